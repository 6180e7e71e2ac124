package org.learningjava.brandlens.domain.service.aggregation;

import org.learningjava.brandlens.domain.model.EnsembleBrandResult;
import org.learningjava.brandlens.domain.model.TargetBrand;
import org.learningjava.brandlens.domain.model.TrialResult;
import org.learningjava.brandlens.domain.service.extraction.BrandVisibilityChecker;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Picks the trial shown to users: brand count closest to the median, and, when the target is
 * usually present, one where it is actually visible.
 */
@Component
public class RepresentativeRunSelector {

    static final double TARGET_USUALLY_PRESENT = 0.5;
    static final int MISSING_TARGET_PENALTY = 10;

    private final BrandVisibilityChecker visibilityChecker;

    public RepresentativeRunSelector(BrandVisibilityChecker visibilityChecker) {
        this.visibilityChecker = visibilityChecker;
    }

    /** @return the {@link TrialResult#index()} of the chosen trial; 0 when there is none */
    public int select(List<TrialResult> successfulTrials, List<EnsembleBrandResult> allBrands, TargetBrand target) {
        if (successfulTrials.isEmpty()) return 0;
        if (successfulTrials.size() == 1) return successfulTrials.get(0).index();

        int[] counts = successfulTrials.stream().mapToInt(TrialResult::brandCount).sorted().toArray();
        int median = counts[counts.length / 2];

        boolean penalizeMissingTarget = target != null && targetFrequency(allBrands, target) >= TARGET_USUALLY_PRESENT;

        TrialResult best = null;
        int bestScore = Integer.MAX_VALUE;
        for (TrialResult trial : successfulTrials) {
            int score = Math.abs(trial.brandCount() - median);
            if (penalizeMissingTarget && !visibilityChecker.check(trial.extraction(), target).visible()) {
                score += MISSING_TARGET_PENALTY;
            }
            if (score < bestScore) {
                bestScore = score;
                best = trial;
            }
        }
        return best.index();
    }

    private double targetFrequency(List<EnsembleBrandResult> allBrands, TargetBrand target) {
        return allBrands.stream()
                .filter(b -> visibilityChecker.matches(b.normalizedName(), b.domain(), target))
                .mapToDouble(EnsembleBrandResult::frequency)
                .findFirst()
                .orElse(0);
    }
}
