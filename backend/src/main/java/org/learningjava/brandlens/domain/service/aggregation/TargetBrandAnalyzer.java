package org.learningjava.brandlens.domain.service.aggregation;

import org.learningjava.brandlens.domain.model.BrandVisibility;
import org.learningjava.brandlens.domain.model.Confidence;
import org.learningjava.brandlens.domain.model.ConfidenceInterval;
import org.learningjava.brandlens.domain.model.PresenceLevel;
import org.learningjava.brandlens.domain.model.TargetBrand;
import org.learningjava.brandlens.domain.model.TargetBrandResult;
import org.learningjava.brandlens.domain.model.TargetRunResult;
import org.learningjava.brandlens.domain.model.TrialResult;
import org.learningjava.brandlens.domain.model.VisibilityType;
import org.learningjava.brandlens.domain.service.extraction.BrandVisibilityChecker;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class TargetBrandAnalyzer {

    private static final int FEW_RUNS = 5;

    private final BrandVisibilityChecker visibilityChecker;

    public TargetBrandAnalyzer(BrandVisibilityChecker visibilityChecker) {
        this.visibilityChecker = visibilityChecker;
    }

    public TargetBrandResult analyze(TargetBrand target, List<TrialResult> successfulTrials, boolean withStatistics) {
        int totalRuns = successfulTrials.size();
        if (totalRuns == 0) {
            throw new IllegalArgumentException("Target analysis needs at least one successful trial");
        }

        List<TargetRunResult> runs = new ArrayList<>(totalRuns);
        int visible = 0, mentionedRuns = 0, supportedRuns = 0;
        for (TrialResult trial : successfulTrials) {
            BrandVisibility v = visibilityChecker.check(trial.extraction(), target);
            if (v.visible()) {
                visible++;
                if (v.visibilityType() == VisibilityType.MENTIONED) mentionedRuns++;
                else if (v.visibilityType() == VisibilityType.SUPPORTED) supportedRuns++;
            }
            runs.add(new TargetRunResult(trial.index(), v.visible(), v.visibilityType(),
                    v.mentionCount(), v.sourceCount(), v.evidence()));
        }

        double frequency = (double) visible / totalRuns;
        PresenceLevel level = PresenceClassifier.classify(frequency);

        Double pValue = withStatistics ? VarianceStatistics.pValue(visible, totalRuns) : null;
        boolean significant = pValue != null
                ? VarianceStatistics.isSignificant(pValue)
                : frequency >= PresenceClassifier.DEFINITE_PRESENT || frequency == 0;
        ConfidenceInterval ci = withStatistics ? VarianceStatistics.wilsonInterval(visible, totalRuns) : null;

        return new TargetBrandResult(
                target.name(),
                target.domain(),
                frequency,
                level,
                confidenceFor(frequency),
                mentionedRuns,
                supportedRuns,
                totalRuns,
                ci,
                significant,
                pValue,
                runs,
                summary(target.name(), level, frequency, ci, significant, totalRuns));
    }

    /** High at the extremes, medium from one half up, low in between. */
    static Confidence confidenceFor(double frequency) {
        if (frequency >= 0.8 || frequency <= 0.2) return Confidence.HIGH;
        if (frequency >= 0.5) return Confidence.MEDIUM;
        return Confidence.LOW;
    }

    static String summary(String name, PresenceLevel level, double frequency, ConfidenceInterval ci,
                          boolean significant, int totalRuns) {
        long pct = Math.round(frequency * 100);
        String ciSuffix = ci == null ? ""
                : " (95% CI: " + Math.round(ci.lowerBound() * 100) + "-" + Math.round(ci.upperBound() * 100) + "%)";

        String summary = switch (level) {
            case DEFINITE_PRESENT -> name + " is definitively visible (appeared in " + pct + "% of simulations)" + ciSuffix;
            case POSSIBLE_PRESENT -> name + " may be visible (appeared in " + pct + "% of simulations)" + ciSuffix + " - results vary";
            case INCONCLUSIVE -> name + " visibility is inconclusive (appeared in only " + pct + "% of simulations)" + ciSuffix;
            case LIKELY_ABSENT -> name + " is likely not visible (not found in any simulation)";
        };
        if (!significant && totalRuns < FEW_RUNS) {
            summary += " Consider running more simulations for statistical significance.";
        }
        return summary;
    }
}
