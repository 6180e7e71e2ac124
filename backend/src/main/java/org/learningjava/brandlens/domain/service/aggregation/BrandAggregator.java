package org.learningjava.brandlens.domain.service.aggregation;

import org.learningjava.brandlens.domain.model.BrandExtractionResult;
import org.learningjava.brandlens.domain.model.EnsembleBrandResult;
import org.learningjava.brandlens.domain.model.ExtractedBrand;
import org.learningjava.brandlens.domain.model.RunDetail;
import org.learningjava.brandlens.domain.model.TrialResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Cross-trial brand frequencies. Only successful trials may be passed in; their count is
 * the denominator of every frequency.
 */
@Component
public class BrandAggregator {

    public List<EnsembleBrandResult> aggregateBrandsAcrossRuns(List<TrialResult> successfulTrials, boolean withIntervals) {
        int totalRuns = successfulTrials.size();
        if (totalRuns == 0) return List.of();

        Map<String, Tally> byName = new HashMap<>();
        for (TrialResult trial : successfulTrials) {
            for (ExtractedBrand brand : trial.extraction().allBrands()) {
                Tally t = byName.computeIfAbsent(brand.normalizedName(), k -> new Tally());
                t.observe(trial.index(), brand.name(), brand.domain());
                t.appearances++;
                if (brand.mentioned()) t.mentionAppearances++;
                if (brand.supported()) t.sourceAppearances++;
                t.totalMentions += brand.mentionCount();
                t.totalSources += brand.sourceCount();
                t.runDetails.add(new RunDetail(trial.index(), brand.mentioned(), brand.supported(),
                        brand.mentionCount(), brand.sourceCount()));
            }
        }

        List<EnsembleBrandResult> results = new ArrayList<>(byName.size());
        byName.forEach((normalizedName, t) -> {
            double frequency = (double) t.appearances / totalRuns;
            t.runDetails.sort(Comparator.comparingInt(RunDetail::runIndex));
            results.add(new EnsembleBrandResult(
                    t.name,
                    normalizedName,
                    t.domain,
                    frequency,
                    t.appearances,
                    totalRuns,
                    PresenceClassifier.classify(frequency),
                    (double) t.mentionAppearances / totalRuns,
                    (double) t.sourceAppearances / totalRuns,
                    "Appeared in " + t.appearances + "/" + totalRuns + " runs ("
                            + t.totalMentions + " mentions, " + t.totalSources + " sources)",
                    withIntervals ? VarianceStatistics.wilsonInterval(t.appearances, totalRuns) : null,
                    t.runDetails));
        });

        // ties by name keep the order independent of trial order
        results.sort(Comparator.comparingDouble(EnsembleBrandResult::frequency).reversed()
                .thenComparing(EnsembleBrandResult::normalizedName));
        return results;
    }

    /** Coefficient of variation of the per-trial brand counts; 0 with fewer than two trials. */
    public double calculateBrandVariance(List<BrandExtractionResult> extractions) {
        if (extractions.size() < 2) return 0;

        double mean = extractions.stream().mapToInt(BrandExtractionResult::brandCount).average().orElse(0);
        if (mean <= 0) return 0;
        double variance = extractions.stream()
                .mapToDouble(e -> Math.pow(e.brandCount() - mean, 2))
                .sum() / extractions.size();
        return Math.sqrt(variance) / mean;
    }

    /** Display name and domain are taken from the earliest trial that has them. */
    private static final class Tally {
        String name;
        int nameRun = Integer.MAX_VALUE;
        String domain;
        int domainRun = Integer.MAX_VALUE;
        int appearances;
        int mentionAppearances;
        int sourceAppearances;
        int totalMentions;
        int totalSources;
        final List<RunDetail> runDetails = new ArrayList<>();

        void observe(int runIndex, String brandName, String brandDomain) {
            if (runIndex < nameRun) {
                name = brandName;
                nameRun = runIndex;
            }
            if (brandDomain != null && runIndex < domainRun) {
                domain = brandDomain;
                domainRun = runIndex;
            }
        }
    }
}
