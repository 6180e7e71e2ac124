package org.learningjava.brandlens.domain.model;

import java.util.List;

/** Cross-trial view of one brand. {@code frequency == appearanceCount / totalRuns}. */
public record EnsembleBrandResult(
        String name,
        String normalizedName,
        String domain,
        double frequency,
        int appearanceCount,
        int totalRuns,
        PresenceLevel presenceLevel,
        double mentionFrequency,
        double sourceFrequency,
        String evidenceSummary,
        ConfidenceInterval confidenceInterval,  // only with variance metrics
        List<RunDetail> runDetails
) {
    public EnsembleBrandResult {
        runDetails = runDetails == null ? List.of() : List.copyOf(runDetails);
    }
}
