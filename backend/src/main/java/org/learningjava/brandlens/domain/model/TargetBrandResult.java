package org.learningjava.brandlens.domain.model;

import java.util.List;

public record TargetBrandResult(
        String name,
        String domain,
        double visibilityFrequency,
        PresenceLevel presenceLevel,
        Confidence confidence,
        int mentionedInRuns,
        int supportedInRuns,
        int totalRuns,
        ConfidenceInterval confidenceInterval,  // null unless statistics were requested
        boolean statisticallySignificant,
        Double pValue,                          // null unless statistics were requested
        List<TargetRunResult> runResults,
        String summary
) {
    public TargetBrandResult {
        runResults = runResults == null ? List.of() : List.copyOf(runResults);
    }

    public int visibleInRuns() {
        return (int) runResults.stream().filter(TargetRunResult::visible).count();
    }
}
