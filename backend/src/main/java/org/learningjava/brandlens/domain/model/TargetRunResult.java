package org.learningjava.brandlens.domain.model;

import java.util.List;

public record TargetRunResult(
        int runIndex,
        boolean visible,
        VisibilityType visibilityType,
        int mentionCount,
        int sourceCount,
        List<String> evidence
) {
    public TargetRunResult {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
