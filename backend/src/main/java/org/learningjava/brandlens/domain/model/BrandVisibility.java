package org.learningjava.brandlens.domain.model;

import java.util.List;

/** Whether the target brand is visible in one trial, and why. */
public record BrandVisibility(
        boolean visible,
        VisibilityType visibilityType,
        Confidence confidence,
        int mentionCount,
        int sourceCount,
        List<String> evidence
) {
    public BrandVisibility {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
