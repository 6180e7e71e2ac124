package org.learningjava.brandlens.domain.model;

public record RunDetail(
        int runIndex,
        boolean mentioned,
        boolean supported,
        int mentionCount,
        int sourceCount
) { }
