package org.learningjava.brandlens.domain.model;

public record VarianceMetrics(
        int runCount,
        int successfulRuns,
        double brandVariance,
        ConfidenceInterval confidenceInterval,
        boolean statisticallySignificant,
        Double pValue,
        Double standardError
) { }
