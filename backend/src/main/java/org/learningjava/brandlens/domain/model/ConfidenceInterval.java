package org.learningjava.brandlens.domain.model;

public record ConfidenceInterval(
        double frequency,
        double lowerBound,
        double upperBound,
        double confidenceLevel,
        int sampleSize
) { }
