package org.learningjava.brandlens.domain.service.aggregation;

import org.learningjava.brandlens.domain.model.ConfidenceInterval;

/**
 * Small-sample statistics over "visible in k of n trials".
 * The p-value is a one-sided exact binomial test against a 5% chance-presence baseline.
 */
public final class VarianceStatistics {

    public static final double DEFAULT_CONFIDENCE_LEVEL = 0.95;
    public static final double NULL_PROBABILITY = 0.05;
    public static final double SIGNIFICANCE_LEVEL = 0.05;

    private VarianceStatistics() { }

    public static ConfidenceInterval wilsonInterval(int successes, int trials) {
        return wilsonInterval(successes, trials, DEFAULT_CONFIDENCE_LEVEL);
    }

    public static ConfidenceInterval wilsonInterval(int successes, int trials, double confidenceLevel) {
        if (trials <= 0) {
            return new ConfidenceInterval(0, 0, 0, confidenceLevel, 0);
        }
        double z = zScore(confidenceLevel);
        double n = trials;
        double p = successes / n;
        double z2 = z * z;

        double denominator = 1 + z2 / n;
        double center = (p + z2 / (2 * n)) / denominator;
        double margin = (z / denominator) * Math.sqrt(p * (1 - p) / n + z2 / (4 * n * n));

        return new ConfidenceInterval(p,
                Math.max(0, center - margin),
                Math.min(1, center + margin),
                confidenceLevel, trials);
    }

    /** P(X >= successes) for X ~ Binomial(trials, {@link #NULL_PROBABILITY}). */
    public static double pValue(int successes, int trials) {
        return pValue(successes, trials, NULL_PROBABILITY);
    }

    public static double pValue(int successes, int trials, double nullProbability) {
        double sum = 0;
        for (int k = Math.max(0, successes); k <= trials; k++) {
            sum += binomialCoefficient(trials, k)
                    * Math.pow(nullProbability, k)
                    * Math.pow(1 - nullProbability, trials - k);
        }
        return Math.min(1, sum);
    }

    public static boolean isSignificant(double pValue) {
        return pValue < SIGNIFICANCE_LEVEL;
    }

    public static double standardError(double frequency, int trials) {
        return trials <= 0 ? 0 : Math.sqrt(frequency * (1 - frequency) / trials);
    }

    static double binomialCoefficient(int n, int k) {
        if (k < 0 || k > n) return 0;
        if (k == 0 || k == n) return 1;
        double result = 1;
        for (int i = 1; i <= k; i++) {
            result = result * (n - i + 1) / i;
        }
        return result;
    }

    private static double zScore(double confidenceLevel) {
        if (Math.abs(confidenceLevel - 0.90) < 1e-9) return 1.645;
        if (Math.abs(confidenceLevel - 0.99) < 1e-9) return 2.576;
        return 1.96;
    }
}
