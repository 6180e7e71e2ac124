package org.learningjava.brandlens.domain.service.aggregation;

import org.learningjava.brandlens.domain.model.PresenceLevel;

/** Frequency thresholds shared by every brand and by the target analysis. */
public final class PresenceClassifier {

    public static final double DEFINITE_PRESENT = 0.60;
    public static final double POSSIBLE_PRESENT = 0.20;

    private PresenceClassifier() { }

    public static PresenceLevel classify(double frequency) {
        if (frequency >= DEFINITE_PRESENT) return PresenceLevel.DEFINITE_PRESENT;
        if (frequency >= POSSIBLE_PRESENT) return PresenceLevel.POSSIBLE_PRESENT;
        if (frequency > 0) return PresenceLevel.INCONCLUSIVE;
        return PresenceLevel.LIKELY_ABSENT;
    }
}
