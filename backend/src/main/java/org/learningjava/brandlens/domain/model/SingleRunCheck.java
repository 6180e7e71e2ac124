package org.learningjava.brandlens.domain.model;

import java.util.List;

/** Result of the one-call quick check: no extraction pass, frequency is either 0 or 1. */
public record SingleRunCheck(
        SimulationOutput simulation,
        QuickVisibility targetVisibility   // null when no target was given
) {
    public record QuickVisibility(boolean visible, Confidence confidence, List<String> evidence) {
        public QuickVisibility {
            evidence = evidence == null ? List.of() : List.copyOf(evidence);
        }
    }
}
