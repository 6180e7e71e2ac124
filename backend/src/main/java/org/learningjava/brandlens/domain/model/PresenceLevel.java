package org.learningjava.brandlens.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** How often a brand shows up across the trials of one ensemble. */
public enum PresenceLevel {
    DEFINITE_PRESENT("definite_present"),   // >= 60% of trials
    POSSIBLE_PRESENT("possible_present"),   // 20-59%
    INCONCLUSIVE("inconclusive"),           // above 0, below 20%
    LIKELY_ABSENT("likely_absent");         // 0%

    private final String id;

    PresenceLevel(String id) { this.id = id; }

    @JsonValue
    public String id() { return id; }
}
