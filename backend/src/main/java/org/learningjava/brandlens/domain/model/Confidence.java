package org.learningjava.brandlens.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Confidence {
    HIGH("high", 3),
    MEDIUM("medium", 2),
    LOW("low", 1);

    private final String id;
    private final int rank;

    Confidence(String id, int rank) {
        this.id = id;
        this.rank = rank;
    }

    @JsonValue
    public String id() { return id; }

    public int rank() { return rank; }

    /** Lenient lookup used for model output; unknown values read as {@link #LOW}. */
    @JsonCreator
    public static Confidence fromId(String raw) {
        if (raw == null) return LOW;
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (Confidence c : values()) {
            if (c.id.equals(key)) return c;
        }
        return LOW;
    }
}
