package org.learningjava.brandlens.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum MentionType {
    EXPLICIT("explicit"),   // exact name
    PARTIAL("partial"),     // shortened or abbreviated
    FUZZY("fuzzy");         // implied

    private final String id;

    MentionType(String id) { this.id = id; }

    @JsonValue
    public String id() { return id; }

    @JsonCreator
    public static MentionType fromId(String raw) {
        if (raw == null) return FUZZY;
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (MentionType t : values()) {
            if (t.id.equals(key)) return t;
        }
        return FUZZY;
    }
}
