package org.learningjava.brandlens.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Language {
    EN("en", "English"),
    AR("ar", "Arabic");

    private final String id;
    private final String displayName;

    Language(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    @JsonValue
    public String id() { return id; }

    public String displayName() { return displayName; }

    @JsonCreator
    public static Language fromId(String raw) {
        if (raw == null || raw.isBlank()) return EN;
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (Language l : values()) {
            if (l.id.equals(key)) return l;
        }
        throw new IllegalArgumentException("Unsupported language: " + raw);
    }
}
