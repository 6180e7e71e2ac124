package org.learningjava.brandlens.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Generative engines whose answers can be simulated. */
public enum Engine {
    CHATGPT("chatgpt", "ChatGPT"),
    GEMINI("gemini", "Gemini"),
    GROK("grok", "Grok"),
    PERPLEXITY("perplexity", "Perplexity");

    private final String id;
    private final String label;

    Engine(String id, String label) {
        this.id = id;
        this.label = label;
    }

    @JsonValue
    public String id() { return id; }

    public String label() { return label; }

    @JsonCreator
    public static Engine fromId(String raw) {
        if (raw == null) return null;
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (Engine e : values()) {
            if (e.id.equals(key)) return e;
        }
        throw new IllegalArgumentException("Unsupported engine: " + raw);
    }
}
