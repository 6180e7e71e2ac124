package org.learningjava.brandlens.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VisibilityType {
    MENTIONED("mentioned"),
    SUPPORTED("supported"),
    ABSENT("absent");

    private final String id;

    VisibilityType(String id) { this.id = id; }

    @JsonValue
    public String id() { return id; }
}
