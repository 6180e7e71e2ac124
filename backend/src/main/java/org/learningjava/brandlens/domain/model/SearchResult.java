package org.learningjava.brandlens.domain.model;

public record SearchResult(
        String url,
        String title,
        String snippet
) { }
