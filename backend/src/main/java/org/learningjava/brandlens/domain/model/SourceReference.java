package org.learningjava.brandlens.domain.model;

public record SourceReference(
        String url,
        String title,   // may be null
        String snippet  // may be null
) {
    public SourceReference(String url) {
        this(url, null, null);
    }
}
