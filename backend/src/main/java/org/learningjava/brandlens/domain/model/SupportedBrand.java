package org.learningjava.brandlens.domain.model;

import java.util.List;

/** A brand backed by the consulted sources, whether or not the answer names it. */
public record SupportedBrand(
        String name,
        String canonicalDomain,     // may be null
        List<String> sourceUrls,
        Confidence confidence
) {
    public SupportedBrand {
        sourceUrls = sourceUrls == null ? List.of() : List.copyOf(sourceUrls);
    }
}
