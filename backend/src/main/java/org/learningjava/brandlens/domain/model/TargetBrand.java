package org.learningjava.brandlens.domain.model;

import java.util.List;

/** The brand being measured. */
public record TargetBrand(
        String name,
        String domain,
        List<String> aliases
) {
    public TargetBrand {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Target brand name must not be blank");
        }
        domain = domain == null ? "" : domain.trim();
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
    }

    public TargetBrand(String name, String domain) {
        this(name, domain, List.of());
    }
}
