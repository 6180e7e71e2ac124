package org.learningjava.brandlens.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record SourceAnalysis(
        int totalSources,
        List<String> uniqueDomains,
        Map<String, List<String>> brandSourceMap   // domain -> urls
) {
    public SourceAnalysis {
        uniqueDomains = uniqueDomains == null ? List.of() : List.copyOf(uniqueDomains);
        brandSourceMap = brandSourceMap == null ? Map.of() : copyOf(brandSourceMap);
    }

    // insertion order is the candidate order shown to the extractor
    private static Map<String, List<String>> copyOf(Map<String, List<String>> map) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        map.forEach((domain, urls) -> copy.put(domain, urls == null ? List.of() : List.copyOf(urls)));
        return Collections.unmodifiableMap(copy);
    }

    public static SourceAnalysis none() {
        return new SourceAnalysis(0, List.of(), Map.of());
    }
}
