package org.learningjava.brandlens.domain.model;

/**
 * One brand of a single trial after mentioned and supported entries are merged.
 * Every brand in a trial's result set is mentioned, supported, or both.
 */
public record ExtractedBrand(
        String name,
        String normalizedName,
        String domain,          // may be null
        boolean mentioned,
        boolean supported,
        int mentionCount,
        int sourceCount,
        Confidence confidence,
        String evidenceSummary
) {
    public ExtractedBrand {
        if (!mentioned && !supported) {
            throw new IllegalArgumentException("Brand '" + name + "' is neither mentioned nor supported");
        }
    }

    public static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(java.util.Locale.ROOT);
    }
}
