package org.learningjava.brandlens.domain.model;

/**
 * Caller input for one ensemble. {@code runCount} may be null (configured default) and is
 * clamped to the configured range before use.
 */
public record EnsembleRequest(
        Engine engine,
        String query,
        Language language,
        Region region,
        TargetBrand targetBrand,
        Integer runCount,
        boolean enableVarianceMetrics
) {
    public EnsembleRequest {
        language = language == null ? Language.EN : language;
        region = region == null ? Region.GLOBAL : region;
    }
}
