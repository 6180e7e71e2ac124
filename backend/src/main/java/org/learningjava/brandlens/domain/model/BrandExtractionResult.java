package org.learningjava.brandlens.domain.model;

import java.util.List;

public record BrandExtractionResult(
        List<MentionedBrand> mentionedBrands,
        List<SupportedBrand> supportedBrands,
        List<String> uncertaintyNotes,
        List<ExtractedBrand> allBrands,
        SourceAnalysis sourceAnalysis
) {
    public BrandExtractionResult {
        mentionedBrands = mentionedBrands == null ? List.of() : List.copyOf(mentionedBrands);
        supportedBrands = supportedBrands == null ? List.of() : List.copyOf(supportedBrands);
        uncertaintyNotes = uncertaintyNotes == null ? List.of() : List.copyOf(uncertaintyNotes);
        allBrands = allBrands == null ? List.of() : List.copyOf(allBrands);
        sourceAnalysis = sourceAnalysis == null ? SourceAnalysis.none() : sourceAnalysis;
    }

    /** No brands detected. Used whenever the extraction output cannot be trusted. */
    public static BrandExtractionResult empty(String note, SourceAnalysis sourceAnalysis) {
        return new BrandExtractionResult(List.of(), List.of(), List.of(note), List.of(), sourceAnalysis);
    }

    public int brandCount() {
        return allBrands.size();
    }
}
