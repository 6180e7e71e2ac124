package org.learningjava.brandlens.domain.service.extraction;

import java.util.List;
import java.util.Map;

/** JSON schema the extraction backend must answer with. Field names are part of the wire contract. */
public final class ExtractionSchema {

    public static final String NAME = "brand_extraction";

    public static final String MENTIONED_BRANDS = "mentioned_brands";
    public static final String SUPPORTED_BRANDS = "supported_brands";
    public static final String UNCERTAINTY_NOTES = "uncertainty_notes";

    private static final List<String> CONFIDENCE_VALUES = List.of("high", "medium", "low");

    private ExtractionSchema() { }

    public static Map<String, Object> schema() {
        Map<String, Object> mentioned = Map.of(
                "type", "object",
                "properties", Map.of(
                        "name", Map.of("type", "string",
                                "description", "Brand name as mentioned (e.g., 'Apple', 'DAMAC Properties')"),
                        "canonical_domain", Map.of("type", List.of("string", "null"),
                                "description", "The brand's main website domain if known (e.g., 'apple.com')"),
                        "answer_spans", stringArray("Exact text snippets from the answer where this brand appears"),
                        "citation_urls", stringArray("URLs from citations that reference this brand"),
                        "confidence", Map.of("type", "string", "enum", CONFIDENCE_VALUES,
                                "description", "How confident we are this brand is correctly identified"),
                        "mention_type", Map.of("type", "string", "enum", List.of("explicit", "partial", "fuzzy"),
                                "description", "explicit=exact name match, partial=shortened/abbreviated, fuzzy=implied")
                ),
                "required", List.of("name", "canonical_domain", "answer_spans", "citation_urls", "confidence", "mention_type"),
                "additionalProperties", false
        );

        Map<String, Object> supported = Map.of(
                "type", "object",
                "properties", Map.of(
                        "name", Map.of("type", "string", "description", "Brand name inferred from sources"),
                        "canonical_domain", Map.of("type", List.of("string", "null"),
                                "description", "The brand's main website domain"),
                        "source_urls", stringArray("URLs from sources that support this brand"),
                        "confidence", Map.of("type", "string", "enum", CONFIDENCE_VALUES)
                ),
                "required", List.of("name", "canonical_domain", "source_urls", "confidence"),
                "additionalProperties", false
        );

        return Map.of(
                "type", "object",
                "properties", Map.of(
                        MENTIONED_BRANDS, Map.of("type", "array",
                                "description", "Brands explicitly mentioned or strongly implied in the answer text",
                                "items", mentioned),
                        SUPPORTED_BRANDS, Map.of("type", "array",
                                "description", "Brands implied by sources even if not explicitly mentioned in the answer",
                                "items", supported),
                        UNCERTAINTY_NOTES, stringArray("Any ambiguities or uncertainties in brand identification")
                ),
                "required", List.of(MENTIONED_BRANDS, SUPPORTED_BRANDS, UNCERTAINTY_NOTES),
                "additionalProperties", false
        );
    }

    private static Map<String, Object> stringArray(String description) {
        return Map.of("type", "array", "items", Map.of("type", "string"), "description", description);
    }
}
