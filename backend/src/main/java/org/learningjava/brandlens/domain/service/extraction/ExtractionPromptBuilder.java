package org.learningjava.brandlens.domain.service.extraction;

import org.learningjava.brandlens.config.ExtractionProperties;
import org.learningjava.brandlens.domain.model.SourceReference;
import org.learningjava.brandlens.domain.service.domain.DomainNormalizer;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

@Component
public class ExtractionPromptBuilder {

    private final int maxSourcesInPrompt;

    public ExtractionPromptBuilder(ExtractionProperties props) {
        this.maxSourcesInPrompt = props.getMaxSourcesInPrompt();
    }

    public String buildSystemPrompt(List<String> candidateLines) {
        String candidates = candidateLines.isEmpty() ? "(none)" : String.join("\n", candidateLines);
        return """
            You are a brand/company extraction specialist. Your job is to identify ALL brands and companies mentioned or implied in AI responses.

            CRITICAL: Err on the side of OVER-DETECTION. A missed brand is worse than a false positive.

            Your task:
            1. Extract brands MENTIONED in the answer text (even partial/abbreviated references)
            2. Extract brands SUPPORTED by the sources (brands whose websites appear in sources)
            3. Note any ambiguities or uncertainties

            Brand candidate domains found in sources:
            %s

            RULES:
            - Include the target brand if it's mentioned AT ALL, even vaguely
            - Include brands that are implied but not explicitly named
            - Include brands whose official websites appear in sources, even if not mentioned in text
            - DO NOT include generic marketplaces (Amazon, eBay, etc.) as brands
            - DO NOT include review sites (G2, Trustpilot, etc.) as brands
            - DO include the actual companies/products being reviewed on those sites
            """.formatted(candidates);
    }

    public String buildUserPrompt(String engineId, String answerText, List<SourceReference> sources) {
        return """
            Extract all brands from this %s AI response:

            === AI ANSWER ===
            %s

            === SOURCES CONSULTED ===
            %s

            Extract:
            1. mentioned_brands: Brands in the answer text
            2. supported_brands: Brands implied by sources but not mentioned
            3. uncertainty_notes: Any ambiguities
            """.formatted(engineId, answerText, summarizeSources(sources));
    }

    String summarizeSources(List<SourceReference> sources) {
        int limit = Math.min(sources.size(), Math.max(0, maxSourcesInPrompt));
        return IntStream.range(0, limit)
                .mapToObj(i -> {
                    SourceReference s = sources.get(i);
                    String label = s.title() == null || s.title().isBlank() ? s.url() : s.title();
                    return "[" + (i + 1) + "] " + DomainNormalizer.stripWww(s.url()) + ": " + label;
                })
                .collect(Collectors.joining("\n"));
    }
}
