package org.learningjava.brandlens.domain.service.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.learningjava.brandlens.domain.model.Confidence;
import org.learningjava.brandlens.domain.model.MentionType;
import org.learningjava.brandlens.domain.model.MentionedBrand;
import org.learningjava.brandlens.domain.model.SupportedBrand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.learningjava.brandlens.domain.service.extraction.ExtractionSchema.MENTIONED_BRANDS;
import static org.learningjava.brandlens.domain.service.extraction.ExtractionSchema.SUPPORTED_BRANDS;
import static org.learningjava.brandlens.domain.service.extraction.ExtractionSchema.UNCERTAINTY_NOTES;

/**
 * Validates raw extraction output against {@link ExtractionSchema}.
 * <p>
 * Structural problems (blank text, invalid JSON, a missing or non-array top-level field) throw
 * {@link MalformedExtractionException}; the caller turns that into an empty extraction.
 * Problems inside a single entry are repaired or the entry is dropped, with a note.
 */
@Component
public class ExtractionResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ExtractionResponseParser.class);

    private static final Pattern CODE_FENCE = Pattern.compile("^```(?:json)?\\s*(.*?)\\s*```$", Pattern.DOTALL);

    public record ParsedExtraction(
            List<MentionedBrand> mentionedBrands,
            List<SupportedBrand> supportedBrands,
            List<String> uncertaintyNotes
    ) { }

    private final ObjectMapper om;

    public ExtractionResponseParser(ObjectMapper om) {
        this.om = om;
    }

    public ParsedExtraction parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedExtractionException("Empty response from brand extractor");
        }

        JsonNode root;
        try {
            root = om.readTree(stripCodeFence(raw.trim()));
        } catch (JsonProcessingException e) {
            throw new MalformedExtractionException("Extraction output is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedExtractionException("Extraction output is not a JSON object");
        }

        JsonNode mentionedNode = requireArray(root, MENTIONED_BRANDS);
        JsonNode supportedNode = requireArray(root, SUPPORTED_BRANDS);
        JsonNode notesNode = requireArray(root, UNCERTAINTY_NOTES);

        List<String> notes = new ArrayList<>(strings(notesNode));

        List<MentionedBrand> mentioned = new ArrayList<>();
        int dropped = 0;
        for (JsonNode n : mentionedNode) {
            String name = text(n, "name");
            if (name == null) { dropped++; continue; }
            mentioned.add(new MentionedBrand(
                    name,
                    text(n, "canonical_domain"),
                    strings(n.path("answer_spans")),
                    strings(n.path("citation_urls")),
                    Confidence.fromId(n.path("confidence").asText(null)),
                    MentionType.fromId(n.path("mention_type").asText(null))
            ));
        }

        List<SupportedBrand> supported = new ArrayList<>();
        for (JsonNode n : supportedNode) {
            String name = text(n, "name");
            if (name == null) { dropped++; continue; }
            supported.add(new SupportedBrand(
                    name,
                    text(n, "canonical_domain"),
                    strings(n.path("source_urls")),
                    Confidence.fromId(n.path("confidence").asText(null))
            ));
        }

        if (dropped > 0) {
            log.debug("Dropped {} extraction entries without a usable name", dropped);
            notes.add("Dropped " + dropped + " extraction entr" + (dropped == 1 ? "y" : "ies") + " without a brand name");
        }
        return new ParsedExtraction(mentioned, supported, notes);
    }

    // ---- helpers ----

    private static JsonNode requireArray(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isArray()) {
            throw new MalformedExtractionException("Extraction output is missing array '" + field + "'");
        }
        return node;
    }

    /** Trimmed text value, or null when missing, non-textual or blank. */
    private static String text(JsonNode entry, String field) {
        if (entry == null || !entry.isObject()) return null;
        JsonNode v = entry.get(field);
        if (v == null || !v.isTextual()) return null;
        String s = v.asText().trim();
        return s.isEmpty() ? null : s;
    }

    private static List<String> strings(JsonNode array) {
        List<String> out = new ArrayList<>();
        if (array == null || !array.isArray()) return out;
        for (JsonNode item : array) {
            if (item.isTextual() && !item.asText().isBlank()) {
                out.add(item.asText());
            }
        }
        return out;
    }

    private static String stripCodeFence(String s) {
        Matcher m = CODE_FENCE.matcher(s);
        return m.matches() ? m.group(1) : s;
    }
}
