package org.learningjava.brandlens.domain.service.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.learningjava.brandlens.domain.model.Confidence;
import org.learningjava.brandlens.domain.model.MentionType;
import org.learningjava.brandlens.domain.service.extraction.ExtractionResponseParser.ParsedExtraction;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ExtractionResponseParserTest {

    private final ExtractionResponseParser parser = new ExtractionResponseParser(new ObjectMapper());

    private static final String VALID = """
            {
              "mentioned_brands": [
                {"name": "Acme", "canonical_domain": "acme.com",
                 "answer_spans": ["Acme is popular", "try Acme"], "citation_urls": ["https://acme.com"],
                 "confidence": "high", "mention_type": "explicit"}
              ],
              "supported_brands": [
                {"name": "Globex", "canonical_domain": null, "source_urls": ["https://globex.com/a"], "confidence": "medium"}
              ],
              "uncertainty_notes": ["Globex only appears in sources"]
            }
            """;

    @Test
    void parsesValidPayload() {
        ParsedExtraction p = parser.parse(VALID);

        assertEquals(1, p.mentionedBrands().size());
        var acme = p.mentionedBrands().get(0);
        assertEquals("Acme", acme.name());
        assertEquals("acme.com", acme.canonicalDomain());
        assertEquals(2, acme.answerSpans().size());
        assertEquals(Confidence.HIGH, acme.confidence());
        assertEquals(MentionType.EXPLICIT, acme.mentionType());

        var globex = p.supportedBrands().get(0);
        assertNull(globex.canonicalDomain());
        assertEquals(Confidence.MEDIUM, globex.confidence());
        assertEquals(List.of("Globex only appears in sources"), p.uncertaintyNotes());
    }

    @Test
    void toleratesMarkdownCodeFence() {
        ParsedExtraction p = parser.parse("```json\n" + VALID + "\n```");

        assertEquals("Acme", p.mentionedBrands().get(0).name());
    }

    @Test
    void blankOutput_isRejected() {
        assertThrows(MalformedExtractionException.class, () -> parser.parse("  "));
        assertThrows(MalformedExtractionException.class, () -> parser.parse(null));
    }

    @Test
    void invalidJson_isRejected() {
        assertThrows(MalformedExtractionException.class, () -> parser.parse("{\"mentioned_brands\": [ "));
    }

    @Test
    void nonObjectRoot_isRejected() {
        assertThrows(MalformedExtractionException.class, () -> parser.parse("[]"));
    }

    @Test
    void missingOrNonArrayTopLevelField_isRejected() {
        MalformedExtractionException missing = assertThrows(MalformedExtractionException.class,
                () -> parser.parse("{\"mentioned_brands\": [], \"uncertainty_notes\": []}"));
        assertThat(missing.getMessage()).contains("supported_brands");

        assertThrows(MalformedExtractionException.class,
                () -> parser.parse("{\"mentioned_brands\": {}, \"supported_brands\": [], \"uncertainty_notes\": []}"));
    }

    @Test
    void entriesWithoutName_areDroppedWithNote() {
        String raw = """
                {"mentioned_brands": [{"name": "  ", "answer_spans": []}, {"name": "Acme"}],
                 "supported_brands": [{"canonical_domain": "x.com"}],
                 "uncertainty_notes": []}
                """;

        ParsedExtraction p = parser.parse(raw);

        assertEquals(1, p.mentionedBrands().size());
        assertTrue(p.supportedBrands().isEmpty());
        assertThat(p.uncertaintyNotes()).anyMatch(n -> n.contains("Dropped 2"));
    }

    @Test
    void unknownEnumsDegrade_andMissingArraysBecomeEmpty() {
        String raw = """
                {"mentioned_brands": [{"name": "Acme", "confidence": "certain", "mention_type": "vibes"}],
                 "supported_brands": [], "uncertainty_notes": []}
                """;

        var acme = parser.parse(raw).mentionedBrands().get(0);

        assertEquals(Confidence.LOW, acme.confidence());
        assertEquals(MentionType.FUZZY, acme.mentionType());
        assertTrue(acme.answerSpans().isEmpty());
        assertTrue(acme.citationUrls().isEmpty());
    }
}
