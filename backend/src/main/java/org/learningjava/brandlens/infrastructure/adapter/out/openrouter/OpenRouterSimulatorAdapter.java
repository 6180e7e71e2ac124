package org.learningjava.brandlens.infrastructure.adapter.out.openrouter;

import com.fasterxml.jackson.databind.JsonNode;
import org.learningjava.brandlens.application.port.SimulatorPort;
import org.learningjava.brandlens.config.SimulatorProperties;
import org.learningjava.brandlens.domain.exception.SimulationException;
import org.learningjava.brandlens.domain.model.Engine;
import org.learningjava.brandlens.domain.model.Language;
import org.learningjava.brandlens.domain.model.Region;
import org.learningjava.brandlens.domain.model.SimulationOutput;
import org.learningjava.brandlens.domain.model.SourceReference;
import org.learningjava.brandlens.domain.service.domain.DomainNormalizer;
import org.learningjava.brandlens.domain.service.domain.DomainNormalizer.MarkdownLink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Simulates an answer engine through a web-search capable OpenRouter model.
 * Sources are the model's {@code url_citation} annotations followed by any links in the answer.
 */
@Component
public class OpenRouterSimulatorAdapter implements SimulatorPort {

    private static final Logger log = LoggerFactory.getLogger(OpenRouterSimulatorAdapter.class);

    private final OpenRouterClient client;
    private final SimulatorProperties props;

    public OpenRouterSimulatorAdapter(OpenRouterClient client, SimulatorProperties props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public SimulationOutput simulate(Engine engine, String query, Language language, Region region) {
        String model = props.getModels().get(engine.id());
        if (model == null || model.isBlank()) {
            throw new SimulationException(engine, "No simulator model configured for engine '" + engine.id() + "'");
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("temperature", props.getTemperature());
        body.put("messages", List.of(
                Map.of("role", "system", "content", systemPrompt(engine, language)),
                Map.of("role", "user", "content", userPrompt(query, region))));

        JsonNode response;
        try {
            response = client.chatCompletion(body, model);
        } catch (IllegalStateException e) {
            throw new SimulationException(engine, engine.label() + " simulation failed: " + e.getMessage(), e);
        }

        String answer = OpenRouterClient.content(response);
        if (answer.isBlank()) {
            throw new SimulationException(engine, engine.label() + " returned an empty answer (model=" + model + ")");
        }
        List<SourceReference> sources = collectSources(OpenRouterClient.firstMessage(response), answer);
        log.debug("Simulated {} answer: {} chars, {} sources", engine.id(), answer.length(), sources.size());
        return new SimulationOutput(answer, sources);
    }

    static String systemPrompt(Engine engine, Language language) {
        return """
            You are %s answering a real user's question with live web search.
            Answer the way %s would: recommend specific brands, products or companies where relevant.
            Cite the web pages you used as markdown links.
            Respond in %s.
            """.formatted(engine.label(), engine.label(), language.displayName());
    }

    static String userPrompt(String query, Region region) {
        String hint = region.searchHint();
        return hint == null || hint.isBlank() ? query.trim() : query.trim() + " " + hint;
    }

    /** Citations first, then markdown links and bare URLs of the answer; deduplicated by canonical URL. */
    static List<SourceReference> collectSources(JsonNode message, String answer) {
        Map<String, SourceReference> byCanonical = new LinkedHashMap<>();

        for (JsonNode ann : message.path("annotations")) {
            JsonNode cite = ann.path("url_citation");
            if ("url_citation".equals(ann.path("type").asText()) && cite.path("url").isTextual()) {
                add(byCanonical, new SourceReference(cite.get("url").asText(),
                        asText(cite.path("title")), asText(cite.path("content"))));
            }
        }
        for (MarkdownLink link : DomainNormalizer.extractMarkdownLinks(answer)) {
            add(byCanonical, new SourceReference(link.url(), link.text(), null));
        }
        for (String url : DomainNormalizer.extractUrlsFromText(answer)) {
            add(byCanonical, new SourceReference(url));
        }
        return new ArrayList<>(byCanonical.values());
    }

    private static void add(Map<String, SourceReference> byCanonical, SourceReference s) {
        byCanonical.putIfAbsent(DomainNormalizer.canonicalizeUrl(s.url()), s);
    }

    private static String asText(JsonNode n) {
        return n.isTextual() && !n.asText().isBlank() ? n.asText() : null;
    }
}
