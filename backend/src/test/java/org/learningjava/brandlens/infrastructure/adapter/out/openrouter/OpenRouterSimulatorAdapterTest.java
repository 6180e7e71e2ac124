package org.learningjava.brandlens.infrastructure.adapter.out.openrouter;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.brandlens.config.SimulatorProperties;
import org.learningjava.brandlens.domain.exception.SimulationException;
import org.learningjava.brandlens.domain.model.Engine;
import org.learningjava.brandlens.domain.model.Language;
import org.learningjava.brandlens.domain.model.Region;
import org.learningjava.brandlens.domain.model.SimulationOutput;
import org.learningjava.brandlens.domain.model.SourceReference;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenRouterSimulatorAdapterTest {

    private static final String URL = "https://openrouter.test/api/v1/chat/completions";

    private MockRestServiceServer server;
    private SimulatorProperties props;
    private OpenRouterSimulatorAdapter adapter;

    @BeforeEach
    void setUp() {
        RestTemplate rest = new RestTemplate();
        server = MockRestServiceServer.bindTo(rest).build();
        props = new SimulatorProperties();
        adapter = new OpenRouterSimulatorAdapter(
                new OpenRouterClient(rest, "key", "https://openrouter.test/api/v1/", "http://localhost", "brandlens"), props);
    }

    @Test
    void simulate_sendsSearchModelAndRegionHint_andCollectsCitationsThenLinks() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer key"))
                .andExpect(header("X-Title", "brandlens"))
                .andExpect(jsonPath("$.model").value("openai/gpt-4o-mini:online"))
                .andExpect(jsonPath("$.temperature").value(0.7))
                .andExpect(jsonPath("$.messages[1].content").value("best crm in the United States"))
                .andRespond(withSuccess("""
                        {"choices": [{"message": {
                            "content": "Try [Acme](https://www.acme.com/?utm_source=openai) or https://globex.com/crm.",
                            "annotations": [
                              {"type": "url_citation", "url_citation": {"url": "https://www.acme.com/", "title": "Acme CRM", "content": "snippet"}},
                              {"type": "file", "file": {}}
                            ]}}],
                         "usage": {"prompt_tokens": 10, "completion_tokens": 20}}
                        """, MediaType.APPLICATION_JSON));

        SimulationOutput out = adapter.simulate(Engine.CHATGPT, "  best crm ", Language.EN, Region.US);

        server.verify();
        assertThat(out.answerText()).startsWith("Try [Acme]");
        assertEquals(List.of("https://www.acme.com/", "https://globex.com/crm"),
                out.sources().stream().map(SourceReference::url).toList());
        assertEquals("Acme CRM", out.sources().get(0).title());
        assertEquals("snippet", out.sources().get(0).snippet());
    }

    @Test
    void simulate_httpError_becomesSimulationException() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        SimulationException ex = assertThrows(SimulationException.class,
                () -> adapter.simulate(Engine.GEMINI, "q", Language.EN, Region.GLOBAL));

        assertEquals(Engine.GEMINI, ex.getEngine());
        assertThat(ex.getMessage()).contains("Gemini simulation failed").contains("429");
    }

    @Test
    void simulate_emptyAnswer_isAFailure() {
        server.expect(requestTo(URL)).andRespond(withSuccess(
                "{\"choices\": [{\"message\": {\"content\": \"  \"}}]}", MediaType.APPLICATION_JSON));

        assertThrows(SimulationException.class, () -> adapter.simulate(Engine.GROK, "q", Language.EN, Region.GLOBAL));
    }

    @Test
    void simulate_unconfiguredEngine_failsWithoutCallingUpstream() {
        props.setModels(Map.of("chatgpt", "openai/gpt-4o-mini:online"));

        assertThrows(SimulationException.class, () -> adapter.simulate(Engine.PERPLEXITY, "q", Language.EN, Region.GLOBAL));
        server.verify();
    }

    @Test
    void prompts() {
        assertEquals("crm", OpenRouterSimulatorAdapter.userPrompt("crm", Region.GLOBAL));
        assertThat(OpenRouterSimulatorAdapter.systemPrompt(Engine.PERPLEXITY, Language.AR))
                .contains("You are Perplexity").contains("Respond in Arabic");
    }

    @Test
    void missingApiKey_isReportedAsSimulationFailure() {
        OpenRouterSimulatorAdapter noKey = new OpenRouterSimulatorAdapter(
                new OpenRouterClient(new RestTemplate(), "", "https://openrouter.test/api/v1", "r", "t"), props);

        SimulationException ex = assertThrows(SimulationException.class,
                () -> noKey.simulate(Engine.CHATGPT, "q", Language.EN, Region.GLOBAL));
        assertThat(ex.getMessage()).contains("API key not configured");
    }
}
