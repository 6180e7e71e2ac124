package org.learningjava.brandlens.infrastructure.adapter.out.openrouter;

import com.fasterxml.jackson.databind.JsonNode;
import org.learningjava.brandlens.application.port.ChatLLMPort.Usage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Process-wide OpenRouter handle shared by the chat and simulator adapters: one RestTemplate,
 * one resolved API key, the attribution headers OpenRouter expects.
 */
@Component
public class OpenRouterClient {

    private static final Logger log = LoggerFactory.getLogger(OpenRouterClient.class);

    private final RestTemplate rest;
    private final String apiKey;
    private final String baseUrl;
    private final String referer;
    private final String title;

    @Autowired
    public OpenRouterClient(
            @Value("${OPENROUTER_API_KEY:}") String envKey,
            @Value("${OPENROUTER_API_KEY_FILE:/run/secrets/openrouter_api_key}") String apiKeyFilePath,
            @Value("${llm.openrouter.base-url:https://openrouter.ai/api/v1}") String baseUrl,
            @Value("${llm.openrouter.referer:http://localhost}") String referer,
            @Value("${llm.openrouter.title:brandlens}") String title,
            @Value("${llm.openrouter.timeout.ms:60000}") int timeoutMs
    ) {
        this(buildRestTemplate(timeoutMs), resolveApiKey(envKey, apiKeyFilePath), baseUrl, referer, title);
    }

    public OpenRouterClient(RestTemplate rest, String apiKey, String baseUrl, String referer, String title) {
        this.rest = rest;
        this.apiKey = apiKey;
        this.baseUrl = trimTrailingSlash(baseUrl);
        this.referer = referer;
        this.title = title;
        log.debug("OpenRouterClient init: baseUrl={}, referer={}, title={}", this.baseUrl, this.referer, this.title);
    }

    /**
     * POSTs to {@code /chat/completions} and returns the decoded body.
     *
     * @throws IllegalStateException on missing key, HTTP error status or connection failure
     */
    public JsonNode chatCompletion(Map<String, Object> body, String model) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("OpenRouter API key not configured. Set OPENROUTER_API_KEY or mount OPENROUTER_API_KEY_FILE.");
        }
        final String url = baseUrl + "/chat/completions";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(apiKey);
        headers.set("HTTP-Referer", referer);
        headers.set("X-Title", title);

        try {
            ResponseEntity<JsonNode> response = rest.postForEntity(url, new HttpEntity<>(body, headers), JsonNode.class);
            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new IllegalStateException("OpenRouter call failed: status=" + response.getStatusCode().value()
                        + " body=" + response.getBody());
            }
            return response.getBody();
        } catch (HttpStatusCodeException ex) {
            HttpStatusCode status = ex.getStatusCode();
            log.error("OpenRouter HTTP {} {} for model='{}'\nResponse body: {}\nHeaders set: Authorization(Bearer ****), HTTP-Referer={}, X-Title={}",
                    status.value(), ex.getStatusText(), model, ex.getResponseBodyAsString(), referer, title);
            if (status.value() == HttpStatus.UNAUTHORIZED.value()) {
                throw new IllegalStateException("OpenRouter 401 Unauthorized. Check API key, required headers, and model access.", ex);
            }
            throw new IllegalStateException("OpenRouter error: " + status.value() + " " + ex.getStatusText() + " (model=" + model + ")", ex);
        } catch (ResourceAccessException io) {
            log.error("OpenRouter connection error to {}: {}", url, io.toString());
            throw new IllegalStateException("Cannot reach OpenRouter (" + baseUrl + "). Check network / URL / timeouts.", io);
        }
    }

    // ---- response helpers ----

    /** {@code choices[0].message}, or a missing node. */
    static JsonNode firstMessage(JsonNode body) {
        return body.path("choices").path(0).path("message");
    }

    static String content(JsonNode body) {
        JsonNode c = firstMessage(body).path("content");
        return c.isTextual() ? c.asText() : "";
    }

    static Usage usage(JsonNode body) {
        JsonNode u = body.path("usage");
        Integer pt = u.path("prompt_tokens").canConvertToInt() ? u.get("prompt_tokens").asInt() : null;
        Integer ct = u.path("completion_tokens").canConvertToInt() ? u.get("completion_tokens").asInt() : null;
        return pt != null || ct != null ? new Usage(pt, ct) : null;
    }

    // ---- construction helpers ----

    private static RestTemplate buildRestTemplate(int timeoutMs) {
        SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
        f.setConnectTimeout(timeoutMs);
        f.setReadTimeout(timeoutMs);
        return new RestTemplate(f);
    }

    private static String trimTrailingSlash(String s) {
        if (s == null) return "";
        return s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
    }

    private static String resolveApiKey(String envKey, String filePath) {
        String key = envKey == null ? "" : envKey.trim();
        if (!key.isBlank()) return key;
        if (filePath == null || filePath.isBlank()) return "";
        try {
            Path path = Path.of(filePath);
            if (Files.exists(path)) {
                return Files.readString(path, StandardCharsets.UTF_8).trim();
            }
        } catch (IOException e) {
            log.warn("Could not read OpenRouter key file {}: {}", filePath, e.toString());
        }
        return "";
    }
}
