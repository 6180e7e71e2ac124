package org.learningjava.brandlens.infrastructure.adapter.out.ollama;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.learningjava.brandlens.application.port.ChatLLMPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Local extraction backend. Structured output uses Ollama's {@code format} field with the JSON schema. */
@Component
public class OllamaChatAdapter implements ChatLLMPort {

    private static final Logger log = LoggerFactory.getLogger(OllamaChatAdapter.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient http;
    private final ObjectMapper om = new ObjectMapper();
    private final String baseUrl;

    private static OkHttpClient defaultClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(10))
                .writeTimeout(Duration.ofSeconds(60))
                .readTimeout(Duration.ofMinutes(3))      // extraction over long answers can take a while
                .retryOnConnectionFailure(true)
                .build();
    }

    @Autowired
    public OllamaChatAdapter(@Value("${brandlens.ollama.url:http://localhost:11434}") String baseUrl) {
        this(baseUrl, defaultClient());
    }

    public OllamaChatAdapter(String baseUrl, OkHttpClient http) {
        this.http = http;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    @Override
    public String provider() { return "ollama"; }

    @Override
    public ChatResult complete(ChatPrompt prompt, String model) {
        try {
            return doChat(model, prompt);
        } catch (IOException e) {
            throw new IllegalStateException("Ollama chat failed: " + e.getMessage(), e);
        }
    }

    /** Single-turn chat via /api/chat; returns text + usage tokens when Ollama reports them. */
    private ChatResult doChat(String modelName, ChatPrompt prompt) throws IOException {
        List<Map<String, Object>> messages = new ArrayList<>();
        if (prompt.system() != null && !prompt.system().isBlank()) {
            messages.add(Map.of("role", "system", "content", prompt.system()));
        }
        messages.add(Map.of("role", "user", "content", prompt.user()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", modelName);
        body.put("messages", messages);
        body.put("stream", false);
        body.put("options", Map.of("temperature", 0));
        if (prompt.structured()) {
            body.put("format", prompt.schema());
        }

        var req = new Request.Builder()
                .url(baseUrl + "/api/chat")
                .header("Accept", "application/json")
                .post(RequestBody.create(om.writeValueAsBytes(body), JSON))
                .build();

        try (Response resp = http.newCall(req).execute()) {
            if (!resp.isSuccessful()) {
                String bodyStr = resp.body() != null ? resp.body().string() : "";
                log.error("Ollama HTTP {} for model='{}': {}", resp.code(), modelName, bodyStr);
                throw new IOException("HTTP " + resp.code() + " - " + resp.message() + " | body=" + bodyStr);
            }
            var raw = resp.body() != null ? resp.body().string() : "{}";
            JsonNode json = om.readTree(raw);

            // text can be in message.content or response depending on build
            JsonNode content = json.path("message").path("content");
            if (!content.isTextual()) content = json.path("response");
            if (!content.isTextual()) {
                log.error("Ollama response for model='{}' has no message.content: {}", modelName, raw);
                throw new IOException("Ollama response has no message.content (model=" + modelName + ")");
            }
            String text = content.asText();

            Integer promptTok = json.path("prompt_eval_count").canConvertToInt()
                    ? json.get("prompt_eval_count").asInt() : null;
            Integer completionTok = json.path("eval_count").canConvertToInt()
                    ? json.get("eval_count").asInt() : null;
            Usage usage = (promptTok != null || completionTok != null) ? new Usage(promptTok, completionTok) : null;
            return new ChatResult(text, usage);
        }
    }
}
