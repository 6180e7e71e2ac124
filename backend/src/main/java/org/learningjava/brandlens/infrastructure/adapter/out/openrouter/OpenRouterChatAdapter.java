package org.learningjava.brandlens.infrastructure.adapter.out.openrouter;

import com.fasterxml.jackson.databind.JsonNode;
import org.learningjava.brandlens.application.port.ChatLLMPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
public class OpenRouterChatAdapter implements ChatLLMPort {

    private static final Logger log = LoggerFactory.getLogger(OpenRouterChatAdapter.class);

    private final OpenRouterClient client;

    public OpenRouterChatAdapter(OpenRouterClient client) {
        this.client = client;
    }

    @Override
    public String provider() { return "openrouter"; }

    @Override
    public ChatResult complete(ChatPrompt prompt, String model) {
        List<Map<String, Object>> messages = new ArrayList<>();
        if (prompt.system() != null && !prompt.system().isBlank()) {
            messages.add(Map.of("role", "system", "content", prompt.system()));
        }
        messages.add(Map.of("role", "user", "content", prompt.user()));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("messages", messages);
        if (prompt.structured()) {
            body.put("response_format", Map.of(
                    "type", "json_schema",
                    "json_schema", Map.of(
                            "name", prompt.schemaName(),
                            "strict", true,
                            "schema", prompt.schema())));
        }

        JsonNode response = client.chatCompletion(body, model);
        String content = OpenRouterClient.content(response);
        if (content.isEmpty()) {
            log.warn("OpenRouter response missing choices[0].message.content for model='{}'", model);
        }
        Usage usage = OpenRouterClient.usage(response);
        log.debug("OpenRouter completion: model={}, usage={}", model, usage);
        return new ChatResult(content, usage);
    }
}
