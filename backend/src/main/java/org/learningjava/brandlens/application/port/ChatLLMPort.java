package org.learningjava.brandlens.application.port;

import java.util.Map;

public interface ChatLLMPort {
    String provider();

    /**
     * One non-streaming completion. When the prompt carries a schema the backend is asked for
     * structured output matching it; the returned text is still raw and must be validated.
     * Transport and HTTP failures are thrown, never returned as text.
     */
    ChatResult complete(ChatPrompt prompt, String model);

    record Usage(Integer promptTokens, Integer completionTokens) {}
    record ChatResult(String text, Usage usage) {}

    record ChatPrompt(String system, String user, String schemaName, Map<String, Object> schema) {
        public static ChatPrompt of(String system, String user) {
            return new ChatPrompt(system, user, null, null);
        }

        public boolean structured() {
            return schemaName != null && schema != null;
        }
    }
}
