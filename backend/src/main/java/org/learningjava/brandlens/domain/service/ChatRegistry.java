package org.learningjava.brandlens.domain.service;

import org.learningjava.brandlens.application.port.ChatLLMPort;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class ChatRegistry {
    private final Map<String, ChatLLMPort> providers = new HashMap<>();

    public ChatRegistry(List<ChatLLMPort> adapters) {
        for (ChatLLMPort adapter : adapters) {
            providers.put(adapter.provider(), adapter);
        }
    }

    public ChatLLMPort get(String id) {
        return providers.get(id);
    }

    /** Same as {@link #get(String)} but fails fast for an unconfigured provider. */
    public ChatLLMPort require(String id) {
        ChatLLMPort port = providers.get(id);
        if (port == null) {
            throw new IllegalStateException("No chat provider '" + id + "' registered. Available: " + providers.keySet());
        }
        return port;
    }

    public Set<String> listProviders() {
        return providers.keySet();
    }
}
