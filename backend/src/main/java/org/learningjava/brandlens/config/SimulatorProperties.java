package org.learningjava.brandlens.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

// engine id -> web-search capable OpenRouter model
@Component
@ConfigurationProperties(prefix = "simulator")
public class SimulatorProperties {
    private Map<String, String> models = new HashMap<>(Map.of(
            "chatgpt",    "openai/gpt-4o-mini:online",
            "gemini",     "google/gemini-2.0-flash-001:online",
            "grok",       "x-ai/grok-3-mini:online",
            "perplexity", "perplexity/sonar"
    ));
    private double temperature = 0.7;

    public Map<String, String> getModels() { return models; }
    public void setModels(Map<String, String> m) { this.models = m; }
    public double getTemperature() { return temperature; }
    public void setTemperature(double v) { this.temperature = v; }
}
