package org.learningjava.brandlens.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@Validated
@ConfigurationProperties(prefix = "extraction")
public class ExtractionProperties {
    @NotBlank private String provider = "openrouter";
    @NotBlank private String model = "openai/gpt-4o-mini";
    @Min(1) private int maxSourcesInPrompt = 30;

    public String getProvider() { return provider; }
    public void setProvider(String v) { this.provider = v; }
    public String getModel() { return model; }
    public void setModel(String v) { this.model = v; }
    public int getMaxSourcesInPrompt() { return maxSourcesInPrompt; }
    public void setMaxSourcesInPrompt(int v) { this.maxSourcesInPrompt = v; }
}
