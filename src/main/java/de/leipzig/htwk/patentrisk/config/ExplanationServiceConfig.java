package de.leipzig.htwk.patentrisk.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * Configuration for the generative explanation service (OpenAI-compatible chat endpoint)
 */
@Component
@ConfigurationProperties(prefix = "patent.explanation")
@Data
public class ExplanationServiceConfig {

    private boolean enabled = true;
    private String serviceUrl;
    private String apiKey;
    private String model = "openai/gpt-4o-mini";
    private double temperature = 0.3;
    private int maxTokens = 1000;
    private int timeoutSeconds = 30;

    // Prompt size limits
    private int maxMatchesInPrompt = 5;
    private int maxClaimChars = 500;
    private int maxPatentsInPrompt = 5;

    public boolean isConfigured() {
        return enabled && serviceUrl != null && !serviceUrl.trim().isEmpty();
    }
}
