package de.leipzig.htwk.patentrisk.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * Configuration for the external embedding service
 */
@Component
@ConfigurationProperties(prefix = "patent.embeddings")
@Data
public class EmbeddingServiceConfig {

    private String serviceUrl;
    private String apiKey;
    private String modelId = "nomic-embed-text";
    private int dimensions = 768;
    private int timeoutSeconds = 15;

    // Long texts are split into overlapping chunks and the chunk vectors averaged
    private int maxChunkChars = 2000;
    private int chunkOverlap = 200;

    /**
     * Whether an endpoint is configured at all
     */
    public boolean isConfigured() {
        return serviceUrl != null && !serviceUrl.trim().isEmpty();
    }

    /**
     * Validate that required configuration is present
     */
    public void validateConfiguration() {
        if (!isConfigured()) {
            throw new IllegalStateException("Embedding service URL is not configured");
        }
        if (modelId == null || modelId.trim().isEmpty()) {
            throw new IllegalStateException("Model ID is not configured");
        }
        if (dimensions <= 0) {
            throw new IllegalStateException("Dimensions must be positive");
        }
        if (chunkOverlap >= maxChunkChars) {
            throw new IllegalStateException("Chunk overlap must be smaller than the chunk size");
        }
    }
}
