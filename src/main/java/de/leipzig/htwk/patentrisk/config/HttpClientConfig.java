package de.leipzig.htwk.patentrisk.config;

import java.time.Duration;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP clients for the embedding and explanation services
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate embeddingRestTemplate(RestTemplateBuilder builder, EmbeddingServiceConfig config) {
        RestTemplateBuilder configured = builder
            .setConnectTimeout(Duration.ofSeconds(5))
            .setReadTimeout(Duration.ofSeconds(config.getTimeoutSeconds()))
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            configured = configured.defaultHeader(HttpHeaders.AUTHORIZATION, buildAuthHeader(config.getApiKey()));
        }
        return configured.build();
    }

    @Bean
    public RestTemplate explanationRestTemplate(RestTemplateBuilder builder, ExplanationServiceConfig config) {
        RestTemplateBuilder configured = builder
            .setConnectTimeout(Duration.ofSeconds(5))
            .setReadTimeout(Duration.ofSeconds(config.getTimeoutSeconds()))
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            configured = configured.defaultHeader(HttpHeaders.AUTHORIZATION, buildAuthHeader(config.getApiKey()));
        }
        return configured.build();
    }

    private String buildAuthHeader(String apiKey) {
        return "Bearer " + apiKey;
    }
}
