package de.leipzig.htwk.patentrisk.client.impl;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import de.leipzig.htwk.patentrisk.client.EmbeddingClient;
import de.leipzig.htwk.patentrisk.config.EmbeddingServiceConfig;
import de.leipzig.htwk.patentrisk.exception.DimensionMismatchException;
import de.leipzig.htwk.patentrisk.exception.EmbeddingUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Client for an OpenAI-style embeddings endpoint.
 * <p>
 * Texts longer than the configured chunk size are split into overlapping chunks, preferably at
 * sentence boundaries. All chunks go out in one request and their vectors are averaged and
 * L2-normalised. Retries are left to the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HttpEmbeddingClient implements EmbeddingClient {

    private static final String[] SENTENCE_BREAKS = {". ", ".\n", "; ", ";\n"};

    @Qualifier("embeddingRestTemplate")
    private final RestTemplate restTemplate;

    private final EmbeddingServiceConfig config;

    @Override
    public int dimensions() {
        return config.getDimensions();
    }

    @Override
    public double[] embed(String text) {
        String trimmed = text == null ? "" : text.strip();
        if (trimmed.isEmpty()) {
            return new double[config.getDimensions()];
        }
        try {
            config.validateConfiguration();
        } catch (IllegalStateException e) {
            throw new EmbeddingUnavailableException(e.getMessage() + ". Check the 'patent.embeddings' settings.", e);
        }

        List<String> chunks = chunk(trimmed, config.getMaxChunkChars(), config.getChunkOverlap());
        List<double[]> vectors = callEmbeddingService(chunks);
        if (vectors.size() == 1) {
            return vectors.get(0);
        }
        log.debug("Averaging {} chunk embeddings for text of {} chars", vectors.size(), trimmed.length());
        return averageAndNormalize(vectors);
    }

    private List<double[]> callEmbeddingService(List<String> inputs) {
        // {"input": ["text1", "text2"], "model": "model-name", "dimensions": 768}
        Map<String, Object> request = new HashMap<>();
        request.put("input", inputs);
        request.put("model", config.getModelId());
        request.put("dimensions", config.getDimensions());

        Map<?, ?> response;
        try {
            response = restTemplate.postForObject(config.getServiceUrl(), request, Map.class);
        } catch (RestClientException e) {
            log.error("HTTP request failed to {}: {} - {}", config.getServiceUrl(), e.getClass().getSimpleName(), e.getMessage());
            throw new EmbeddingUnavailableException("Embedding service request failed: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new EmbeddingUnavailableException("Null response from embedding service at " + config.getServiceUrl());
        }
        return parseEmbeddingResponse(response, inputs.size());
    }

    /**
     * Parse standard OpenAI-style embedding response format
     */
    private List<double[]> parseEmbeddingResponse(Map<?, ?> response, int expectedCount) {
        // {"data": [{"object": "embedding", "embedding": [...], "index": 0}], "model": "...", "usage": {...}}
        if (!(response.get("data") instanceof List<?> dataList)) {
            log.error("Invalid response from embedding service: data field missing, response keys: {}", response.keySet());
            throw new EmbeddingUnavailableException("Embedding service returned no data field");
        }
        if (dataList.size() != expectedCount) {
            throw new EmbeddingUnavailableException(
                String.format("Embedding count mismatch: expected %d, got %d", expectedCount, dataList.size()));
        }

        List<double[]> vectors = new ArrayList<>(expectedCount);
        for (Object item : dataList) {
            if (!(item instanceof Map<?, ?> embeddingData) || !(embeddingData.get("embedding") instanceof List<?> values)) {
                throw new EmbeddingUnavailableException("Embedding service returned an entry without an embedding");
            }
            if (values.size() != config.getDimensions()) {
                throw new DimensionMismatchException("embedding", config.getDimensions(), values.size());
            }
            double[] vector = new double[values.size()];
            for (int i = 0; i < vector.length; i++) {
                if (!(values.get(i) instanceof Number number)) {
                    throw new EmbeddingUnavailableException("Embedding service returned a non-numeric component");
                }
                vector[i] = number.doubleValue();
            }
            vectors.add(vector);
        }
        return vectors;
    }

    /**
     * Split text into chunks of at most {@code maxChars}, overlapping by {@code overlap} characters
     */
    static List<String> chunk(String text, int maxChars, int overlap) {
        if (text.length() <= maxChars) {
            return List.of(text);
        }

        List<String> chunks = new ArrayList<>();
        int start = 0;
        while (start < text.length()) {
            int end = Math.min(start + maxChars, text.length());
            if (end < text.length()) {
                String window = text.substring(start, end);
                for (String sep : SENTENCE_BREAKS) {
                    int lastSep = window.lastIndexOf(sep);
                    if (lastSep > maxChars / 2) {
                        end = start + lastSep + sep.length();
                        break;
                    }
                }
            }

            String chunk = text.substring(start, end).strip();
            if (!chunk.isEmpty()) {
                chunks.add(chunk);
            }
            if (end >= text.length()) {
                break;
            }
            start = Math.max(end - overlap, start + 1);
        }
        return chunks;
    }

    static double[] averageAndNormalize(List<double[]> vectors) {
        double[] average = new double[vectors.get(0).length];
        for (double[] vector : vectors) {
            for (int i = 0; i < average.length; i++) {
                average[i] += vector[i] / vectors.size();
            }
        }
        double norm = 0.0;
        for (double v : average) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm == 0.0) {
            return average;
        }
        for (int i = 0; i < average.length; i++) {
            average[i] /= norm;
        }
        return average;
    }
}
