package de.leipzig.htwk.patentrisk.client.impl;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import de.leipzig.htwk.patentrisk.client.ExplanationClient;
import de.leipzig.htwk.patentrisk.config.ExplanationServiceConfig;
import de.leipzig.htwk.patentrisk.exception.ExplanationUnavailableException;
import de.leipzig.htwk.patentrisk.model.BlockingPatent;
import de.leipzig.htwk.patentrisk.model.Claim;
import de.leipzig.htwk.patentrisk.model.ClaimMatch;
import de.leipzig.htwk.patentrisk.model.ExplanationResult;
import de.leipzig.htwk.patentrisk.model.FreedomToOperate;
import de.leipzig.htwk.patentrisk.model.Patent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Explanations from an OpenAI-compatible chat completions endpoint. The model is asked for a
 * JSON object; replies wrapped in markdown code fences are unwrapped before parsing.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LlmExplanationClient implements ExplanationClient {

    private static final int MAX_INVENTION_CHARS = 1500;
    private static final int MAX_ABSTRACT_CHARS = 1000;
    private static final int MAX_BLOCKING_CLAIM_CHARS = 400;

    @Qualifier("explanationRestTemplate")
    private final RestTemplate restTemplate;

    private final ExplanationServiceConfig config;
    private final ObjectMapper objectMapper;

    @Override
    public boolean isEnabled() {
        return config.isConfigured();
    }

    @Override
    public ExplanationResult explainComparison(Patent source, Patent target, List<ClaimMatch> matches) {
        List<ClaimMatch> presented = matches.stream().limit(config.getMaxMatchesInPrompt()).toList();
        String content = complete(buildComparisonPrompt(source, target, presented));
        return parseExplanation(content);
    }

    @Override
    public ExplanationResult explainPriorArt(String inventionDescription, List<BlockingPatent> blockingPatents) {
        List<BlockingPatent> presented = blockingPatents.stream().limit(config.getMaxPatentsInPrompt()).toList();
        String content = complete(buildPriorArtPrompt(inventionDescription, presented));
        return parseExplanation(content);
    }

    String buildComparisonPrompt(Patent source, Patent target, List<ClaimMatch> matches) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are a patent attorney AI. Analyze these patents for potential infringement.\n\n");
        prompt.append("SOURCE PATENT: ").append(describe(source)).append("\n\n");
        prompt.append("TARGET PATENT: ").append(describe(target)).append("\n\n");

        if (!matches.isEmpty()) {
            String matchesContext = IntStream.range(0, matches.size())
                .mapToObj(i -> describeMatch(i + 1, matches.get(i)))
                .collect(Collectors.joining("\n\n"));
            prompt.append("MATCHING CLAIMS:\n").append(matchesContext).append("\n\n");
        }

        prompt.append("""
            Provide analysis in JSON format:
            {
                "summary": "Brief overall assessment of infringement risk (2-3 sentences)",
                "freedom_to_operate": "likely|uncertain|unlikely",
                "key_risks": ["risk 1", "risk 2", ...],
                "design_around_suggestions": ["suggestion 1", "suggestion 2", ...],
                "recommendation": "Specific action recommended",
                "match_assessments": ["Brief assessment for match 1", "Brief assessment for match 2", ...]
            }

            Focus on:
            1. Whether the claims cover the same technical subject matter
            2. Whether one claim would literally or equivalently infringe the other
            3. Key differences that might avoid infringement

            Be precise and technical.""");
        return prompt.toString();
    }

    String buildPriorArtPrompt(String inventionDescription, List<BlockingPatent> blockingPatents) {
        String patentsContext = blockingPatents.stream()
            .map(this::describeBlockingPatent)
            .collect(Collectors.joining("\n\n"));

        return "You are a patent attorney AI. Analyze the freedom to operate for this invention.\n\n"
            + "INVENTION DESCRIPTION:\n" + truncate(inventionDescription, MAX_INVENTION_CHARS) + "\n\n"
            + "POTENTIALLY BLOCKING PRIOR ART:\n" + patentsContext + "\n\n"
            + """
            Analyze and respond in JSON format:
            {
                "freedom_to_operate": "likely|uncertain|unlikely",
                "summary": "Two or three sentence assessment",
                "key_risks": ["risk 1", "risk 2", ...],
                "design_around_suggestions": ["suggestion 1", "suggestion 2", ...],
                "recommendation": "Brief recommendation for next steps"
            }

            Consider:
            1. How similar are the blocking claims to the invention?
            2. Are there clear differences that could avoid infringement?
            3. What modifications could help design around the prior art?

            Be practical and specific.""";
    }

    private String complete(String prompt) {
        if (!config.isConfigured()) {
            throw new ExplanationUnavailableException("Explanation service is not configured");
        }

        Map<String, Object> request = new HashMap<>();
        request.put("model", config.getModel());
        request.put("messages", List.of(Map.of("role", "user", "content", prompt)));
        request.put("temperature", config.getTemperature());
        request.put("max_tokens", config.getMaxTokens());

        JsonNode response;
        try {
            response = restTemplate.postForObject(config.getServiceUrl(), request, JsonNode.class);
        } catch (RestClientException e) {
            throw new ExplanationUnavailableException("Explanation service request failed: " + e.getMessage(), e);
        }

        JsonNode content = response == null ? null : response.path("choices").path(0).path("message").path("content");
        if (content == null || !content.isTextual() || content.asText().isBlank()) {
            throw new ExplanationUnavailableException("Explanation service returned no content");
        }
        return content.asText();
    }

    /**
     * Parse the model's reply. Unknown or missing fields are left empty.
     */
    ExplanationResult parseExplanation(String content) {
        JsonNode root;
        try {
            root = objectMapper.readTree(stripCodeFences(content));
        } catch (JsonProcessingException e) {
            throw new ExplanationUnavailableException("Explanation was not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new ExplanationUnavailableException("Explanation was not a JSON object");
        }

        return ExplanationResult.builder()
            .freedomToOperate(FreedomToOperate.fromString(text(root, "freedom_to_operate")))
            .summary(text(root, "summary"))
            .keyRisks(strings(root, "key_risks"))
            .designAroundSuggestions(strings(root, "design_around_suggestions"))
            .recommendation(text(root, "recommendation"))
            .matchAssessments(strings(root, "match_assessments"))
            .build();
    }

    static String stripCodeFences(String content) {
        String body = content;
        if (body.contains("```json")) {
            body = body.substring(body.indexOf("```json") + 7);
            int close = body.indexOf("```");
            body = close >= 0 ? body.substring(0, close) : body;
        } else if (body.contains("```")) {
            body = body.substring(body.indexOf("```") + 3);
            int close = body.indexOf("```");
            body = close >= 0 ? body.substring(0, close) : body;
        }
        return body.strip();
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return node != null && node.isValueNode() && !node.isNull() ? node.asText() : null;
    }

    private static List<String> strings(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        node.forEach(item -> {
            if (item.isValueNode() && !item.isNull()) {
                values.add(item.asText());
            }
        });
        return List.copyOf(values);
    }

    private String describe(Patent patent) {
        return String.format("%s - %s%nAbstract: %s",
            patent.getPatentNumber() != null ? patent.getPatentNumber() : patent.getId(),
            patent.getTitle(),
            truncate(patent.getAbstractText(), MAX_ABSTRACT_CHARS));
    }

    private String describeMatch(int index, ClaimMatch match) {
        return String.format("MATCH %d (Similarity: %.1f%%):%n%s%n%n%s",
            index, match.getSimilarity() * 100,
            describeClaim("Source", match.getSourceClaim()),
            describeClaim("Target", match.getTargetClaim()));
    }

    private String describeClaim(String side, Claim claim) {
        return String.format("%s Claim %d (%s):%n%s", side, claim.getClaimNumber(),
            claim.isIndependent() ? "Independent" : "Dependent",
            truncate(claim.getText(), config.getMaxClaimChars()));
    }

    private String describeBlockingPatent(BlockingPatent blocking) {
        Patent patent = blocking.getPatent();
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("PATENT: %s - %s%n", patent.getPatentNumber() != null ? patent.getPatentNumber() : "Unknown", patent.getTitle()));
        sb.append(String.format("Highest similarity: %.1f%%", blocking.getHighestSimilarity() * 100));
        if (!blocking.getBlockingClaims().isEmpty()) {
            Claim top = blocking.getBlockingClaims().get(0).getTargetClaim();
            sb.append(String.format("%nTop blocking claim (Claim %d): %s", top.getClaimNumber(),
                truncate(top.getText(), MAX_BLOCKING_CLAIM_CHARS)));
        }
        return sb.toString();
    }

    private static String truncate(String text, int maxChars) {
        if (text == null) {
            return "N/A";
        }
        return text.length() > maxChars ? text.substring(0, maxChars) + "..." : text;
    }
}
