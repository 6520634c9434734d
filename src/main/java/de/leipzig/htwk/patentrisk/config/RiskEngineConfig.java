package de.leipzig.htwk.patentrisk.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/**
 * Scoring, matching and resilience settings of the risk engine
 */
@Component
@ConfigurationProperties(prefix = "patent.engine")
@Data
public class RiskEngineConfig {

    // Score fusion
    private double defaultVectorWeight = 0.7;

    // Search
    private int defaultSearchLimit = 20;
    private int maxSearchLimit = 100;
    private int candidateMultiplier = 2;
    private int fuzzyCandidatePool = 1000;
    private double minCombinedScore = 0.0;

    // Claim matching
    private double claimSimilarityFloor = 0.3;
    private int maxClaimMatches = 20;
    private int matrixThreads = 4;

    // Risk thresholds
    private double highRiskThreshold = 0.8;
    private double mediumRiskThreshold = 0.6;

    // Prior art
    private int minInventionDescriptionLength = 50;
    private int minClaimCompareDescriptionLength = 20;
    private int maxPriorArtLimit = 50;
    private int priorArtCandidateMultiplier = 3;
    private int blockingClaimsPerPatent = 5;
    private double blockingPatentFloor = 0.4;

    // Collaborator calls
    private int maxRetries = 2;
    private long initialBackoffMillis = 200;
    private double backoffMultiplier = 2.0;
    private long callTimeoutMillis = 10_000;
    private int collaboratorThreads = 8;
    private int requestThreads = 16;
    private long requestTimeoutMillis = 120_000;
}
