package de.leipzig.htwk.patentrisk.model;

/**
 * A stored claim found similar to free claim text
 */
public record SimilarClaim(Claim claim, String patentTitle, String patentNumber, double vectorScore,
                           double fuzzyScore, double combinedScore, RiskLevel riskLevel) {
}
