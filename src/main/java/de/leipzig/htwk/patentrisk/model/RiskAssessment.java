package de.leipzig.htwk.patentrisk.model;

/**
 * Aggregate verdict over a set of claim matches
 */
public record RiskAssessment(RiskLevel overallRisk, int independentClaimsAtRisk, double highestSimilarity,
                             double averageSimilarity, FreedomToOperate freedomToOperate) {
}
