package de.leipzig.htwk.patentrisk.model;

/**
 * Vector and fuzzy score together with the weight they were fused with.
 * Instances come from {@code ScoreCombiner}; {@code combinedScore} is never set on its own.
 *
 * @param degraded true when the vector leg was unavailable and the score is fuzzy-only
 */
public record HybridScore(double vectorScore, double fuzzyScore, double vectorWeight, double combinedScore, boolean degraded) {
}
