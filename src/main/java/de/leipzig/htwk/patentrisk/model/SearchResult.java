package de.leipzig.htwk.patentrisk.model;

public record SearchResult(Patent patent, double vectorScore, double fuzzyScore, double combinedScore,
                           MatchType matchType, boolean degraded) {

    public static SearchResult of(Patent patent, HybridScore score, MatchType matchType) {
        return new SearchResult(patent, score.vectorScore(), score.fuzzyScore(), score.combinedScore(),
                matchType, score.degraded());
    }
}
