package de.leipzig.htwk.patentrisk.service.similarity;

import java.util.Comparator;

import org.springframework.stereotype.Component;

import de.leipzig.htwk.patentrisk.config.RiskEngineConfig;
import de.leipzig.htwk.patentrisk.model.HybridScore;
import de.leipzig.htwk.patentrisk.model.SearchResult;
import lombok.RequiredArgsConstructor;

/**
 * Fuses a vector and a fuzzy score with a vector weight {@code w}:
 * {@code w * vector + (1 - w) * fuzzy}.
 */
@Component
@RequiredArgsConstructor
public class ScoreCombiner {

    /**
     * Ranking order for search results: combined desc, vector desc, patent id asc
     */
    public static final Comparator<SearchResult> RANKING = Comparator
        .comparingDouble(SearchResult::combinedScore).reversed()
        .thenComparing(Comparator.comparingDouble(SearchResult::vectorScore).reversed())
        .thenComparing(result -> result.patent().getId(), Comparator.nullsLast(Comparator.naturalOrder()));

    private final RiskEngineConfig config;

    public HybridScore combine(double vectorScore, double fuzzyScore, Double vectorWeight) {
        double weight = resolveWeight(vectorWeight);
        return new HybridScore(vectorScore, fuzzyScore, weight, combinedScore(vectorScore, fuzzyScore, weight), false);
    }

    /**
     * Score used when no vector is available: weight 0, marked degraded
     */
    public HybridScore fuzzyOnly(double fuzzyScore) {
        return new HybridScore(0.0, fuzzyScore, 0.0, combinedScore(0.0, fuzzyScore, 0.0), true);
    }

    /**
     * Out-of-range weights are clamped, a missing or NaN weight falls back to the default
     */
    public double resolveWeight(Double vectorWeight) {
        if (vectorWeight == null || vectorWeight.isNaN()) {
            return VectorSimilarity.clamp(config.getDefaultVectorWeight());
        }
        return VectorSimilarity.clamp(vectorWeight);
    }

    public static double combinedScore(double vectorScore, double fuzzyScore, double weight) {
        if (vectorScore == fuzzyScore) {
            return VectorSimilarity.clamp(vectorScore);
        }
        return VectorSimilarity.clamp(weight * vectorScore + (1.0 - weight) * fuzzyScore);
    }
}
