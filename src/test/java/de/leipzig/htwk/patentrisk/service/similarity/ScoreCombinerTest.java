package de.leipzig.htwk.patentrisk.service.similarity;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import de.leipzig.htwk.patentrisk.config.RiskEngineConfig;
import de.leipzig.htwk.patentrisk.model.HybridScore;
import de.leipzig.htwk.patentrisk.model.MatchType;
import de.leipzig.htwk.patentrisk.model.Patent;
import de.leipzig.htwk.patentrisk.model.SearchResult;

class ScoreCombinerTest {

    private final ScoreCombiner combiner = new ScoreCombiner(new RiskEngineConfig());

    @Test
    void weightsVectorAndFuzzyScores() {
        HybridScore score = combiner.combine(0.8, 0.4, 0.7);
        assertEquals(0.68, score.combinedScore(), 1e-12);
        assertEquals(0.7, score.vectorWeight());
        assertFalse(score.degraded());
    }

    @Test
    void equalInputsCombineToThemselvesForAnyWeight() {
        for (double a : new double[]{0.0, 0.1, 0.3333333333333333, 0.7, 0.9999999, 1.0}) {
            for (double w : new double[]{0.0, 0.3, 0.7, 1.0}) {
                assertEquals(a, ScoreCombiner.combinedScore(a, a, w));
            }
        }
    }

    @Test
    void isMonotoneInBothInputs() {
        double w = 0.7;
        assertTrue(ScoreCombiner.combinedScore(0.6, 0.5, w) <= ScoreCombiner.combinedScore(0.7, 0.5, w));
        assertTrue(ScoreCombiner.combinedScore(0.6, 0.5, w) <= ScoreCombiner.combinedScore(0.6, 0.9, w));
        assertTrue(ScoreCombiner.combinedScore(0.2, 0.2, w) <= ScoreCombiner.combinedScore(0.2, 0.21, w));
    }

    @Test
    void weightIsClampedAndDefaulted() {
        assertEquals(1.0, combiner.resolveWeight(1.5));
        assertEquals(0.0, combiner.resolveWeight(-0.2));
        assertEquals(0.7, combiner.resolveWeight(null));
        assertEquals(0.7, combiner.resolveWeight(Double.NaN));
    }

    @Test
    void fuzzyOnlyIgnoresVectorAndIsDegraded() {
        HybridScore score = combiner.fuzzyOnly(0.42);
        assertEquals(0.42, score.combinedScore());
        assertEquals(0.0, score.vectorWeight());
        assertTrue(score.degraded());
    }

    @Test
    void rankingBreaksTiesOnVectorScoreThenPatentId() {
        List<SearchResult> results = new ArrayList<>(List.of(
            result("c", 0.5, 0.5),
            result("b", 0.6, 0.4),
            result("a", 0.6, 0.4),
            result("d", 0.9, 0.1)));
        results.sort(ScoreCombiner.RANKING);

        List<String> ids = results.stream().map(r -> r.patent().getId()).toList();
        // combined: c 0.5, b/a 0.54, d 0.66
        assertEquals(List.of("d", "a", "b", "c"), ids);
    }

    private SearchResult result(String id, double vector, double fuzzy) {
        return SearchResult.of(Patent.builder().id(id).build(), combiner.combine(vector, fuzzy, 0.7), MatchType.HYBRID);
    }
}
