package de.leipzig.htwk.patentrisk.service.claims;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import de.leipzig.htwk.patentrisk.config.RiskEngineConfig;
import de.leipzig.htwk.patentrisk.model.Claim;
import de.leipzig.htwk.patentrisk.model.ClaimMatch;
import de.leipzig.htwk.patentrisk.model.HybridScore;
import de.leipzig.htwk.patentrisk.service.risk.RiskClassifier;
import de.leipzig.htwk.patentrisk.service.similarity.FuzzySimilarity;
import de.leipzig.htwk.patentrisk.service.similarity.ScoreCombiner;
import de.leipzig.htwk.patentrisk.service.similarity.VectorSimilarity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * All-pairs hybrid similarity between two claim sets, reduced to a one-to-one selection.
 * <p>
 * Selection is greedy: cells are visited by descending score and a pair is taken only if
 * neither claim has been used yet. Cells below the similarity floor are never taken.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ClaimMatcher {

    private static final Comparator<Cell> CELL_ORDER = Comparator
        .comparingDouble((Cell c) -> c.score().combinedScore()).reversed()
        .thenComparingInt(c -> c.source().getClaimNumber())
        .thenComparingInt(c -> c.target().getClaimNumber());

    private final ScoreCombiner scoreCombiner;
    private final RiskClassifier riskClassifier;
    private final RiskEngineConfig config;

    @Qualifier("claimMatrixExecutor")
    private final Executor claimMatrixExecutor;

    private record Cell(int sourceIndex, int targetIndex, Claim source, Claim target, HybridScore score) {
    }

    /**
     * @param vectorWeight weight of the vector score, null for the configured default
     * @return matches by descending similarity, at most {@code maxClaimMatches}
     */
    public List<ClaimMatch> match(List<Claim> source, List<Claim> target, Double vectorWeight) {
        if (source.isEmpty() || target.isEmpty()) {
            return List.of();
        }

        double weight = scoreCombiner.resolveWeight(vectorWeight);
        List<Cell> cells = computeMatrix(source, target, weight);
        cells.sort(CELL_ORDER);

        boolean[] usedSource = new boolean[source.size()];
        boolean[] usedTarget = new boolean[target.size()];
        int maxPairs = Math.min(config.getMaxClaimMatches(), Math.min(source.size(), target.size()));

        List<ClaimMatch> matches = new ArrayList<>();
        for (Cell cell : cells) {
            if (matches.size() >= maxPairs) {
                break;
            }
            int s = cell.sourceIndex();
            int t = cell.targetIndex();
            if (usedSource[s] || usedTarget[t]) {
                continue;
            }
            usedSource[s] = true;
            usedTarget[t] = true;

            double similarity = cell.score().combinedScore();
            matches.add(ClaimMatch.builder()
                .sourceClaim(cell.source())
                .targetClaim(cell.target())
                .similarity(similarity)
                .riskLevel(riskClassifier.classify(similarity))
                .degraded(cell.score().degraded())
                .build());
        }

        log.debug("Matched {} of {}x{} claims ({} cells above floor)", matches.size(), source.size(), target.size(), cells.size());
        return matches;
    }

    /**
     * Hybrid score of one claim pair. A pair lacking an embedding on either side is scored on text alone.
     */
    public HybridScore scorePair(Claim source, Claim target, double weight) {
        double fuzzy = FuzzySimilarity.similarity(source.getText(), target.getText());
        if (!source.hasEmbedding() || !target.hasEmbedding()) {
            return scoreCombiner.fuzzyOnly(fuzzy);
        }
        double vector = VectorSimilarity.similarity(source.getEmbedding(), target.getEmbedding());
        return scoreCombiner.combine(vector, fuzzy, weight);
    }

    private List<Cell> computeMatrix(List<Claim> source, List<Claim> target, double weight) {
        double floor = config.getClaimSimilarityFloor();

        List<CompletableFuture<List<Cell>>> rows = new ArrayList<>(source.size());
        for (int i = 0; i < source.size(); i++) {
            int s = i;
            rows.add(CompletableFuture.supplyAsync(() -> {
                Claim sourceClaim = source.get(s);
                List<Cell> row = new ArrayList<>();
                for (int t = 0; t < target.size(); t++) {
                    HybridScore score = scorePair(sourceClaim, target.get(t), weight);
                    if (score.combinedScore() >= floor) {
                        row.add(new Cell(s, t, sourceClaim, target.get(t), score));
                    }
                }
                return row;
            }, claimMatrixExecutor));
        }

        List<Cell> cells = new ArrayList<>();
        try {
            for (CompletableFuture<List<Cell>> row : rows) {
                cells.addAll(row.get());
            }
        } catch (InterruptedException e) {
            rows.forEach(row -> row.cancel(true));
            Thread.currentThread().interrupt();
            throw new CancellationException("Claim matching interrupted");
        } catch (ExecutionException e) {
            rows.forEach(row -> row.cancel(true));
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Claim matrix computation failed", e.getCause());
        }
        return cells;
    }
}
