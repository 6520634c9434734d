package de.leipzig.htwk.patentrisk.service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Service;

import de.leipzig.htwk.patentrisk.client.EmbeddingClient;
import de.leipzig.htwk.patentrisk.client.PatentCatalog;
import de.leipzig.htwk.patentrisk.client.VectorIndex;
import de.leipzig.htwk.patentrisk.client.VectorIndex.Neighbor;
import de.leipzig.htwk.patentrisk.config.RiskEngineConfig;
import de.leipzig.htwk.patentrisk.exception.EmbeddingUnavailableException;
import de.leipzig.htwk.patentrisk.exception.EngineException;
import de.leipzig.htwk.patentrisk.model.HybridScore;
import de.leipzig.htwk.patentrisk.model.MatchType;
import de.leipzig.htwk.patentrisk.model.Patent;
import de.leipzig.htwk.patentrisk.model.SearchResult;
import de.leipzig.htwk.patentrisk.service.cache.CacheKeys;
import de.leipzig.htwk.patentrisk.service.cache.ResultCache;
import de.leipzig.htwk.patentrisk.service.similarity.FuzzySimilarity;
import de.leipzig.htwk.patentrisk.service.similarity.ScoreCombiner;
import de.leipzig.htwk.patentrisk.service.similarity.VectorSimilarity;
import de.leipzig.htwk.patentrisk.validation.RequestValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Hybrid patent search.
 * <p>
 * Candidates come from two legs: the vector index (nearest patents to the query embedding) and a
 * lexical pass over the most recent patents. Every candidate is scored on both signals and ranked
 * by the fused score. When the embedding service or the index is down the search still answers,
 * on the lexical signal alone, with every result flagged as degraded.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatentSearchService {

    private final EmbeddingClient embeddingClient;
    private final VectorIndex vectorIndex;
    private final PatentCatalog catalog;
    private final ScoreCombiner scoreCombiner;
    private final ResultCache resultCache;
    private final CollaboratorInvoker invoker;
    private final RiskEngineConfig config;

    public List<SearchResult> search(String query, Integer limit, Double vectorWeight) {
        RequestValidator.validateRequired(query, "query", "for patent search");
        RequestValidator.validateLimit(limit, config.getMaxSearchLimit(), "limit");

        int effectiveLimit = limit != null ? limit : config.getDefaultSearchLimit();
        double weight = scoreCombiner.resolveWeight(vectorWeight);

        return resultCache.computeIfAbsent(
            CacheKeys.search(query, weight, effectiveLimit),
            () -> doSearch(query.strip(), effectiveLimit, weight),
            results -> results.stream().noneMatch(SearchResult::degraded));
    }

    private List<SearchResult> doSearch(String query, int limit, double weight) {
        long start = System.currentTimeMillis();

        double[] queryVector = embedQuery(query);
        Map<String, Neighbor> neighbors = queryVector != null
            ? findNeighbors(queryVector, limit * config.getCandidateMultiplier())
            : null;
        boolean degraded = neighbors == null;

        // Lexical leg
        List<Patent> pool = catalog.fuzzyCandidates(config.getFuzzyCandidatePool());
        Map<String, Double> fuzzyScores = new LinkedHashMap<>();
        Map<String, Patent> patents = new LinkedHashMap<>();
        for (Patent patent : pool) {
            fuzzyScores.put(patent.getId(), FuzzySimilarity.similarity(query, patent.searchableText()));
            patents.put(patent.getId(), patent);
        }
        Set<String> fuzzyLeg = new HashSet<>();
        fuzzyScores.entrySet().stream()
            .filter(e -> e.getValue() > 0.0)
            .sorted(Map.Entry.<String, Double>comparingByValue().reversed().thenComparing(Map.Entry.<String, Double>comparingByKey()))
            .limit(2L * limit)
            .forEach(e -> fuzzyLeg.add(e.getKey()));

        Set<String> vectorLeg = degraded ? Set.of() : neighbors.keySet();
        List<String> missing = vectorLeg.stream().filter(id -> !patents.containsKey(id)).toList();
        patents.putAll(catalog.findAllById(missing));

        Set<String> candidateIds = new HashSet<>(vectorLeg);
        candidateIds.addAll(fuzzyLeg);

        List<SearchResult> results = new ArrayList<>(candidateIds.size());
        for (String id : candidateIds) {
            Patent patent = patents.get(id);
            if (patent == null) {
                log.debug("Vector index returned unknown patent {}", id);
                continue;
            }
            double fuzzy = fuzzyScores.computeIfAbsent(id, k -> FuzzySimilarity.similarity(query, patent.searchableText()));

            HybridScore score;
            if (degraded) {
                score = scoreCombiner.fuzzyOnly(fuzzy);
            } else {
                score = scoreCombiner.combine(vectorScore(queryVector, patent, neighbors.get(id)), fuzzy, weight);
            }
            if (score.combinedScore() < config.getMinCombinedScore()) {
                continue;
            }
            results.add(SearchResult.of(patent, score, matchType(vectorLeg.contains(id), fuzzyLeg.contains(id))));
        }

        results.sort(ScoreCombiner.RANKING);
        List<SearchResult> ranked = List.copyOf(results.subList(0, Math.min(limit, results.size())));

        log.info("Search for '{}' returned {} results from {} candidates in {} ms{}",
            abbreviate(query), ranked.size(), candidateIds.size(), System.currentTimeMillis() - start,
            degraded ? " (degraded: fuzzy only)" : "");
        return ranked;
    }

    /**
     * Exact cosine against the stored vector when there is one, otherwise the index's own score
     */
    private static double vectorScore(double[] queryVector, Patent patent, Neighbor neighbor) {
        if (patent.hasEmbedding()) {
            return VectorSimilarity.similarity(queryVector, patent.getEmbedding());
        }
        return neighbor != null ? VectorSimilarity.fromCosine(neighbor.rawScore()) : 0.0;
    }

    private double[] embedQuery(String query) {
        try {
            return invoker.invoke("query embedding", () -> embeddingClient.embed(query),
                e -> new EmbeddingUnavailableException("Query embedding failed: " + e.getMessage(), e));
        } catch (EngineException e) {
            if (!e.isRecoverable()) {
                throw e;
            }
            log.warn("Semantic search unavailable, falling back to fuzzy only: {}", e.getMessage());
            return null;
        }
    }

    private Map<String, Neighbor> findNeighbors(double[] queryVector, int k) {
        try {
            List<Neighbor> found = invoker.invoke("vector index lookup", () -> vectorIndex.nearestNeighbors(queryVector, k),
                e -> new EmbeddingUnavailableException("Vector index lookup failed: " + e.getMessage(), e));
            Map<String, Neighbor> byId = new LinkedHashMap<>();
            found.forEach(n -> byId.putIfAbsent(n.patentId(), n));
            return byId;
        } catch (EngineException e) {
            if (!e.isRecoverable()) {
                throw e;
            }
            log.warn("Vector index unavailable, falling back to fuzzy only: {}", e.getMessage());
            return null;
        }
    }

    private static MatchType matchType(boolean fromVector, boolean fromFuzzy) {
        if (fromVector && fromFuzzy) {
            return MatchType.HYBRID;
        }
        return fromVector ? MatchType.VECTOR : MatchType.FUZZY;
    }

    private static String abbreviate(String text) {
        return text.length() > 60 ? text.substring(0, 60) + "..." : text;
    }
}
