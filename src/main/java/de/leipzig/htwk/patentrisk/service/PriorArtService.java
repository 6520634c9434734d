package de.leipzig.htwk.patentrisk.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.stereotype.Service;

import de.leipzig.htwk.patentrisk.client.EmbeddingClient;
import de.leipzig.htwk.patentrisk.client.ExplanationClient;
import de.leipzig.htwk.patentrisk.client.PatentCatalog;
import de.leipzig.htwk.patentrisk.client.VectorIndex;
import de.leipzig.htwk.patentrisk.config.RiskEngineConfig;
import de.leipzig.htwk.patentrisk.exception.EmbeddingUnavailableException;
import de.leipzig.htwk.patentrisk.exception.EngineException;
import de.leipzig.htwk.patentrisk.exception.ExplanationUnavailableException;
import de.leipzig.htwk.patentrisk.exception.PatentNotFoundException;
import de.leipzig.htwk.patentrisk.model.BlockingPatent;
import de.leipzig.htwk.patentrisk.model.Claim;
import de.leipzig.htwk.patentrisk.model.ClaimMatch;
import de.leipzig.htwk.patentrisk.model.ExplanationResult;
import de.leipzig.htwk.patentrisk.model.HybridScore;
import de.leipzig.htwk.patentrisk.model.InventionClaimComparison;
import de.leipzig.htwk.patentrisk.model.Patent;
import de.leipzig.htwk.patentrisk.model.PriorArtReport;
import de.leipzig.htwk.patentrisk.model.RiskLevel;
import de.leipzig.htwk.patentrisk.model.SimilarClaim;
import de.leipzig.htwk.patentrisk.service.cache.CacheKeys;
import de.leipzig.htwk.patentrisk.service.cache.ResultCache;
import de.leipzig.htwk.patentrisk.service.claims.ClaimMatcher;
import de.leipzig.htwk.patentrisk.service.risk.RiskAggregator;
import de.leipzig.htwk.patentrisk.service.risk.RiskClassifier;
import de.leipzig.htwk.patentrisk.service.similarity.FuzzySimilarity;
import de.leipzig.htwk.patentrisk.validation.RequestValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Claim-level prior art search for a free-text invention description, and claim-to-claim
 * similarity search across the catalog.
 * <p>
 * The invention is treated as a single independent claim and scored against the claims of
 * candidate patents with the same hybrid score as a claim comparison.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriorArtService {

    private static final int QUERY_SUMMARY_CHARS = 200;
    private static final int DEFAULT_PRIOR_ART_LIMIT = 20;
    private static final int DEFAULT_SIMILAR_CLAIMS_LIMIT = 10;

    private static final Comparator<ClaimMatch> BY_SIMILARITY = Comparator
        .comparingDouble(ClaimMatch::getSimilarity).reversed()
        .thenComparingInt(m -> m.getTargetClaim().getClaimNumber());

    private static final Comparator<SimilarClaim> SIMILAR_CLAIM_ORDER = Comparator
        .comparingDouble(SimilarClaim::combinedScore).reversed()
        .thenComparing(s -> s.claim().getPatentId())
        .thenComparingInt(s -> s.claim().getClaimNumber());

    private final PatentCatalog catalog;
    private final PatentClaimService claimService;
    private final ClaimMatcher claimMatcher;
    private final RiskClassifier riskClassifier;
    private final RiskAggregator riskAggregator;
    private final EmbeddingClient embeddingClient;
    private final VectorIndex vectorIndex;
    private final ExplanationClient explanationClient;
    private final CollaboratorInvoker invoker;
    private final ResultCache resultCache;
    private final RiskEngineConfig config;

    public PriorArtReport priorArtSearch(String inventionDescription, Integer limit, boolean includeAnalysis) {
        RequestValidator.validateInventionDescription(inventionDescription, config.getMinInventionDescriptionLength(), "inventionDescription");
        RequestValidator.validateLimit(limit, config.getMaxPriorArtLimit(), "limit");

        String description = inventionDescription.strip();
        int effectiveLimit = limit != null ? limit : Math.min(DEFAULT_PRIOR_ART_LIMIT, config.getMaxPriorArtLimit());
        boolean analyse = includeAnalysis && explanationClient.isEnabled();

        return resultCache.computeIfAbsent(
            CacheKeys.priorArt(description, effectiveLimit, includeAnalysis),
            () -> doPriorArtSearch(description, effectiveLimit, analyse),
            report -> !report.isDegraded() && (!analyse || report.getBlockingPatents().isEmpty() || report.getAnalysis() != null));
    }

    private PriorArtReport doPriorArtSearch(String description, int limit, boolean analyse) {
        long start = System.currentTimeMillis();
        int candidateCount = limit * config.getPriorArtCandidateMultiplier();

        double[] inventionVector = embed(description, "invention embedding");
        Claim invention = Claim.builder()
            .claimNumber(1)
            .text(description)
            .independent(true)
            .embedding(inventionVector)
            .build();

        Set<String> candidateIds = new LinkedHashSet<>();
        boolean indexAvailable = false;
        if (inventionVector != null) {
            List<VectorIndex.ClaimNeighbor> claimNeighbors = lookup(() -> vectorIndex.nearestClaims(inventionVector, candidateCount, null));
            if (claimNeighbors != null) {
                claimNeighbors.forEach(n -> candidateIds.add(n.patentId()));
            }
            List<VectorIndex.Neighbor> patentNeighbors = lookup(() -> vectorIndex.nearestNeighbors(inventionVector, candidateCount));
            if (patentNeighbors != null) {
                patentNeighbors.forEach(n -> candidateIds.add(n.patentId()));
            }
            indexAvailable = claimNeighbors != null && patentNeighbors != null;
        }
        candidateIds.addAll(topFuzzyPatents(description, candidateCount, null));

        Map<String, Patent> patents = catalog.findAllById(candidateIds);
        Map<String, List<Claim>> storedClaims = catalog.findClaimsByPatentIds(patents.keySet());

        // One outage check per request, not one retry budget per candidate
        AtomicBoolean embeddingAvailable = new AtomicBoolean(inventionVector != null);
        List<BlockingPatent> blocking = new ArrayList<>();
        for (Patent patent : patents.values()) {
            List<Claim> claims = storedClaims.getOrDefault(patent.getId(), List.of());
            if (claims.isEmpty()) {
                claims = claimService.withEmbeddings(claimService.resolveClaims(patent), embeddingAvailable);
            }
            BlockingPatent candidate = assess(invention, patent, claims);
            if (candidate != null) {
                blocking.add(candidate);
            }
        }

        blocking.sort(Comparator.comparingDouble(BlockingPatent::getHighestSimilarity).reversed()
            .thenComparing(b -> b.getPatent().getId()));
        List<BlockingPatent> ranked = List.copyOf(blocking.subList(0, Math.min(limit, blocking.size())));

        ExplanationResult analysis = null;
        if (analyse && !ranked.isEmpty()) {
            analysis = analyse(description, ranked);
        }

        boolean degraded = !indexAvailable || !embeddingAvailable.get()
            || ranked.stream().flatMap(b -> b.getBlockingClaims().stream()).anyMatch(ClaimMatch::isDegraded);

        log.info("Prior art search over {} candidates found {} blocking patents in {} ms{}",
            patents.size(), ranked.size(), System.currentTimeMillis() - start,
            degraded ? " (degraded)" : "");

        return PriorArtReport.builder()
            .querySummary(description.length() > QUERY_SUMMARY_CHARS
                ? description.substring(0, QUERY_SUMMARY_CHARS) + "..."
                : description)
            .patentsSearched(catalog.count())
            .blockingPatents(ranked)
            .analysis(analysis)
            .degraded(degraded)
            .build();
    }

    /**
     * Blocking claims of one patent, or null when none comes close enough
     */
    private BlockingPatent assess(Claim invention, Patent patent, List<Claim> claims) {
        double weight = config.getDefaultVectorWeight();
        List<ClaimMatch> matches = new ArrayList<>();
        for (Claim claim : claims) {
            HybridScore score = claimMatcher.scorePair(invention, claim, weight);
            if (score.combinedScore() < config.getClaimSimilarityFloor()) {
                continue;
            }
            matches.add(ClaimMatch.builder()
                .sourceClaim(invention)
                .targetClaim(claim)
                .similarity(score.combinedScore())
                .riskLevel(riskClassifier.classify(score.combinedScore()))
                .degraded(score.degraded())
                .build());
        }
        if (matches.isEmpty()) {
            return null;
        }

        matches.sort(BY_SIMILARITY);
        List<ClaimMatch> top = List.copyOf(matches.subList(0, Math.min(config.getBlockingClaimsPerPatent(), matches.size())));
        double highest = top.get(0).getSimilarity();
        if (highest < config.getBlockingPatentFloor()) {
            return null;
        }

        return BlockingPatent.builder()
            .patent(patent)
            .blockingClaims(top)
            .highestSimilarity(highest)
            .overallRisk(riskAggregator.aggregate(top).overallRisk())
            .build();
    }

    /**
     * Score an invention description against every claim of one patent, for a closer look at a
     * patent found by {@link #priorArtSearch}. Unlike the search, no claim is dropped for a low score.
     */
    public InventionClaimComparison compareInventionToClaims(String inventionDescription, String patentId) {
        RequestValidator.validateInventionDescription(inventionDescription, config.getMinClaimCompareDescriptionLength(), "inventionDescription");
        RequestValidator.validateRequired(patentId, "patentId", "to compare the invention against");

        Patent patent = catalog.findById(patentId)
            .orElseThrow(() -> new PatentNotFoundException("patentId", patentId));

        String description = inventionDescription.strip();
        double[] inventionVector = embed(description, "invention embedding");
        Claim invention = Claim.builder()
            .claimNumber(1)
            .text(description)
            .independent(true)
            .embedding(inventionVector)
            .build();

        AtomicBoolean embeddingAvailable = new AtomicBoolean(inventionVector != null);
        List<Claim> claims = claimService.withEmbeddings(claimService.resolveClaims(patent), embeddingAvailable);

        double weight = config.getDefaultVectorWeight();
        List<ClaimMatch> comparisons = new ArrayList<>(claims.size());
        for (Claim claim : claims) {
            HybridScore score = claimMatcher.scorePair(invention, claim, weight);
            comparisons.add(ClaimMatch.builder()
                .sourceClaim(invention)
                .targetClaim(claim)
                .similarity(score.combinedScore())
                .riskLevel(riskClassifier.classify(score.combinedScore()))
                .degraded(score.degraded())
                .build());
        }
        comparisons.sort(BY_SIMILARITY);

        int highRisk = (int) comparisons.stream().filter(m -> m.getRiskLevel() == RiskLevel.HIGH).count();
        boolean degraded = !embeddingAvailable.get() || comparisons.stream().anyMatch(ClaimMatch::isDegraded);
        log.info("Compared invention against {} claims of {}: {} at high risk{}",
            claims.size(), patentId, highRisk, degraded ? " (degraded)" : "");

        return InventionClaimComparison.builder()
            .patent(patent)
            .totalClaims(claims.size())
            .highRiskClaims(highRisk)
            .claimComparisons(List.copyOf(comparisons))
            .degraded(degraded)
            .build();
    }

    /**
     * Stored claims most similar to the given claim text
     */
    public List<SimilarClaim> findSimilarClaims(String claimText, Integer limit, String excludePatentId) {
        RequestValidator.validateRequired(claimText, "claimText", "for similar claim search");
        RequestValidator.validateLimit(limit, config.getMaxSearchLimit(), "limit");

        String text = claimText.strip();
        int effectiveLimit = limit != null ? limit : DEFAULT_SIMILAR_CLAIMS_LIMIT;
        double[] vector = embed(text, "claim query embedding");
        Claim query = Claim.builder().claimNumber(1).text(text).independent(true).embedding(vector).build();

        List<VectorIndex.ClaimNeighbor> neighbors = vector != null
            ? lookup(() -> vectorIndex.nearestClaims(vector, effectiveLimit * config.getCandidateMultiplier(), excludePatentId))
            : null;

        Set<String> patentIds = new LinkedHashSet<>();
        if (neighbors != null) {
            neighbors.forEach(n -> patentIds.add(n.patentId()));
        } else {
            patentIds.addAll(topFuzzyPatents(text, 2 * effectiveLimit, excludePatentId));
        }

        Map<String, Patent> patents = catalog.findAllById(patentIds);
        Map<String, List<Claim>> claimsByPatent = catalog.findClaimsByPatentIds(patents.keySet());

        List<SimilarClaim> results = new ArrayList<>();
        for (Patent patent : patents.values()) {
            for (Claim claim : claimsByPatent.getOrDefault(patent.getId(), List.of())) {
                if (neighbors != null && neighbors.stream().noneMatch(n ->
                        n.patentId().equals(claim.getPatentId()) && n.claimNumber() == claim.getClaimNumber())) {
                    continue;
                }
                HybridScore score = claimMatcher.scorePair(query, claim, config.getDefaultVectorWeight());
                results.add(new SimilarClaim(claim, patent.getTitle(), patent.getPatentNumber(),
                    score.vectorScore(), score.fuzzyScore(), score.combinedScore(),
                    riskClassifier.classify(score.combinedScore())));
            }
        }

        results.sort(SIMILAR_CLAIM_ORDER);
        return List.copyOf(results.subList(0, Math.min(effectiveLimit, results.size())));
    }

    private List<String> topFuzzyPatents(String text, int count, String excludePatentId) {
        return catalog.fuzzyCandidates(config.getFuzzyCandidatePool()).stream()
            .filter(p -> excludePatentId == null || !excludePatentId.equals(p.getId()))
            .map(p -> Map.entry(p.getId(), FuzzySimilarity.similarity(text, p.searchableText())))
            .filter(e -> e.getValue() > 0.0)
            .sorted(Map.Entry.<String, Double>comparingByValue().reversed().thenComparing(Map.Entry.<String, Double>comparingByKey()))
            .limit(count)
            .map(Map.Entry::getKey)
            .toList();
    }

    private double[] embed(String text, String operation) {
        try {
            return invoker.invoke(operation, () -> embeddingClient.embed(text),
                e -> new EmbeddingUnavailableException("Embedding failed: " + e.getMessage(), e));
        } catch (EngineException e) {
            if (!e.isRecoverable()) {
                throw e;
            }
            log.warn("{} unavailable, falling back to fuzzy only: {}", operation, e.getMessage());
            return null;
        }
    }

    private <T> T lookup(Callable<T> call) {
        try {
            return invoker.invoke("vector index lookup", call,
                e -> new EmbeddingUnavailableException("Vector index lookup failed: " + e.getMessage(), e));
        } catch (EngineException e) {
            if (!e.isRecoverable()) {
                throw e;
            }
            log.warn("Vector index unavailable: {}", e.getMessage());
            return null;
        }
    }

    private ExplanationResult analyse(String description, List<BlockingPatent> blocking) {
        try {
            return invoker.invoke("prior art explanation", () -> explanationClient.explainPriorArt(description, blocking),
                e -> new ExplanationUnavailableException("Prior art analysis failed: " + e.getMessage(), e));
        } catch (EngineException e) {
            if (!e.isRecoverable()) {
                throw e;
            }
            log.warn("Prior art analysis unavailable, returning matches only: {}", e.getMessage());
            return null;
        }
    }
}
