package de.leipzig.htwk.patentrisk.service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.stereotype.Service;

import de.leipzig.htwk.patentrisk.client.EmbeddingClient;
import de.leipzig.htwk.patentrisk.client.ExplanationClient;
import de.leipzig.htwk.patentrisk.client.PatentCatalog;
import de.leipzig.htwk.patentrisk.config.ExplanationServiceConfig;
import de.leipzig.htwk.patentrisk.config.RiskEngineConfig;
import de.leipzig.htwk.patentrisk.exception.EmbeddingUnavailableException;
import de.leipzig.htwk.patentrisk.exception.EngineException;
import de.leipzig.htwk.patentrisk.exception.ExplanationUnavailableException;
import de.leipzig.htwk.patentrisk.exception.PatentNotFoundException;
import de.leipzig.htwk.patentrisk.model.Claim;
import de.leipzig.htwk.patentrisk.model.ClaimMatch;
import de.leipzig.htwk.patentrisk.model.ComparisonReport;
import de.leipzig.htwk.patentrisk.model.ExplanationResult;
import de.leipzig.htwk.patentrisk.model.HybridScore;
import de.leipzig.htwk.patentrisk.model.Patent;
import de.leipzig.htwk.patentrisk.model.RiskAssessment;
import de.leipzig.htwk.patentrisk.service.cache.CacheKeys;
import de.leipzig.htwk.patentrisk.service.cache.ResultCache;
import de.leipzig.htwk.patentrisk.service.claims.ClaimMatcher;
import de.leipzig.htwk.patentrisk.service.risk.RiskAggregator;
import de.leipzig.htwk.patentrisk.service.risk.RiskClassifier;
import de.leipzig.htwk.patentrisk.service.similarity.FuzzySimilarity;
import de.leipzig.htwk.patentrisk.service.similarity.ScoreCombiner;
import de.leipzig.htwk.patentrisk.service.similarity.VectorSimilarity;
import de.leipzig.htwk.patentrisk.validation.RequestValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Infringement risk between two patents, either on whole documents or claim by claim.
 * <p>
 * The numeric verdict never depends on the explanation service: its prose is merged into a
 * finished report and a failed explanation only leaves the prose fields at their defaults.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatentComparisonService {

    private final PatentCatalog catalog;
    private final PatentClaimService claimService;
    private final ClaimMatcher claimMatcher;
    private final RiskClassifier riskClassifier;
    private final RiskAggregator riskAggregator;
    private final ScoreCombiner scoreCombiner;
    private final EmbeddingClient embeddingClient;
    private final ExplanationClient explanationClient;
    private final CollaboratorInvoker invoker;
    private final ResultCache resultCache;
    private final RiskEngineConfig config;
    private final ExplanationServiceConfig explanationConfig;

    /**
     * Document-level comparison: one score over title and abstract, aggregated as if each
     * patent were a single independent claim.
     */
    public ComparisonReport compare(String sourcePatentId, String targetPatentId) {
        Patent source = loadPatent(sourcePatentId, "sourcePatentId");
        Patent target = loadPatent(targetPatentId, "targetPatentId");

        return resultCache.computeIfAbsent(
            CacheKeys.compare(source.getId(), target.getId()),
            () -> doCompare(source, target),
            report -> isCacheable(report, explanationClient.isEnabled()));
    }

    public ComparisonReport compareClaims(String sourcePatentId, String targetPatentId, boolean includeExplanation, Double vectorWeight) {
        Patent source = loadPatent(sourcePatentId, "sourcePatentId");
        Patent target = loadPatent(targetPatentId, "targetPatentId");
        double weight = scoreCombiner.resolveWeight(vectorWeight);
        boolean explain = includeExplanation && explanationClient.isEnabled();

        return resultCache.computeIfAbsent(
            CacheKeys.compareClaims(source.getId(), target.getId(), includeExplanation, weight),
            () -> doCompareClaims(source, target, explain, weight),
            report -> isCacheable(report, explain));
    }

    private ComparisonReport doCompare(Patent source, Patent target) {
        HybridScore score = documentScore(source, target);

        Claim sourceDocument = documentClaim(source);
        Claim targetDocument = documentClaim(target);
        List<ClaimMatch> documentMatches = new ArrayList<>();
        if (score.combinedScore() >= config.getClaimSimilarityFloor()) {
            documentMatches.add(ClaimMatch.builder()
                .sourceClaim(sourceDocument)
                .targetClaim(targetDocument)
                .similarity(score.combinedScore())
                .riskLevel(riskClassifier.classify(score.combinedScore()))
                .degraded(score.degraded())
                .build());
        }
        RiskAssessment assessment = riskAggregator.aggregate(documentMatches);

        ComparisonReport report = baseReport(source, target, assessment, documentMatches.size())
            .documentScore(score)
            .degraded(score.degraded())
            .build();

        log.info("Compared patents {} and {}: combined {} (vector {}, fuzzy {}), risk {}",
            source.getId(), target.getId(), format(score.combinedScore()), format(score.vectorScore()),
            format(score.fuzzyScore()), assessment.overallRisk());

        if (!explanationClient.isEnabled()) {
            return report;
        }
        ExplanationResult explanation = explain(() -> explanationClient.explainComparison(source, target, List.of()), source, target);
        return explanation != null ? applyExplanation(report, explanation) : report;
    }

    private ComparisonReport doCompareClaims(Patent source, Patent target, boolean explain, double weight) {
        long start = System.currentTimeMillis();

        AtomicBoolean embeddingAvailable = new AtomicBoolean(true);
        List<Claim> sourceClaims = claimService.withEmbeddings(claimService.resolveClaims(source), embeddingAvailable);
        List<Claim> targetClaims = claimService.withEmbeddings(claimService.resolveClaims(target), embeddingAvailable);

        if (sourceClaims.isEmpty() || targetClaims.isEmpty()) {
            log.warn("No claims for {} - cannot compare claims of {} and {}",
                sourceClaims.isEmpty() ? source.getId() : target.getId(), source.getId(), target.getId());
            RiskAssessment empty = riskAggregator.aggregate(List.of());
            return baseReport(source, target, empty, 0)
                .sourceClaimsCount(sourceClaims.size())
                .targetClaimsCount(targetClaims.size())
                .summary("Claims are missing for one or both patents, so no claim-level comparison was possible.")
                .recommendation("Manual review recommended.")
                .build();
        }

        List<ClaimMatch> matches = claimMatcher.match(sourceClaims, targetClaims, weight);
        RiskAssessment assessment = riskAggregator.aggregate(matches);
        boolean degraded = sourceClaims.stream().anyMatch(c -> !c.hasEmbedding())
            || targetClaims.stream().anyMatch(c -> !c.hasEmbedding());

        ComparisonReport report = baseReport(source, target, assessment, matches.size())
            .topMatches(matches)
            .sourceClaimsCount(sourceClaims.size())
            .targetClaimsCount(targetClaims.size())
            .degraded(degraded)
            .build();

        log.info("Compared {} x {} claims of {} and {} in {} ms: {} matches, risk {}, {} independent claim(s) at risk",
            sourceClaims.size(), targetClaims.size(), source.getId(), target.getId(), System.currentTimeMillis() - start,
            matches.size(), assessment.overallRisk(), assessment.independentClaimsAtRisk());

        if (!explain || matches.isEmpty()) {
            return report;
        }
        List<ClaimMatch> presented = matches.subList(0, Math.min(explanationConfig.getMaxMatchesInPrompt(), matches.size()));
        ExplanationResult explanation = explain(() -> explanationClient.explainComparison(source, target, presented), source, target);
        return explanation != null ? applyExplanation(report, explanation) : report;
    }

    /**
     * Merge prose into a finished report. Match assessments are applied in order to the matches
     * that were presented; the numeric fields stay as computed.
     */
    static ComparisonReport applyExplanation(ComparisonReport report, ExplanationResult explanation) {
        List<ClaimMatch> matches = new ArrayList<>(report.getTopMatches());
        List<String> assessments = explanation.getMatchAssessments();
        for (int i = 0; i < Math.min(assessments.size(), matches.size()); i++) {
            matches.set(i, matches.get(i).withOverlapAssessment(assessments.get(i)));
        }

        ComparisonReport.ComparisonReportBuilder builder = report.toBuilder()
            .topMatches(List.copyOf(matches))
            .keyRisks(explanation.getKeyRisks())
            .designAroundSuggestions(explanation.getDesignAroundSuggestions())
            .explained(true);
        if (explanation.getSummary() != null && !explanation.getSummary().isBlank()) {
            builder.summary(explanation.getSummary());
        }
        if (explanation.getRecommendation() != null && !explanation.getRecommendation().isBlank()) {
            builder.recommendation(explanation.getRecommendation());
        }
        return builder.build();
    }

    private ExplanationResult explain(Callable<ExplanationResult> call, Patent source, Patent target) {
        try {
            return invoker.invoke("comparison explanation", call,
                e -> new ExplanationUnavailableException("Explanation failed: " + e.getMessage(), e));
        } catch (EngineException e) {
            if (!e.isRecoverable()) {
                throw e;
            }
            log.warn("Explanation unavailable for {} vs {}, returning numeric report only: {}",
                source.getId(), target.getId(), e.getMessage());
            return null;
        }
    }

    private HybridScore documentScore(Patent source, Patent target) {
        double fuzzy = FuzzySimilarity.similarity(source.searchableText(), target.searchableText());
        double[] sourceVector = documentVector(source);
        double[] targetVector = sourceVector != null ? documentVector(target) : null;
        if (sourceVector == null || targetVector == null) {
            return scoreCombiner.fuzzyOnly(fuzzy);
        }
        double vector = VectorSimilarity.similarity(sourceVector, targetVector);
        return scoreCombiner.combine(vector, fuzzy, null);
    }

    private double[] documentVector(Patent patent) {
        if (patent.hasEmbedding()) {
            return patent.getEmbedding();
        }
        try {
            return invoker.invoke("document embedding", () -> embeddingClient.embed(patent.searchableText()),
                e -> new EmbeddingUnavailableException("Document embedding failed: " + e.getMessage(), e));
        } catch (EngineException e) {
            if (!e.isRecoverable()) {
                throw e;
            }
            log.warn("No vector for patent {}, comparing on text only: {}", patent.getId(), e.getMessage());
            return null;
        }
    }

    private static Claim documentClaim(Patent patent) {
        return Claim.builder()
            .patentId(patent.getId())
            .claimNumber(1)
            .text(patent.searchableText())
            .independent(true)
            .build();
    }

    private ComparisonReport.ComparisonReportBuilder baseReport(Patent source, Patent target, RiskAssessment assessment, int matchCount) {
        return ComparisonReport.builder()
            .sourcePatentId(source.getId())
            .targetPatentId(target.getId())
            .overallRisk(assessment.overallRisk())
            .independentClaimsAtRisk(assessment.independentClaimsAtRisk())
            .highestSimilarity(assessment.highestSimilarity())
            .averageSimilarity(assessment.averageSimilarity())
            .freedomToOperate(assessment.freedomToOperate())
            .summary(riskAggregator.defaultSummary(assessment, matchCount))
            .recommendation(riskAggregator.defaultRecommendation(assessment));
    }

    private Patent loadPatent(String patentId, String field) {
        RequestValidator.validateRequired(patentId, field, "for comparison");
        return catalog.findById(patentId).orElseThrow(() -> new PatentNotFoundException(field, patentId));
    }

    // Degraded or unexplained-on-request reports are recomputed so a recovered collaborator shows up
    private static boolean isCacheable(ComparisonReport report, boolean explanationWanted) {
        if (report.isDegraded()) {
            return false;
        }
        boolean needsExplanation = explanationWanted && (report.getDocumentScore() != null || !report.getTopMatches().isEmpty());
        return !needsExplanation || report.isExplained();
    }

    private static String format(double value) {
        return String.format("%.3f", value);
    }
}
