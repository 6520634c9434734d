package de.leipzig.htwk.patentrisk.controller;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.context.request.async.DeferredResult;

import de.leipzig.htwk.patentrisk.config.RiskEngineConfig;
import de.leipzig.htwk.patentrisk.exception.CollaboratorTimeoutException;
import de.leipzig.htwk.patentrisk.model.Claim;
import de.leipzig.htwk.patentrisk.model.ComparisonReport;
import de.leipzig.htwk.patentrisk.model.InventionClaimComparison;
import de.leipzig.htwk.patentrisk.model.PriorArtReport;
import de.leipzig.htwk.patentrisk.model.SearchResult;
import de.leipzig.htwk.patentrisk.model.SimilarClaim;
import de.leipzig.htwk.patentrisk.model.Requests.CompareClaimsRequest;
import de.leipzig.htwk.patentrisk.model.Requests.CompareRequest;
import de.leipzig.htwk.patentrisk.model.Requests.CompareToClaimsRequest;
import de.leipzig.htwk.patentrisk.model.Requests.PriorArtSearchRequest;
import de.leipzig.htwk.patentrisk.model.Requests.SearchRequest;
import de.leipzig.htwk.patentrisk.model.Requests.SimilarClaimsRequest;
import de.leipzig.htwk.patentrisk.service.PatentClaimService;
import de.leipzig.htwk.patentrisk.service.PatentComparisonService;
import de.leipzig.htwk.patentrisk.service.PatentSearchService;
import de.leipzig.htwk.patentrisk.service.PriorArtService;
import de.leipzig.htwk.patentrisk.service.cache.ResultCache;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Controller that publishes the patent search, comparison and prior art endpoints
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class PatentRiskController {

    private final PatentSearchService searchService;
    private final PatentComparisonService comparisonService;
    private final PriorArtService priorArtService;
    private final PatentClaimService claimService;
    private final ResultCache resultCache;
    private final RiskEngineConfig config;

    @Qualifier("requestExecutor")
    private final ExecutorService requestExecutor;

    /**
     * Hybrid search over title and abstract
     */
    @PostMapping("/patents/search")
    public ResponseEntity<Map<String, Object>> search(@Valid @RequestBody SearchRequest request) {
        log.info("Searching patents (limit: {}, vectorWeight: {})", request.getLimit(), request.getVectorWeight());

        List<SearchResult> results = searchService.search(request.getQuery(), request.getLimit(), request.getVectorWeight());

        return ResponseEntity.ok(Map.of(
            "success", true,
            "query", request.getQuery(),
            "count", results.size(),
            "degraded", results.stream().anyMatch(SearchResult::degraded),
            "results", results
        ));
    }

    /**
     * Document-level comparison of two patents
     */
    @PostMapping("/patents/compare")
    public ResponseEntity<Map<String, Object>> compare(@Valid @RequestBody CompareRequest request) {
        ComparisonReport report = comparisonService.compare(request.getSourcePatentId(), request.getTargetPatentId());
        return ResponseEntity.ok(Map.of("success", true, "report", report));
    }

    /**
     * Claim-by-claim comparison. Runs off the servlet thread so a client disconnect or
     * the request timeout interrupts the matrix and any pending collaborator call.
     */
    @PostMapping("/claims/compare")
    public DeferredResult<ResponseEntity<Map<String, Object>>> compareClaims(@Valid @RequestBody CompareClaimsRequest request) {
        boolean explain = !Boolean.FALSE.equals(request.getIncludeExplanation());
        return defer("compare claims", () -> {
            ComparisonReport report = comparisonService.compareClaims(
                request.getSourcePatentId(), request.getTargetPatentId(), explain, request.getVectorWeight());
            return Map.of("success", true, "report", report);
        });
    }

    @PostMapping("/prior-art/search")
    public DeferredResult<ResponseEntity<Map<String, Object>>> priorArtSearch(@Valid @RequestBody PriorArtSearchRequest request) {
        boolean analysis = !Boolean.FALSE.equals(request.getIncludeAnalysis());
        return defer("prior art search", () -> {
            PriorArtReport report = priorArtService.priorArtSearch(
                request.getInventionDescription(), request.getLimit(), analysis);
            return Map.of("success", true, "report", report);
        });
    }

    /**
     * Invention description against every claim of one patent
     */
    @PostMapping("/prior-art/compare-to-claims")
    public DeferredResult<ResponseEntity<Map<String, Object>>> compareToClaims(@Valid @RequestBody CompareToClaimsRequest request) {
        return defer("compare invention to claims", () -> {
            InventionClaimComparison comparison = priorArtService.compareInventionToClaims(
                request.getInventionDescription(), request.getPatentId());
            return Map.of("success", true, "comparison", comparison);
        });
    }

    @GetMapping("/patents/{patentId}/claims")
    public ResponseEntity<Map<String, Object>> getClaims(@PathVariable String patentId) {
        List<Claim> claims = claimService.getClaims(patentId);

        Map<String, Object> response = new HashMap<>();
        response.put("success", true);
        response.put("patentId", patentId);
        response.put("count", claims.size());
        response.put("independentCount", claims.stream().filter(Claim::isIndependent).count());
        response.put("claims", claims);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/claims/similar")
    public ResponseEntity<Map<String, Object>> findSimilarClaims(@Valid @RequestBody SimilarClaimsRequest request) {
        List<SimilarClaim> claims = priorArtService.findSimilarClaims(
            request.getClaimText(), request.getLimit(), request.getExcludePatentId());

        return ResponseEntity.ok(Map.of(
            "success", true,
            "count", claims.size(),
            "claims", claims
        ));
    }

    @DeleteMapping("/cache")
    public ResponseEntity<Map<String, Object>> clearCache() {
        resultCache.invalidateAll();
        log.info("Result cache cleared");
        return ResponseEntity.ok(Map.of("success", true, "message", "Result cache cleared"));
    }

    private DeferredResult<ResponseEntity<Map<String, Object>>> defer(String operation, Supplier<Map<String, Object>> work) {
        DeferredResult<ResponseEntity<Map<String, Object>>> result = new DeferredResult<>(config.getRequestTimeoutMillis());

        Future<?> future;
        try {
            future = requestExecutor.submit(() -> {
                try {
                    result.setResult(ResponseEntity.ok(work.get()));
                } catch (RuntimeException e) {
                    result.setErrorResult(e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Rejected {}: request pool exhausted", operation);
            result.setErrorResult(new CollaboratorTimeoutException(operation, "Server busy, retry later", e));
            return result;
        }

        result.onTimeout(() -> {
            log.warn("{} exceeded {} ms, cancelling", operation, config.getRequestTimeoutMillis());
            future.cancel(true);
            result.setErrorResult(new CollaboratorTimeoutException(operation,
                operation + " did not finish within " + config.getRequestTimeoutMillis() + " ms"));
        });
        result.onError(error -> {
            log.debug("{} aborted: {}", operation, error.getMessage());
            future.cancel(true);
        });
        return result;
    }
}
