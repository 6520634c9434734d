package de.leipzig.htwk.patentrisk.service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.stereotype.Service;

import de.leipzig.htwk.patentrisk.client.EmbeddingClient;
import de.leipzig.htwk.patentrisk.client.PatentCatalog;
import de.leipzig.htwk.patentrisk.exception.EmbeddingUnavailableException;
import de.leipzig.htwk.patentrisk.exception.EngineException;
import de.leipzig.htwk.patentrisk.exception.PatentNotFoundException;
import de.leipzig.htwk.patentrisk.model.Claim;
import de.leipzig.htwk.patentrisk.model.Patent;
import de.leipzig.htwk.patentrisk.service.claims.ClaimExtractor;
import de.leipzig.htwk.patentrisk.validation.RequestValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Claims of a patent: the stored ones when the catalog has them, otherwise extracted from the
 * raw claims text on the fly.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PatentClaimService {

    private final PatentCatalog catalog;
    private final ClaimExtractor claimExtractor;
    private final EmbeddingClient embeddingClient;
    private final CollaboratorInvoker invoker;

    public List<Claim> getClaims(String patentId) {
        RequestValidator.validateRequired(patentId, "patentId", "to list claims");
        Patent patent = catalog.findById(patentId)
            .orElseThrow(() -> new PatentNotFoundException("patentId", patentId));
        return resolveClaims(patent);
    }

    public List<Claim> resolveClaims(Patent patent) {
        List<Claim> stored = catalog.findClaims(patent.getId());
        if (!stored.isEmpty()) {
            return stored;
        }
        List<Claim> extracted = claimExtractor.extract(patent.getId(), patent.getClaimsText());
        log.debug("Extracted {} claims from text of patent {}", extracted.size(), patent.getId());
        return extracted;
    }

    /**
     * Fill in missing claim embeddings. Stops embedding at the first unavailable call and returns
     * the remaining claims without a vector, so they get scored on text alone.
     */
    public List<Claim> withEmbeddings(List<Claim> claims) {
        return withEmbeddings(claims, new AtomicBoolean(true));
    }

    /**
     * Same as {@link #withEmbeddings(List)}, with the availability flag shared by all calls of one
     * request. Once a call finds the embedding service down, later calls skip it instead of running
     * the retry budget again; callers read the flag to mark their result degraded.
     */
    public List<Claim> withEmbeddings(List<Claim> claims, AtomicBoolean embeddingAvailable) {
        List<Claim> result = new ArrayList<>(claims.size());
        for (Claim claim : claims) {
            if (claim.hasEmbedding() || !embeddingAvailable.get()) {
                result.add(claim);
                continue;
            }
            try {
                double[] vector = invoker.invoke("claim embedding",
                    () -> embeddingClient.embed(embeddingText(claim)),
                    e -> new EmbeddingUnavailableException("Claim embedding failed: " + e.getMessage(), e));
                result.add(claim.toBuilder().embedding(vector).build());
            } catch (EngineException e) {
                if (!e.isRecoverable()) {
                    throw e;
                }
                log.warn("Embedding unavailable for claims of patent {}, scoring the rest on text: {}",
                    claim.getPatentId(), e.getMessage());
                embeddingAvailable.set(false);
                result.add(claim);
            }
        }
        return result;
    }

    // Same prefix the ingestion side uses for stored claim vectors
    static String embeddingText(Claim claim) {
        return "Patent Claim " + claim.getClaimNumber() + ": " + claim.getText();
    }
}
