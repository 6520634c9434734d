package de.leipzig.htwk.patentrisk.client;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import de.leipzig.htwk.patentrisk.model.Claim;
import de.leipzig.htwk.patentrisk.model.Patent;

/**
 * Read access to stored patents and their claims
 */
public interface PatentCatalog {

    Optional<Patent> findById(String patentId);

    Map<String, Patent> findAllById(Collection<String> patentIds);

    /**
     * Stored claims ordered by claim number, empty when the patent was never split into claims
     */
    List<Claim> findClaims(String patentId);

    Map<String, List<Claim>> findClaimsByPatentIds(Collection<String> patentIds);

    /**
     * Patents to score lexically, most recent first
     */
    List<Patent> fuzzyCandidates(int limit);

    long count();
}
