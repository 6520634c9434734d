package de.leipzig.htwk.patentrisk.client;

import java.util.List;

/**
 * Approximate nearest-neighbour lookup over stored patent and claim vectors.
 * Raw scores are cosine similarities in [-1,1], best first.
 */
public interface VectorIndex {

    record Neighbor(String patentId, double rawScore) {
    }

    record ClaimNeighbor(String patentId, int claimNumber, double rawScore) {
    }

    List<Neighbor> nearestNeighbors(double[] vector, int k);

    /**
     * @param excludePatentId claims of this patent are skipped, may be null
     */
    List<ClaimNeighbor> nearestClaims(double[] vector, int k, String excludePatentId);
}
