package de.leipzig.htwk.patentrisk.client.impl;

import java.util.List;

import org.springframework.stereotype.Component;

import de.leipzig.htwk.patentrisk.client.VectorIndex;
import de.leipzig.htwk.patentrisk.repository.ClaimRepository;
import de.leipzig.htwk.patentrisk.repository.PatentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Nearest-neighbour search with pgvector's cosine distance operator
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PgVectorIndex implements VectorIndex {

    private final PatentRepository patentRepository;
    private final ClaimRepository claimRepository;

    @Override
    public List<Neighbor> nearestNeighbors(double[] vector, int k) {
        String queryVector = VectorCodec.toVectorString(vector);
        List<Object[]> rows = patentRepository.findNearestByVector(queryVector, k);
        log.debug("pgvector returned {} patent neighbours (k={})", rows.size(), k);
        return rows.stream()
            .map(row -> new Neighbor((String) row[0], toDouble(row[1])))
            .toList();
    }

    @Override
    public List<ClaimNeighbor> nearestClaims(double[] vector, int k, String excludePatentId) {
        String queryVector = VectorCodec.toVectorString(vector);
        List<Object[]> rows = excludePatentId == null
            ? claimRepository.findNearestByVector(queryVector, k)
            : claimRepository.findNearestByVectorExcludingPatent(queryVector, excludePatentId, k);
        log.debug("pgvector returned {} claim neighbours (k={})", rows.size(), k);
        return rows.stream()
            .map(row -> new ClaimNeighbor((String) row[0], ((Number) row[1]).intValue(), toDouble(row[2])))
            .toList();
    }

    private static double toDouble(Object value) {
        return value != null ? ((Number) value).doubleValue() : 0.0;
    }
}
