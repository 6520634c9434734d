package de.leipzig.htwk.patentrisk.repository;

import de.leipzig.htwk.patentrisk.entity.ClaimEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface ClaimRepository extends JpaRepository<ClaimEntity, String> {

    List<ClaimEntity> findByPatentIdOrderByClaimNumberAsc(String patentId);

    List<ClaimEntity> findByPatentIdInOrderByPatentIdAscClaimNumberAsc(Collection<String> patentIds);

    @Query(value = "SELECT patent_id, claim_number, 1 - (embedding <=> CAST(:queryVector AS vector)) AS similarity " +
                   "FROM claims " +
                   "WHERE embedding IS NOT NULL " +
                   "ORDER BY embedding <=> CAST(:queryVector AS vector) " +
                   "LIMIT :limit", nativeQuery = true)
    List<Object[]> findNearestByVector(@Param("queryVector") String queryVector,
                                       @Param("limit") int limit);

    @Query(value = "SELECT patent_id, claim_number, 1 - (embedding <=> CAST(:queryVector AS vector)) AS similarity " +
                   "FROM claims " +
                   "WHERE embedding IS NOT NULL AND patent_id != :excludePatentId " +
                   "ORDER BY embedding <=> CAST(:queryVector AS vector) " +
                   "LIMIT :limit", nativeQuery = true)
    List<Object[]> findNearestByVectorExcludingPatent(@Param("queryVector") String queryVector,
                                                      @Param("excludePatentId") String excludePatentId,
                                                      @Param("limit") int limit);
}
