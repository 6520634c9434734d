package de.leipzig.htwk.patentrisk.repository;

import de.leipzig.htwk.patentrisk.entity.PatentEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PatentRepository extends JpaRepository<PatentEntity, String> {

    List<PatentEntity> findAllByOrderByCreatedAtDescIdAsc(Pageable pageable);

    @Query(value = "SELECT id, 1 - (embedding <=> CAST(:queryVector AS vector)) AS similarity " +
                   "FROM patents " +
                   "WHERE embedding IS NOT NULL " +
                   "ORDER BY embedding <=> CAST(:queryVector AS vector) " +
                   "LIMIT :limit", nativeQuery = true)
    List<Object[]> findNearestByVector(@Param("queryVector") String queryVector,
                                       @Param("limit") int limit);
}
