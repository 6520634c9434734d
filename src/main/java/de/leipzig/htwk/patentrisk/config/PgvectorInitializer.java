package de.leipzig.htwk.patentrisk.config;

import javax.sql.DataSource;

import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import de.leipzig.htwk.patentrisk.client.EmbeddingClient;
import lombok.extern.slf4j.Slf4j;

/**
 * Verifies pgvector is usable before any repository issues a {@code <=>} query,
 * and that the stored patent embeddings have the dimension the embedding service produces.
 */
@Component
@Slf4j
public class PgvectorInitializer implements InitializingBean {

    private final JdbcTemplate jdbcTemplate;
    private final EmbeddingClient embeddingClient;

    @Value("${patent.database.create-extension:false}")
    private boolean createExtension;

    @Autowired
    public PgvectorInitializer(DataSource dataSource, EmbeddingClient embeddingClient) {
        this(new JdbcTemplate(dataSource), embeddingClient);
    }

    PgvectorInitializer(JdbcTemplate jdbcTemplate, EmbeddingClient embeddingClient) {
        this.jdbcTemplate = jdbcTemplate;
        this.embeddingClient = embeddingClient;
    }

    @Override
    public void afterPropertiesSet() throws Exception {
        try {
            if (createExtension) {
                log.info("Installing pgvector extension");
                jdbcTemplate.execute("CREATE EXTENSION IF NOT EXISTS vector");
            }

            jdbcTemplate.execute("SELECT '[1,2,3]'::vector");
            log.info("pgvector extension available");

        } catch (Exception e) {
            log.error("pgvector extension not available: {}", e.getMessage());
            log.error("Make sure the catalog database runs a pgvector image (e.g. pgvector/pgvector:pg16)");
            throw new RuntimeException("pgvector extension is required but not available", e);
        }

        checkStoredDimensions();
    }

    /**
     * @return false only when stored vectors are known to differ from what the embedding client produces
     */
    boolean checkStoredDimensions() {
        int expected = embeddingClient.dimensions();
        try {
            Integer stored = jdbcTemplate.queryForObject(
                "SELECT vector_dims(embedding) FROM patents WHERE embedding IS NOT NULL LIMIT 1", Integer.class);
            if (stored != null && stored != expected) {
                log.warn("Stored patent embeddings have {} dimensions but the embedding service produces {}; "
                        + "vector comparisons against these patents will fail", stored, expected);
                return false;
            }
        } catch (EmptyResultDataAccessException e) {
            log.info("No stored patent embeddings yet");
        } catch (Exception e) {
            log.warn("Could not verify stored embedding dimensions: {}", e.getMessage());
        }
        return true;
    }
}
