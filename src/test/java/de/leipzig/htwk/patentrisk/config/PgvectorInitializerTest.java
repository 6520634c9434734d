package de.leipzig.htwk.patentrisk.config;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import de.leipzig.htwk.patentrisk.support.HashingEmbeddingClient;

class PgvectorInitializerTest {

    private final JdbcTemplate jdbcTemplate = mock(JdbcTemplate.class);
    private final PgvectorInitializer initializer = new PgvectorInitializer(jdbcTemplate, new HashingEmbeddingClient(768));

    @Test
    void storedVectorsOfTheClientDimensionPass() {
        when(jdbcTemplate.queryForObject(anyString(), eq(Integer.class))).thenReturn(768);

        assertTrue(initializer.checkStoredDimensions());
    }

    @Test
    void storedVectorsOfAnotherDimensionAreFlagged() {
        when(jdbcTemplate.queryForObject(anyString(), eq(Integer.class))).thenReturn(384);

        assertFalse(initializer.checkStoredDimensions());
    }

    @Test
    void emptyCatalogPasses() {
        when(jdbcTemplate.queryForObject(anyString(), eq(Integer.class))).thenThrow(new EmptyResultDataAccessException(1));

        assertTrue(initializer.checkStoredDimensions());
    }

    @Test
    void missingExtensionFailsStartup() {
        doThrow(new DataAccessResourceFailureException("type \"vector\" does not exist"))
            .when(jdbcTemplate).execute("SELECT '[1,2,3]'::vector");

        assertThrows(RuntimeException.class, initializer::afterPropertiesSet);
    }
}
