package de.leipzig.htwk.patentrisk.service.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CacheKeysTest {

    @Test
    void whitespaceVariantsShareAKey() {
        assertEquals(CacheKeys.search("video  compression\n", 0.7, 10), CacheKeys.search(" video compression", 0.7, 10));
    }

    @Test
    void everyParameterIsPartOfTheKey() {
        String base = CacheKeys.search("video compression", 0.7, 10);

        assertNotEquals(base, CacheKeys.search("Video compression", 0.7, 10));
        assertNotEquals(base, CacheKeys.search("video compression", 0.6, 10));
        assertNotEquals(base, CacheKeys.search("video compression", 0.7, 11));
        assertNotEquals(CacheKeys.compareClaims("a", "b", true, 0.7), CacheKeys.compareClaims("a", "b", false, 0.7));
        assertNotEquals(CacheKeys.compare("a", "b"), CacheKeys.compare("b", "a"));
    }

    @Test
    void weightsAreComparedAtFourDecimals() {
        assertEquals(CacheKeys.search("q", 0.70001, 5), CacheKeys.search("q", 0.7, 5));
    }

    @Test
    void operationsDoNotCollide() {
        assertNotEquals(CacheKeys.compare("a", "b"), CacheKeys.compareClaims("a", "b", false, 0.7));
        assertTrue(CacheKeys.priorArt("an invention", 20, true).startsWith("priorart:"));
    }

    @Test
    void keyIsPrefixedSha256() {
        String key = CacheKeys.compare("a", "b");
        assertTrue(key.matches("compare:[0-9a-f]{64}"));
    }
}
