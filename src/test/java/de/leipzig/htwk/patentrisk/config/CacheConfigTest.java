package de.leipzig.htwk.patentrisk.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import de.leipzig.htwk.patentrisk.service.cache.CaffeineResultCache;
import de.leipzig.htwk.patentrisk.service.cache.NoOpResultCache;
import de.leipzig.htwk.patentrisk.service.cache.ResultCache;

class CacheConfigTest {

    private final CacheConfig config = new CacheConfig();
    private final AtomicInteger loads = new AtomicInteger();

    @Test
    void enabledCacheIsBoundedCaffeine() {
        CacheProperties properties = new CacheProperties();
        properties.setTtl(Duration.ofMinutes(1));
        properties.setMaxEntries(10);

        ResultCache cache = config.resultCache(properties);

        assertInstanceOf(CaffeineResultCache.class, cache);
        cache.computeIfAbsent("k", loads::incrementAndGet, value -> true);
        cache.computeIfAbsent("k", loads::incrementAndGet, value -> true);
        assertEquals(1, loads.get());
    }

    @Test
    void disabledCacheAlwaysComputes() {
        CacheProperties properties = new CacheProperties();
        properties.setEnabled(false);

        ResultCache cache = config.resultCache(properties);

        assertInstanceOf(NoOpResultCache.class, cache);
        cache.computeIfAbsent("k", loads::incrementAndGet, value -> true);
        cache.computeIfAbsent("k", loads::incrementAndGet, value -> true);
        assertEquals(2, loads.get());
    }
}
