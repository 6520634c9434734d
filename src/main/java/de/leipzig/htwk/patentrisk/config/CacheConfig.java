package de.leipzig.htwk.patentrisk.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.github.benmanes.caffeine.cache.Caffeine;

import de.leipzig.htwk.patentrisk.service.cache.CaffeineResultCache;
import de.leipzig.htwk.patentrisk.service.cache.NoOpResultCache;
import de.leipzig.htwk.patentrisk.service.cache.ResultCache;
import lombok.extern.slf4j.Slf4j;

/**
 * Result cache for searches and comparisons. Entries expire after a short TTL because
 * the embeddings and claims behind a cached result can change underneath it.
 */
@Configuration
@Slf4j
public class CacheConfig {

    @Bean
    public ResultCache resultCache(CacheProperties properties) {
        if (!properties.isEnabled()) {
            log.info("Result cache disabled");
            return new NoOpResultCache();
        }
        log.info("Result cache enabled (ttl: {}, max entries: {})", properties.getTtl(), properties.getMaxEntries());
        return new CaffeineResultCache(Caffeine.newBuilder()
                .maximumSize(properties.getMaxEntries())
                .expireAfterWrite(properties.getTtl())
                .build());
    }
}
