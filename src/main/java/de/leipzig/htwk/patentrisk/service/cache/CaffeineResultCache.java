package de.leipzig.htwk.patentrisk.service.cache;

import java.util.function.Predicate;
import java.util.function.Supplier;

import com.github.benmanes.caffeine.cache.Cache;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * In-process cache backed by Caffeine. The loader runs outside the cache so a slow
 * computation never blocks readers of other keys.
 */
@Slf4j
@RequiredArgsConstructor
public class CaffeineResultCache implements ResultCache {

    private final Cache<String, Object> cache;

    @Override
    @SuppressWarnings("unchecked")
    public <T> T computeIfAbsent(String key, Supplier<T> loader, Predicate<? super T> cacheable) {
        Object cached = cache.getIfPresent(key);
        if (cached != null) {
            log.debug("Cache hit for {}", key);
            return (T) cached;
        }

        T value = loader.get();
        if (value != null && cacheable.test(value)) {
            cache.put(key, value);
        } else {
            log.debug("Result for {} not cached", key);
        }
        return value;
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
    }
}
