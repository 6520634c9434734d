package de.leipzig.htwk.patentrisk.service.cache;

import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Used when caching is switched off: every call computes
 */
public class NoOpResultCache implements ResultCache {

    @Override
    public <T> T computeIfAbsent(String key, Supplier<T> loader, Predicate<? super T> cacheable) {
        return loader.get();
    }

    @Override
    public void invalidateAll() {
        // nothing stored
    }
}
