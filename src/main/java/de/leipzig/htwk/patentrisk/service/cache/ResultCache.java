package de.leipzig.htwk.patentrisk.service.cache;

import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Memoization of expensive searches and comparisons.
 * <p>
 * Lookups and stores are individually atomic but not serialized per key: two concurrent
 * misses on the same key may both run the loader. Results must be immutable values so a
 * hit is indistinguishable from a fresh computation.
 */
public interface ResultCache {

    /**
     * Return the cached value for {@code key}, or run {@code loader} and store its result
     * if {@code cacheable} accepts it.
     */
    <T> T computeIfAbsent(String key, Supplier<T> loader, Predicate<? super T> cacheable);

    void invalidateAll();
}
