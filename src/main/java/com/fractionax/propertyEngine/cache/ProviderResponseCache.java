package com.fractionax.propertyEngine.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Caffeine cache for one kind of provider response (structure, valuation, images, ...),
 * with a fixed TTL.
 *
 * A loader returning null stores nothing, so "not found" answers are asked again next time.
 * Concurrent loads of one key run once; a loader exception propagates and stores nothing.
 */
@Slf4j
public class ProviderResponseCache<K, V> {

    private final String name;
    private final Cache<K, V> entries;

    public ProviderResponseCache(String name, Duration ttl, long maximumSize, Clock clock) {
        this.name = name;
        this.entries = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfterWrite(ttl)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .build();
        log.info("Provider response cache created - name: {}, ttl: {}, maximumSize: {}", name, ttl, maximumSize);
    }

    /**
     * Returns the cached value for a key, loading and storing it on a miss.
     *
     * @param key Cache key
     * @param loader Provider call producing the value, or null when there is nothing to cache
     * @return Cached or freshly loaded value, or null
     */
    public V get(K key, Function<? super K, ? extends V> loader) {
        return entries.get(key, k -> {
            log.debug("Provider cache miss - cache: {}, key: {}", name, k);
            return loader.apply(k);
        });
    }

    public void clear() {
        entries.invalidateAll();
        entries.cleanUp();
    }

    public long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }
}
