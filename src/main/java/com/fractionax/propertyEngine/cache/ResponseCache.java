package com.fractionax.propertyEngine.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Response cache - memoizes resolved queries by fingerprint using Caffeine.
 *
 * Responsibilities:
 * - Hold entries with a per-entry TTL (general searches and address lookups differ)
 * - Treat an expired entry as a miss on read, even before Caffeine has removed it
 * - Coalesce concurrent resolutions of the same fingerprint into one
 *
 * One instance per process, created and torn down by the Spring context.
 */
@Slf4j
public class ResponseCache {

    private final Clock clock;
    private final Cache<String, CacheEntry> entries;
    private final Map<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    public ResponseCache(long maximumSize, Clock clock) {
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .expireAfter(new EntryTtlExpiry())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .removalListener((String key, CacheEntry value, RemovalCause cause) -> {
                    if (cause != RemovalCause.REPLACED) {
                        evictions.incrementAndGet();
                        log.debug("Cache entry removed - fingerprint: {}, cause: {}", key, cause);
                    }
                })
                .build();
    }

    /**
     * Returns the live entry for a fingerprint.
     *
     * @param fingerprint Query fingerprint
     * @return Entry, or empty if absent or expired
     */
    public Optional<CacheEntry> get(String fingerprint) {
        CacheEntry entry = entries.getIfPresent(fingerprint);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (entry.isExpiredAt(clock.instant())) {
            misses.incrementAndGet();
            log.debug("Cache entry expired - fingerprint: {}, expiredAt: {}", fingerprint, entry.expiresAt());
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(entry);
    }

    /**
     * Stores an entry, replacing any previous one for the fingerprint.
     */
    public void put(String fingerprint, CacheEntry entry) {
        entries.put(fingerprint, entry);
        log.debug("Cache entry stored - fingerprint: {}, ttl: {}", fingerprint, entry.getTtl());
    }

    /**
     * Drops the entry for a fingerprint.
     *
     * @return true if an entry was present
     */
    public boolean evict(String fingerprint) {
        boolean present = entries.asMap().remove(fingerprint) != null;
        if (present) {
            log.info("Cache entry evicted - fingerprint: {}", fingerprint);
        }
        return present;
    }

    /**
     * Drops every entry.
     */
    public void clear() {
        long size = entries.estimatedSize();
        entries.invalidateAll();
        entries.cleanUp();
        log.info("Cache cleared - entries: {}", size);
    }

    public CacheStats stats() {
        entries.cleanUp();
        return new CacheStats(entries.estimatedSize(), hits.get(), misses.get(), evictions.get(), inFlight.size());
    }

    /**
     * Runs a resolution for a fingerprint unless one is already running, in which case the
     * caller waits for and shares its outcome.
     *
     * @param fingerprint Query fingerprint
     * @param resolution Work producing the outcome; runs on the calling thread
     * @return Outcome of the single resolution
     */
    @SuppressWarnings("unchecked")
    public <T> T resolveOnce(String fingerprint, Supplier<T> resolution) {
        CompletableFuture<Object> mine = new CompletableFuture<>();
        CompletableFuture<Object> running = inFlight.putIfAbsent(fingerprint, mine);
        if (running != null) {
            log.debug("Joining in-flight resolution - fingerprint: {}", fingerprint);
            try {
                return (T) running.join();
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException runtimeException) {
                    throw runtimeException;
                }
                throw e;
            }
        }

        try {
            T outcome = resolution.get();
            mine.complete(outcome);
            return outcome;
        } catch (RuntimeException | Error e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(fingerprint, mine);
        }
    }

    /**
     * Clears the cache when the application context shuts down.
     */
    public void shutdown() {
        inFlight.values().forEach(future -> future.cancel(false));
        inFlight.clear();
        clear();
    }

    private static final class EntryTtlExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry value, long currentTime) {
            return value.getTtl().toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry value, long currentTime, long currentDuration) {
            return value.getTtl().toNanos();
        }

        @Override
        public long expireAfterRead(String key, CacheEntry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
