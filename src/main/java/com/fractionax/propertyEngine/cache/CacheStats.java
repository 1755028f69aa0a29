package com.fractionax.propertyEngine.cache;

/**
 * Point-in-time counters of the {@link ResponseCache}.
 *
 * @param size Entries currently held (may include expired entries not yet read)
 * @param hits Reads that returned a live entry
 * @param misses Reads that found nothing or an expired entry
 * @param evictions Entries dropped by size limit, expiry or explicit eviction
 * @param inFlight Resolutions currently running
 */
public record CacheStats(long size, long hits, long misses, long evictions, int inFlight) {
}
