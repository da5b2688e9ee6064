package com.shortphrase.infrastructure.ai.cache;

/**
 * Counters of a {@link RewriteCache} at one point in time.
 */
public record CacheStats(
        int size,
        int capacity,
        long hits,
        long misses,
        long evictions
) {
    public double hitRate() {
        long lookups = hits + misses;
        return lookups > 0 ? (double) hits / lookups * 100 : 0;
    }
}
