package com.identity.resolution.cache;

/**
 * Identity cache metrics.
 *
 * @param hitCount          number of calls answered from the cache
 * @param missCount         number of calls that went to the system lookup
 * @param invalidationCount number of cached names discarded, by uid change or explicit invalidation
 */
public record CacheStats(long hitCount, long missCount, long invalidationCount) {

    /**
     * Returns the hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    /**
     * Returns empty stats.
     */
    public static CacheStats empty() {
        return new CacheStats(0, 0, 0);
    }
}
