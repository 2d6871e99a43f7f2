package com.attribute.resolution.cache;

/**
 * Snapshot of the codelist cache counters.
 *
 * @param hitCount      lookups served from the cache
 * @param missCount     lookups that read the terminology table
 * @param evictionCount codelists dropped for size or age
 * @param size          codelists currently held (estimate)
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    public long requestCount() {
        return hitCount + missCount;
    }

    /**
     * Share of lookups served from the cache, 0 before the first lookup.
     */
    public double hitRate() {
        return requestCount() == 0 ? 0.0 : (double) hitCount / requestCount();
    }
}
