package com.attribute.resolution.cache;

import java.time.Duration;

/**
 * Bounds of the codelist cache. Codelists change only with a new CT release,
 * so entries live for an hour by default.
 *
 * @param maxSize    maximum number of codelists held
 * @param ttlSeconds seconds a codelist stays cached after it was read
 * @param enabled    {@code false} reads the terminology table on every invocation
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (enabled && maxSize < 1) {
            throw new IllegalArgumentException("Cache size must be at least 1, got " + maxSize);
        }
        if (enabled && ttlSeconds < 1) {
            throw new IllegalArgumentException("Cache TTL must be at least 1 second, got " + ttlSeconds);
        }
    }

    public Duration ttl() {
        return Duration.ofSeconds(ttlSeconds);
    }

    public static CacheConfig defaults() {
        return new CacheConfig(100, 3600, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(0, 0, false);
    }
}
