package com.relationship.scoring.cache;

/**
 * Configuration for the record cache.
 *
 * @param maxSize    maximum number of entries
 * @param ttlSeconds time-to-live in seconds for each entry
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * Default record cache configuration: 5,000 entries, 600s TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(5_000, 600, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
