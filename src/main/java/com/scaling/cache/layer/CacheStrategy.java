package com.scaling.cache.layer;

/**
 * Consistency strategy of a cache category.
 */
public enum CacheStrategy {
    /**
     * Write the cache and the source of truth before returning.
     */
    WRITE_THROUGH,

    /**
     * Write the cache immediately, persist to the source of truth asynchronously.
     */
    WRITE_BEHIND,

    /**
     * Persist to the source of truth only; the cache entry is dropped
     * and repopulated on the next read.
     */
    WRITE_AROUND,

    /**
     * Check the cache first; on a miss load the value and populate the cache.
     */
    READ_THROUGH
}
