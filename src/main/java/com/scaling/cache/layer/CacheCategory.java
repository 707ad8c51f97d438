package com.scaling.cache.layer;

import com.scaling.config.CategoryConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * A data category with its own TTL and consistency strategy.
 *
 * @param name     Category name, used as the key segment after the namespace
 * @param ttl      Time-to-live of entries written to this category
 * @param strategy How writes and reads reach the source of truth
 */
public record CacheCategory(
        String name,
        Duration ttl,
        CacheStrategy strategy
) {
    public CacheCategory {
        Objects.requireNonNull(name, "Category name cannot be null");
        Objects.requireNonNull(ttl, "Category TTL cannot be null");
        Objects.requireNonNull(strategy, "Category strategy cannot be null");
    }

    public static CacheCategory from(CategoryConfig config) {
        return new CacheCategory(config.name(), config.ttl(), config.strategy());
    }
}
