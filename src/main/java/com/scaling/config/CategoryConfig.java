package com.scaling.config;

import com.scaling.cache.layer.CacheStrategy;

import java.time.Duration;

/**
 * Cache category declared in configuration.
 *
 * @param name     Category name, also its key segment
 * @param ttl      Entry time-to-live
 * @param strategy Consistency strategy
 */
public record CategoryConfig(
        String name,
        Duration ttl,
        CacheStrategy strategy
) {
}
