package com.scaling.config;

import com.scaling.cache.layer.CacheStrategy;

import java.time.Duration;
import java.util.List;

/**
 * Redis connection, pool and category configuration.
 *
 * @param host                Redis host
 * @param port                Redis port
 * @param password            Optional password (null when unauthenticated)
 * @param database            Database index
 * @param namespace           Key namespace prepended to every category key
 * @param defaultTtl          TTL applied when a write does not name one
 * @param minConnections      Idle connections kept in the pool
 * @param maxConnections      Hard cap on pooled connections
 * @param connectionTimeout   Connect timeout, also the longest a caller waits for a pooled connection
 * @param commandTimeout      Per-command timeout
 * @param healthCheckInterval Interval between PING probes
 * @param categories          Category definitions
 */
public record CacheConfig(
        String host,
        int port,
        String password,
        int database,
        String namespace,
        Duration defaultTtl,
        int minConnections,
        int maxConnections,
        Duration connectionTimeout,
        Duration commandTimeout,
        Duration healthCheckInterval,
        List<CategoryConfig> categories
) {
    /**
     * Categories used when the configuration declares none.
     */
    public static List<CategoryConfig> defaultCategories() {
        return List.of(
                new CategoryConfig("task-result", Duration.ofHours(1), CacheStrategy.WRITE_THROUGH),
                new CategoryConfig("consensus", Duration.ofMinutes(5), CacheStrategy.WRITE_BEHIND),
                new CategoryConfig("oracle-data", Duration.ofMinutes(2), CacheStrategy.WRITE_BEHIND),
                new CategoryConfig("health", Duration.ofMinutes(10), CacheStrategy.READ_THROUGH),
                new CategoryConfig("cost-estimate", Duration.ofMinutes(30), CacheStrategy.WRITE_AROUND),
                new CategoryConfig("metrics", Duration.ofMinutes(1), CacheStrategy.WRITE_THROUGH)
        );
    }

    public static CacheConfig defaults() {
        return new CacheConfig(
                "localhost",
                6379,
                null,
                0,
                "scaling",
                Duration.ofMinutes(5),
                5,
                50,
                Duration.ofSeconds(5),
                Duration.ofSeconds(30),
                Duration.ofSeconds(30),
                defaultCategories()
        );
    }

    public CategoryConfig getCategory(String name) {
        return categories.stream()
                .filter(c -> c.name().equals(name))
                .findFirst()
                .orElse(null);
    }
}
