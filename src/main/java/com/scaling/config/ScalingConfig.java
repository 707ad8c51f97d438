package com.scaling.config;

/**
 * Root configuration.
 *
 * @param name    Instance name, used in logs
 * @param version Configuration version
 * @param tasks   Worker pool and lanes
 * @param cache   Redis and cache layer
 * @param metrics Metrics sampling
 */
public record ScalingConfig(
        String name,
        String version,
        TaskConfig tasks,
        CacheConfig cache,
        MetricsConfig metrics
) {
    public static ScalingConfig defaults() {
        return new ScalingConfig(
                "scaling",
                "1.0",
                TaskConfig.defaults(),
                CacheConfig.defaults(),
                MetricsConfig.defaults()
        );
    }
}
