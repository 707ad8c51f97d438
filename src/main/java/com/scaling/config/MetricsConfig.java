package com.scaling.config;

import java.time.Duration;

/**
 * Metrics sampling configuration.
 *
 * @param interval       Sampling interval
 * @param publishToCache Whether each sample is written to the {@code metrics} cache category
 */
public record MetricsConfig(
        Duration interval,
        boolean publishToCache
) {
    public static MetricsConfig defaults() {
        return new MetricsConfig(Duration.ofSeconds(60), true);
    }
}
