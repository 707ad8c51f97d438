package com.scaling.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the scaling infrastructure.
 */
@ConfigurationProperties(prefix = "scaling")
public class ScalingProperties {

    /**
     * Whether the executor, cache and metrics beans are created.
     */
    private boolean enabled = true;

    /**
     * Path to the scaling configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:scaling.yaml";

    /**
     * Whether the metrics collector samples periodically.
     */
    private boolean metricsEnabled = true;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    public void setMetricsEnabled(boolean metricsEnabled) {
        this.metricsEnabled = metricsEnabled;
    }
}
