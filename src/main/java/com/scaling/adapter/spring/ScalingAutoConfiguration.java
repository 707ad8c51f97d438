package com.scaling.adapter.spring;

import com.scaling.cache.CacheCodec;
import com.scaling.cache.CacheConnectionManager;
import com.scaling.cache.KeyValueStore;
import com.scaling.cache.RedisKeyValueStore;
import com.scaling.cache.layer.CacheKeys;
import com.scaling.cache.layer.CacheLayer;
import com.scaling.config.ConfigLoader;
import com.scaling.config.ScalingConfig;
import com.scaling.executor.DefaultTaskExecutor;
import com.scaling.metrics.MetricsCollector;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Spring Boot auto-configuration for the task executor, the Redis cache and the metrics collector.
 */
@Configuration
@ConditionalOnProperty(prefix = "scaling", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ScalingProperties.class)
public class ScalingAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ScalingAutoConfiguration.class);

    private static final long TERMINATION_WAIT_SECONDS = 30;

    private DefaultTaskExecutor taskExecutor;
    private CacheConnectionManager cacheConnectionManager;
    private CacheLayer cacheLayer;
    private MetricsCollector metricsCollector;

    @Bean
    @ConditionalOnMissingBean
    public ScalingConfig scalingConfig(ScalingProperties properties) {
        log.info("Loading scaling configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public DefaultTaskExecutor taskExecutor(ScalingConfig config) {
        log.info("Creating TaskExecutor: {} v{}", config.name(), config.version());
        this.taskExecutor = new DefaultTaskExecutor(config.tasks());
        this.taskExecutor.start();
        return this.taskExecutor;
    }

    // Closed by the connection manager
    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public KeyValueStore keyValueStore(ScalingConfig config) {
        return RedisKeyValueStore.create(config.cache());
    }

    @Bean
    @ConditionalOnMissingBean
    public CacheCodec cacheCodec() {
        return new CacheCodec();
    }

    @Bean
    @ConditionalOnMissingBean
    public CacheConnectionManager cacheConnectionManager(KeyValueStore store, CacheCodec codec, ScalingConfig config) {
        this.cacheConnectionManager = new CacheConnectionManager(store, codec, config.cache());
        this.cacheConnectionManager.start();
        return this.cacheConnectionManager;
    }

    @Bean
    @ConditionalOnMissingBean
    public CacheLayer cacheLayer(CacheConnectionManager manager, CacheCodec codec, ScalingConfig config) {
        CacheKeys keys = new CacheKeys(config.cache().namespace(), codec.getObjectMapper());
        this.cacheLayer = CacheLayer.create(manager, keys, config.cache());
        return this.cacheLayer;
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricsCollector metricsCollector(DefaultTaskExecutor executor, CacheConnectionManager manager,
                                             CacheLayer layer, ScalingConfig config, ScalingProperties properties) {
        this.metricsCollector = new MetricsCollector(executor, manager, layer, config.metrics());
        if (properties.isMetricsEnabled()) {
            this.metricsCollector.start();
        }
        return this.metricsCollector;
    }

    @PreDestroy
    public void shutdown() {
        if (metricsCollector != null) {
            metricsCollector.shutdown();
        }
        if (taskExecutor != null && !taskExecutor.isShutdown()) {
            log.info("Shutting down TaskExecutor");
            taskExecutor.shutdown();
            try {
                if (!taskExecutor.awaitTermination(TERMINATION_WAIT_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("TaskExecutor did not drain in {}s, cancelling remaining tasks", TERMINATION_WAIT_SECONDS);
                    taskExecutor.shutdownNow();
                }
            } catch (InterruptedException e) {
                taskExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        if (cacheLayer != null) {
            cacheLayer.shutdown();
        }
        if (cacheConnectionManager != null) {
            cacheConnectionManager.shutdown();
        }
    }
}
