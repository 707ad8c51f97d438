package com.scaling.adapter.spring;

import com.scaling.cache.CacheConnectionManager;
import com.scaling.cache.InMemoryKeyValueStore;
import com.scaling.cache.KeyValueStore;
import com.scaling.cache.layer.CacheLayer;
import com.scaling.config.ScalingConfig;
import com.scaling.core.Priority;
import com.scaling.executor.DefaultTaskExecutor;
import com.scaling.metrics.MetricsCollector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ScalingAutoConfiguration.
 */
class ScalingAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ScalingAutoConfiguration.class))
            .withUserConfiguration(InMemoryStoreConfiguration.class)
            .withPropertyValues(
                    "scaling.config-path=classpath:scaling-test.yaml",
                    "scaling.metrics-enabled=false");

    @Configuration
    static class InMemoryStoreConfiguration {
        @Bean
        KeyValueStore keyValueStore() {
            return new InMemoryKeyValueStore(Clock.systemUTC());
        }
    }

    @Test
    @DisplayName("Should wire executor, cache and metrics from the configured file")
    void shouldCreateBeans() {
        runner.run(context -> {
            assertEquals("scaling-test", context.getBean(ScalingConfig.class).name());
            assertNotNull(context.getBean(CacheConnectionManager.class));
            assertNotNull(context.getBean(MetricsCollector.class));

            DefaultTaskExecutor executor = context.getBean(DefaultTaskExecutor.class);
            assertEquals(2, executor.getConfig().workerCount());
            assertTrue(executor.submit("spring-task", () -> "wired", Priority.HIGH));
            assertEquals("wired", executor.getResult("spring-task", Duration.ofSeconds(5)));

            CacheLayer layer = context.getBean(CacheLayer.class);
            assertTrue(layer.put("quotes", 1.5, "ETH/USD"));
            assertTrue(layer.key("quotes", "ETH/USD").startsWith("test:quotes:"));
        });
    }

    @Test
    @DisplayName("Should shut the executor down with the context")
    void shouldShutDownWithContext() {
        DefaultTaskExecutor[] holder = new DefaultTaskExecutor[1];
        runner.run(context -> holder[0] = context.getBean(DefaultTaskExecutor.class));

        assertTrue(holder[0].isShutdown());
        assertTrue(holder[0].isTerminated());
    }

    @Test
    @DisplayName("Should create nothing when disabled")
    void shouldBackOffWhenDisabled() {
        runner.withPropertyValues("scaling.enabled=false").run(context -> {
            assertTrue(context.getBeansOfType(DefaultTaskExecutor.class).isEmpty());
            assertTrue(context.getBeansOfType(CacheLayer.class).isEmpty());
        });
    }
}
