package com.scaling;

import com.scaling.cache.layer.CacheLayer;
import com.scaling.core.Priority;
import com.scaling.executor.DefaultTaskExecutor;
import com.scaling.metrics.MetricsCollector;
import com.scaling.metrics.MetricsSnapshot;
import com.scaling.spring.EnableScaling;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisAutoConfiguration;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;
import org.springframework.context.annotation.Bean;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Example Spring Boot application demonstrating prioritized tasks and category caching.
 */
@SpringBootApplication(exclude = {RedisAutoConfiguration.class, RedisRepositoriesAutoConfiguration.class})
@EnableScaling
public class ScalingApplication {

    private static final Logger log = LoggerFactory.getLogger(ScalingApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ScalingApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(DefaultTaskExecutor executor, CacheLayer cacheLayer, MetricsCollector metrics) {
        return args -> {
            log.info("=== Scaling Demo Started ===");

            List<Priority> priorities = List.of(Priority.LOW, Priority.NORMAL, Priority.CRITICAL);
            for (Priority priority : priorities) {
                String taskId = "demo-" + priority.laneName();
                executor.submit(taskId, () -> {
                    Thread.sleep(200);  // Simulate work
                    return Map.of("task", taskId, "score", 0.97);
                }, priority, (id, value, error) -> {
                    if (error == null) {
                        cacheLayer.put("task-result", value, id);
                    }
                });
            }

            for (Priority priority : priorities) {
                String taskId = "demo-" + priority.laneName();
                Object result = executor.getResult(taskId, Duration.ofSeconds(10));
                log.info("Result of {}: {}", taskId, result);
            }

            Map<?, ?> cached = cacheLayer.get("task-result", Map.class, "demo-critical").orElse(null);
            log.info("Cached result of demo-critical: {}", cached);

            MetricsSnapshot snapshot = metrics.snapshot();
            log.info("=== All Tasks Completed ===");
            log.info("Submitted {}, completed {}, failed {}, cache connected: {}",
                    snapshot.tasksSubmitted(), snapshot.tasksCompleted(), snapshot.tasksFailed(),
                    snapshot.cacheConnected());
        };
    }
}
