package com.scaling.metrics;

import com.scaling.cache.CacheConnectionManager;
import com.scaling.cache.layer.CacheCategory;
import com.scaling.cache.layer.CacheLayer;
import com.scaling.config.MetricsConfig;
import com.scaling.core.Priority;
import com.scaling.executor.DefaultTaskExecutor;
import com.scaling.executor.ExecutorStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Samples executor and cache counters.
 * <p>
 * Every value comes from a counter maintained as work happens, so a snapshot costs
 * the same no matter how many tasks have run.
 */
public class MetricsCollector {

    private static final Logger log = LoggerFactory.getLogger(MetricsCollector.class);

    public static final String METRICS_CATEGORY = "metrics";
    static final String PERFORMANCE_ID = "performance";

    private final DefaultTaskExecutor executor;
    private final CacheConnectionManager cacheManager;
    private final CacheLayer cacheLayer;
    private final MetricsConfig config;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private ScheduledExecutorService sampler;

    public MetricsCollector(DefaultTaskExecutor executor, CacheConnectionManager cacheManager,
                            CacheLayer cacheLayer, MetricsConfig config) {
        this(executor, cacheManager, cacheLayer, config, Clock.systemUTC());
    }

    public MetricsCollector(DefaultTaskExecutor executor, CacheConnectionManager cacheManager,
                            CacheLayer cacheLayer, MetricsConfig config, Clock clock) {
        this.executor = executor;
        this.cacheManager = cacheManager;
        this.cacheLayer = cacheLayer;
        this.config = config;
        this.clock = clock;
    }

    public MetricsSnapshot snapshot() {
        Map<Priority, Integer> depths = new EnumMap<>(Priority.class);
        for (Priority priority : Priority.values()) {
            depths.put(priority, executor.getQueueSize(priority));
        }
        ExecutorStats stats = executor.getStats();
        CacheConnectionManager.CacheMetrics cache = cacheManager.getMetrics();
        CacheLayer.CacheLayerMetrics layer = cacheLayer.getMetrics();

        return new MetricsSnapshot(
                depths,
                stats.activeWorkers(),
                stats.idleWorkers(),
                executor.getWorkerStats(),
                stats.submittedCount(),
                stats.completedCount(),
                stats.failedCount(),
                stats.rejectedCount(),
                executor.getSubmittedByPriority(),
                executor.getAverageExecutionTime(),
                cache.hitRate(),
                cache.totalCommands(),
                cache.connected(),
                cache.averageLatencyMs(),
                cache.connectionErrors(),
                layer.hitRate(),
                layer.invalidations(),
                clock.instant()
        );
    }

    /**
     * Start periodic sampling. Each sample is logged and, when enabled, cached
     * in the {@code metrics} category.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        sampler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "metrics-sampler");
            t.setDaemon(true);
            return t;
        });
        long intervalMillis = config.interval().toMillis();
        sampler.scheduleAtFixedRate(this::sample, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("Metrics collector started (every {}s, publish to cache: {})",
                config.interval().toSeconds(), config.publishToCache());
    }

    /**
     * Take one sample, log it and publish it.
     */
    public MetricsSnapshot sample() {
        try {
            MetricsSnapshot snapshot = snapshot();
            log.info("Performance - tasks {}/{} completed, {} failed, {} rejected, {} queued, {} active workers, "
                            + "cache {}% hit rate ({} ms, connected: {})",
                    snapshot.tasksCompleted(), snapshot.tasksSubmitted(), snapshot.tasksFailed(),
                    snapshot.tasksRejected(), snapshot.totalQueueDepth(), snapshot.activeWorkers(),
                    String.format("%.1f", snapshot.cacheHitRate() * 100),
                    String.format("%.1f", snapshot.cacheLatencyMs()), snapshot.cacheConnected());
            if (config.publishToCache()) {
                publish(snapshot);
            }
            return snapshot;
        } catch (RuntimeException e) {
            // Keep the scheduled sampler alive
            log.error("Metrics sampling failed: {}", e.getMessage(), e);
            return null;
        }
    }

    private void publish(MetricsSnapshot snapshot) {
        boolean hasCategory = cacheLayer.getCategories().stream()
                .map(CacheCategory::name)
                .anyMatch(METRICS_CATEGORY::equals);
        if (!hasCategory) {
            log.debug("No '{}' cache category, snapshot not published", METRICS_CATEGORY);
            return;
        }
        cacheLayer.put(METRICS_CATEGORY, snapshot, PERFORMANCE_ID);
    }

    public void shutdown() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        sampler.shutdownNow();
        log.info("Metrics collector stopped");
    }
}
