package com.scaling.cache;

import com.fasterxml.jackson.databind.JavaType;
import com.scaling.config.CacheConfig;
import com.scaling.exception.CacheConnectionException;
import com.scaling.exception.CacheSerializationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Typed, fail-open access to the key-value store.
 * <p>
 * Every operation tolerates store failures of any kind: reads degrade to a miss,
 * writes to a logged no-op, counters to zero. Callers never see a store error.
 * A stored JSON {@code null} reads as a miss.
 * A background probe pings the store on a fixed interval and keeps an exponential
 * moving average of the round-trip latency.
 */
public class CacheConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(CacheConnectionManager.class);

    static final double LATENCY_SMOOTHING = 0.1;

    private final KeyValueStore store;
    private final CacheCodec codec;
    private final CacheConfig config;

    private final AtomicLong totalCommands = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong connectionErrors = new AtomicLong();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile boolean connected;
    private volatile double averageLatencyMs;

    private ScheduledExecutorService healthExecutor;
    private ScheduledFuture<?> healthCheck;

    public CacheConnectionManager(KeyValueStore store, CacheCodec codec, CacheConfig config) {
        this.store = store;
        this.codec = codec;
        this.config = config;
    }

    /**
     * Probe the store once and start the periodic health check.
     * An unreachable store is logged, not raised: the manager keeps serving misses until it recovers.
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        log.info("Starting cache connection manager (health check every {}s)",
                config.healthCheckInterval().toSeconds());

        if (!checkHealth()) {
            log.warn("Cache store unreachable at startup, serving misses until it recovers");
        }

        healthExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cache-health-check");
            t.setDaemon(true);
            return t;
        });
        long intervalMillis = config.healthCheckInterval().toMillis();
        healthCheck = healthExecutor.scheduleWithFixedDelay(
                this::checkHealth, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
    }

    /**
     * Ping the store once, updating the latency average, error counter and connected flag.
     *
     * @return true if the store answered
     */
    public boolean checkHealth() {
        long start = System.nanoTime();
        try {
            store.ping();
            double sampleMs = (System.nanoTime() - start) / 1_000_000.0;
            recordLatency(sampleMs);
            if (!connected) {
                log.info("Cache store connected ({} ms)", String.format("%.1f", sampleMs));
            }
            connected = true;
            log.debug("Cache health check: {} ms latency", String.format("%.1f", sampleMs));
            return true;
        } catch (CacheConnectionException e) {
            connectionErrors.incrementAndGet();
            if (connected) {
                log.error("Cache health check failed: {}", e.getMessage());
            } else {
                log.debug("Cache health check failed: {}", e.getMessage());
            }
            connected = false;
            return false;
        } catch (RuntimeException e) {
            // Keep the scheduled probe alive
            connectionErrors.incrementAndGet();
            connected = false;
            log.error("Unexpected cache health check failure: {}", e.getMessage(), e);
            return false;
        }
    }

    private synchronized void recordLatency(double sampleMs) {
        averageLatencyMs = (1 - LATENCY_SMOOTHING) * averageLatencyMs + LATENCY_SMOOTHING * sampleMs;
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        return getDecoded(key, payload -> codec.decode(payload, type));
    }

    public <T> Optional<T> get(String key, JavaType type) {
        return getDecoded(key, payload -> codec.decode(payload, type));
    }

    private <T> Optional<T> getDecoded(String key, Function<String, T> decoder) {
        totalCommands.incrementAndGet();
        Optional<String> raw;
        try {
            raw = store.get(key);
        } catch (RuntimeException e) {
            misses.incrementAndGet();
            connectionErrors.incrementAndGet();
            log.warn("Cache GET failed for key {}, treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }

        if (raw.isEmpty()) {
            misses.incrementAndGet();
            return Optional.empty();
        }

        try {
            T value = decoder.apply(raw.get());
            if (value == null) {
                misses.incrementAndGet();
                return Optional.empty();
            }
            hits.incrementAndGet();
            return Optional.of(value);
        } catch (CacheSerializationException e) {
            misses.incrementAndGet();
            log.warn("Undecodable cache entry {}, treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Store a value. A null or non-positive TTL falls back to the configured default.
     *
     * @return true if the store accepted the write
     */
    public boolean set(String key, Object value, Duration ttl) {
        Duration effectiveTtl = ttl != null && !ttl.isNegative() && !ttl.isZero() ? ttl : config.defaultTtl();
        String payload;
        try {
            payload = codec.encode(value);
        } catch (CacheSerializationException e) {
            log.warn("Cannot cache value for key {}: {}", key, e.getMessage());
            return false;
        }

        totalCommands.incrementAndGet();
        try {
            store.set(key, payload, effectiveTtl);
            return true;
        } catch (RuntimeException e) {
            connectionErrors.incrementAndGet();
            log.warn("Cache SET failed for key {}, skipping write: {}", key, e.getMessage());
            return false;
        }
    }

    public boolean delete(String key) {
        totalCommands.incrementAndGet();
        try {
            return store.delete(key);
        } catch (RuntimeException e) {
            connectionErrors.incrementAndGet();
            log.warn("Cache DELETE failed for key {}: {}", key, e.getMessage());
            return false;
        }
    }

    public boolean exists(String key) {
        totalCommands.incrementAndGet();
        try {
            return store.exists(key);
        } catch (RuntimeException e) {
            connectionErrors.incrementAndGet();
            log.warn("Cache EXISTS failed for key {}: {}", key, e.getMessage());
            return false;
        }
    }

    /**
     * Keys matching a glob pattern; empty when the store is unreachable.
     */
    public List<String> scan(String pattern) {
        totalCommands.incrementAndGet();
        try {
            return store.scan(pattern);
        } catch (RuntimeException e) {
            connectionErrors.incrementAndGet();
            log.warn("Cache SCAN failed for pattern {}: {}", pattern, e.getMessage());
            return List.of();
        }
    }

    /**
     * Atomic server-side increment.
     *
     * @return the new value, or 0 when the store is unreachable
     */
    public long increment(String key, long amount) {
        totalCommands.incrementAndGet();
        try {
            return store.increment(key, amount);
        } catch (RuntimeException e) {
            connectionErrors.incrementAndGet();
            log.warn("Cache INCRBY failed for key {}: {}", key, e.getMessage());
            return 0L;
        }
    }

    public boolean isConnected() {
        return connected;
    }

    public CacheMetrics getMetrics() {
        return new CacheMetrics(
                totalCommands.get(),
                hits.get(),
                misses.get(),
                connectionErrors.get(),
                connected,
                averageLatencyMs,
                config.maxConnections()
        );
    }

    public void shutdown() {
        if (closed.getAndSet(true)) {
            return;
        }
        running.set(false);
        log.info("Shutting down cache connection manager");
        if (healthCheck != null) {
            healthCheck.cancel(true);
        }
        if (healthExecutor != null) {
            healthExecutor.shutdownNow();
        }
        connected = false;
        store.close();
        log.info("Cache connection manager shutdown complete");
    }

    /**
     * Connection manager counters.
     *
     * @param totalCommands    Commands sent (or attempted)
     * @param hits             GETs that returned a decodable value
     * @param misses           GETs that returned nothing, null, an error or an undecodable payload
     * @param connectionErrors Failed commands and failed health probes
     * @param connected        Outcome of the last health probe
     * @param averageLatencyMs Smoothed PING latency
     * @param maxConnections   Pool cap
     */
    public record CacheMetrics(
            long totalCommands,
            long hits,
            long misses,
            long connectionErrors,
            boolean connected,
            double averageLatencyMs,
            int maxConnections
    ) {
        public double hitRate() {
            long lookups = hits + misses;
            return lookups > 0 ? (double) hits / lookups : 0.0;
        }
    }
}
