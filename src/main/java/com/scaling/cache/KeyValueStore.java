package com.scaling.cache;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Raw string operations against the external key-value service.
 * <p>
 * Implementations report transport problems (network errors, exhausted pool, timeouts)
 * as {@link com.scaling.exception.CacheConnectionException}; the connection manager
 * turns those into cache misses.
 */
public interface KeyValueStore extends AutoCloseable {

    Optional<String> get(String key);

    /**
     * Store a value that expires after the given TTL.
     */
    void set(String key, String value, Duration ttl);

    /**
     * @return true if a key was removed
     */
    boolean delete(String key);

    boolean exists(String key);

    /**
     * Keys matching a glob-style pattern ({@code *}, {@code ?}).
     */
    List<String> scan(String pattern);

    /**
     * Atomically add to an integer counter, creating it at zero when absent.
     *
     * @return the value after the increment
     */
    long increment(String key, long amount);

    /**
     * Round-trip probe used by the health check.
     */
    void ping();

    /**
     * Release pooled connections.
     */
    @Override
    void close();
}
