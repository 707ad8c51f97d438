package com.scaling.cache;

import com.scaling.config.CacheConfig;
import com.scaling.exception.CacheConnectionException;
import io.lettuce.core.api.StatefulConnection;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.PoolException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.RedisPassword;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * {@link KeyValueStore} backed by Redis through a pooled Lettuce connection factory.
 * <p>
 * The pool holds between {@code min-connections} idle and {@code max-connections} total
 * connections; a caller that finds the pool exhausted waits at most {@code connection-timeout}
 * before the borrow fails.
 */
public class RedisKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(RedisKeyValueStore.class);

    private static final long SCAN_BATCH = 500;

    private final LettuceConnectionFactory connectionFactory;
    private final StringRedisTemplate template;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RedisKeyValueStore(LettuceConnectionFactory connectionFactory) {
        this.connectionFactory = connectionFactory;
        this.template = new StringRedisTemplate(connectionFactory);
    }

    /**
     * Build a pooled store from configuration. The factory is initialized but no connection is opened yet.
     */
    public static RedisKeyValueStore create(CacheConfig config) {
        RedisStandaloneConfiguration standalone = new RedisStandaloneConfiguration(config.host(), config.port());
        standalone.setDatabase(config.database());
        if (config.password() != null && !config.password().isBlank()) {
            standalone.setPassword(RedisPassword.of(config.password()));
        }

        GenericObjectPoolConfig<StatefulConnection<?, ?>> poolConfig = new GenericObjectPoolConfig<>();
        poolConfig.setMaxTotal(config.maxConnections());
        poolConfig.setMaxIdle(config.maxConnections());
        poolConfig.setMinIdle(config.minConnections());
        poolConfig.setBlockWhenExhausted(true);
        poolConfig.setMaxWait(config.connectionTimeout());

        LettucePoolingClientConfiguration clientConfig = LettucePoolingClientConfiguration.builder()
                .poolConfig(poolConfig)
                .commandTimeout(config.commandTimeout())
                .build();

        LettuceConnectionFactory factory = new LettuceConnectionFactory(standalone, clientConfig);
        // Every command borrows from the bounded pool instead of one shared connection
        factory.setShareNativeConnection(false);
        factory.afterPropertiesSet();

        log.info("Redis store configured for {}:{}/{} (pool {}..{}, command timeout {}ms)",
                config.host(), config.port(), config.database(),
                config.minConnections(), config.maxConnections(), config.commandTimeout().toMillis());
        return new RedisKeyValueStore(factory);
    }

    @Override
    public Optional<String> get(String key) {
        return call("GET", () -> Optional.ofNullable(template.opsForValue().get(key)));
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        call("SETEX", () -> {
            template.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public boolean delete(String key) {
        return call("DEL", () -> Boolean.TRUE.equals(template.delete(key)));
    }

    @Override
    public boolean exists(String key) {
        return call("EXISTS", () -> Boolean.TRUE.equals(template.hasKey(key)));
    }

    @Override
    public List<String> scan(String pattern) {
        return call("SCAN", () -> {
            List<String> keys = new ArrayList<>();
            ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH).build();
            try (Cursor<String> cursor = template.scan(options)) {
                while (cursor.hasNext()) {
                    keys.add(cursor.next());
                }
            }
            return keys;
        });
    }

    @Override
    public long increment(String key, long amount) {
        return call("INCRBY", () -> {
            Long value = template.opsForValue().increment(key, amount);
            return value != null ? value : 0L;
        });
    }

    @Override
    public void ping() {
        call("PING", () -> template.execute((RedisCallback<String>) RedisConnection::ping));
    }

    boolean sharesNativeConnection() {
        return connectionFactory.getShareNativeConnection();
    }

    @Override
    public void close() {
        if (closed.getAndSet(true)) {
            return;
        }
        log.info("Closing Redis connection pool");
        connectionFactory.destroy();
    }

    private <R> R call(String command, Supplier<R> operation) {
        try {
            return operation.get();
        } catch (DataAccessException | PoolException | IllegalStateException e) {
            // PoolException: pool exhausted; IllegalStateException: factory stopped or destroyed
            throw new CacheConnectionException("Redis " + command + " failed: " + e.getMessage(), e);
        }
    }
}
