package com.scaling.cache;

import com.scaling.config.CacheConfig;
import com.scaling.exception.CacheConnectionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for RedisKeyValueStore with nothing listening on the configured port.
 */
class RedisKeyValueStoreTest {

    // Nothing listens on port 1, so every connect is refused immediately
    private static final CacheConfig UNREACHABLE = new CacheConfig(
            "localhost",
            1,
            null,
            0,
            "scaling-test",
            Duration.ofMinutes(5),
            1,
            2,
            Duration.ofMillis(200),
            Duration.ofMillis(500),
            Duration.ofSeconds(30),
            CacheConfig.defaultCategories()
    );

    private RedisKeyValueStore store;

    @BeforeEach
    void setUp() {
        store = RedisKeyValueStore.create(UNREACHABLE);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    @DisplayName("Should borrow pooled connections instead of sharing one")
    void shouldUsePooledConnections() {
        assertFalse(store.sharesNativeConnection());
    }

    @Test
    @DisplayName("Should report an unreachable server as a connection failure")
    void shouldTranslateConnectFailure() {
        assertThrows(CacheConnectionException.class, () -> store.get("k"));
        assertThrows(CacheConnectionException.class, () -> store.set("k", "v", Duration.ofSeconds(5)));
        assertThrows(CacheConnectionException.class, () -> store.ping());
    }

    @Test
    @DisplayName("Should report use after close as a connection failure")
    void shouldTranslateUseAfterClose() {
        store.close();

        assertThrows(CacheConnectionException.class, () -> store.get("k"));
    }

    @Test
    @DisplayName("Manager over an unreachable server should fail open")
    void managerShouldFailOpen() {
        CacheConnectionManager manager = new CacheConnectionManager(
                RedisKeyValueStore.create(UNREACHABLE), new CacheCodec(), UNREACHABLE);

        assertTrue(manager.get("k", String.class).isEmpty());
        assertFalse(manager.set("k", "v", Duration.ofSeconds(5)));
        assertFalse(manager.delete("k"));
        assertFalse(manager.exists("k"));
        assertEquals(List.of(), manager.scan("scaling-test:*"));
        assertEquals(0L, manager.increment("counter", 1));
        assertFalse(manager.checkHealth());

        CacheConnectionManager.CacheMetrics metrics = manager.getMetrics();
        assertTrue(metrics.connectionErrors() >= 7, "errors=" + metrics.connectionErrors());
        assertEquals(1, metrics.misses());
        assertFalse(metrics.connected());

        manager.shutdown();
        assertDoesNotThrow(() -> assertTrue(manager.get("k", String.class).isEmpty()));
        assertDoesNotThrow(() -> assertFalse(manager.set("k", "v", Duration.ofSeconds(5))));
    }
}
