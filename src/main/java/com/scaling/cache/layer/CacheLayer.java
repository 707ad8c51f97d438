package com.scaling.cache.layer;

import com.scaling.cache.CacheConnectionManager;
import com.scaling.config.CacheConfig;
import com.scaling.exception.CacheSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Category-aware cache on top of {@link CacheConnectionManager}.
 * <p>
 * Each category carries its own TTL and {@link CacheStrategy}. Keys are built by {@link CacheKeys}.
 * Store failures stay invisible to callers; failures of the source of truth surface as
 * {@link CacheSourceException}, except for write-behind persistence, which is only logged.
 */
public class CacheLayer {

    private static final Logger log = LoggerFactory.getLogger(CacheLayer.class);

    private static final long WRITE_BEHIND_DRAIN_SECONDS = 5;

    private final CacheConnectionManager manager;
    private final CacheKeys keys;
    private final Map<String, CacheCategory> categories;
    private final ExecutorService writeBehindExecutor;

    private final AtomicLong operations = new AtomicLong();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong writes = new AtomicLong();
    private final AtomicLong invalidations = new AtomicLong();

    public CacheLayer(CacheConnectionManager manager, CacheKeys keys,
                      Collection<CacheCategory> categories, ExecutorService writeBehindExecutor) {
        this.manager = manager;
        this.keys = keys;
        this.writeBehindExecutor = writeBehindExecutor;
        Map<String, CacheCategory> byName = new LinkedHashMap<>();
        for (CacheCategory category : categories) {
            byName.put(category.name(), category);
        }
        this.categories = byName;
        log.info("Cache layer ready with categories {}", byName.keySet());
    }

    /**
     * Build a layer for the configured categories, with its own write-behind thread.
     */
    public static CacheLayer create(CacheConnectionManager manager, CacheKeys keys, CacheConfig config) {
        List<CacheCategory> categories = config.categories().stream()
                .map(CacheCategory::from)
                .toList();
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "cache-write-behind");
            t.setDaemon(true);
            return t;
        });
        return new CacheLayer(manager, keys, categories, executor);
    }

    public CacheCategory getCategory(String name) {
        CacheCategory category = categories.get(name);
        if (category == null) {
            throw new IllegalArgumentException("Unknown cache category: " + name);
        }
        return category;
    }

    public Collection<CacheCategory> getCategories() {
        return categories.values();
    }

    public String key(String category, Object... identifiers) {
        return keys.key(getCategory(category).name(), identifiers);
    }

    /**
     * Cached value for the identifiers, or empty on a miss (including an unreachable store).
     */
    public <T> Optional<T> get(String category, Class<T> type, Object... identifiers) {
        String key = key(category, identifiers);
        operations.incrementAndGet();
        Optional<T> value = manager.get(key, type);
        if (value.isPresent()) {
            hits.incrementAndGet();
            log.debug("Cache hit {}", key);
        } else {
            misses.incrementAndGet();
            log.debug("Cache miss {}", key);
        }
        return value;
    }

    /**
     * Write a value to the cache only, with the category TTL.
     *
     * @return true if the store accepted it
     */
    public boolean put(String category, Object value, Object... identifiers) {
        CacheCategory cacheCategory = getCategory(category);
        String key = keys.key(cacheCategory.name(), identifiers);
        operations.incrementAndGet();
        boolean stored = manager.set(key, value, cacheCategory.ttl());
        if (stored) {
            writes.incrementAndGet();
            log.debug("Cached {} (ttl {}s)", key, cacheCategory.ttl().toSeconds());
        }
        return stored;
    }

    /**
     * Write a value following the category strategy.
     * Read-through categories write like write-through ones.
     *
     * @return true if the cache holds the value afterwards
     * @throws CacheSourceException if a synchronous source write fails; the cache is left untouched
     */
    public <T> boolean write(String category, T value, SourceWriter<? super T> writer, Object... identifiers) {
        CacheCategory cacheCategory = getCategory(category);
        return switch (cacheCategory.strategy()) {
            case WRITE_BEHIND -> {
                boolean cached = put(category, value, identifiers);
                persistLater(cacheCategory, value, writer);
                yield cached;
            }
            case WRITE_AROUND -> {
                persist(cacheCategory, value, writer);
                invalidate(category, identifiers);
                yield false;
            }
            case WRITE_THROUGH, READ_THROUGH -> {
                persist(cacheCategory, value, writer);
                yield put(category, value, identifiers);
            }
        };
    }

    /**
     * Cached value, or the loader's value stored under the category TTL on a miss.
     * A null from the loader is returned as is and not cached.
     *
     * @throws CacheSourceException if the loader fails
     */
    public <T> T read(String category, Class<T> type, Callable<? extends T> loader, Object... identifiers) {
        Optional<T> cached = get(category, type, identifiers);
        if (cached.isPresent()) {
            return cached.get();
        }
        T loaded;
        try {
            loaded = loader.call();
        } catch (Exception e) {
            throw new CacheSourceException("Loading '" + category + "' entry failed: " + e.getMessage(), e);
        }
        if (loaded != null) {
            put(category, loaded, identifiers);
        }
        return loaded;
    }

    /**
     * Remove one entry.
     *
     * @return true if an entry was deleted
     */
    public boolean invalidate(String category, Object... identifiers) {
        String key = key(category, identifiers);
        operations.incrementAndGet();
        boolean deleted = manager.delete(key);
        if (deleted) {
            invalidations.incrementAndGet();
        }
        return deleted;
    }

    /**
     * Remove every entry of a category.
     *
     * @return number of entries deleted
     */
    public int invalidateCategory(String category) {
        int count = deleteMatching(keys.categoryPattern(getCategory(category).name()));
        log.info("Invalidated {} '{}' cache entries", count, category);
        return count;
    }

    /**
     * Remove every entry matching a glob relative to the namespace, e.g. {@code oracle-data:*}.
     *
     * @return number of entries deleted
     */
    public int invalidatePattern(String pattern) {
        int count = deleteMatching(keys.namespacedPattern(pattern));
        log.info("Invalidated {} cache entries matching '{}'", count, pattern);
        return count;
    }

    private int deleteMatching(String glob) {
        operations.incrementAndGet();
        int count = 0;
        for (String key : manager.scan(glob)) {
            if (manager.delete(key)) {
                count++;
            }
        }
        invalidations.addAndGet(count);
        return count;
    }

    private <T> void persist(CacheCategory category, T value, SourceWriter<? super T> writer) {
        try {
            writer.write(value);
        } catch (Exception e) {
            throw new CacheSourceException("Persisting '" + category.name() + "' entry failed: " + e.getMessage(), e);
        }
    }

    private <T> void persistLater(CacheCategory category, T value, SourceWriter<? super T> writer) {
        try {
            writeBehindExecutor.execute(() -> {
                try {
                    writer.write(value);
                } catch (Exception e) {
                    log.error("Write-behind for '{}' failed: {}", category.name(), e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Write-behind for '{}' rejected, layer is shut down", category.name());
        }
    }

    public CacheLayerMetrics getMetrics() {
        return new CacheLayerMetrics(
                operations.get(),
                hits.get(),
                misses.get(),
                writes.get(),
                invalidations.get()
        );
    }

    /**
     * Stop accepting write-behind work and wait briefly for queued writes.
     */
    public void shutdown() {
        writeBehindExecutor.shutdown();
        try {
            if (!writeBehindExecutor.awaitTermination(WRITE_BEHIND_DRAIN_SECONDS, TimeUnit.SECONDS)) {
                List<Runnable> dropped = writeBehindExecutor.shutdownNow();
                log.warn("Dropped {} pending write-behind writes", dropped.size());
            }
        } catch (InterruptedException e) {
            writeBehindExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Cache layer counters.
     *
     * @param operations    Gets, puts, single and bulk invalidations
     * @param hits          Gets answered from the cache
     * @param misses        Gets that found nothing
     * @param writes        Values stored
     * @param invalidations Entries deleted
     */
    public record CacheLayerMetrics(
            long operations,
            long hits,
            long misses,
            long writes,
            long invalidations
    ) {
        public double hitRate() {
            long lookups = hits + misses;
            return lookups > 0 ? (double) hits / lookups : 0.0;
        }
    }
}
