package com.scaling.config;

import com.scaling.cache.layer.CacheStrategy;
import com.scaling.core.Priority;
import com.scaling.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads scaling configuration from YAML files.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Load configuration from a path.
     * Supports classpath: prefix for classpath resources.
     *
     * @param path Path to the configuration file
     * @return Loaded configuration
     */
    public static ScalingConfig load(String path) {
        log.info("Loading scaling configuration from: {}", path);

        try {
            Resource resource = getResource(path);
            try (InputStream inputStream = resource.getInputStream()) {
                return parseYaml(inputStream);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    private static Resource getResource(String path) {
        if (path.startsWith("classpath:")) {
            String resourcePath = path.substring("classpath:".length());
            return new ClassPathResource(resourcePath);
        }
        return new FileSystemResource(path);
    }

    @SuppressWarnings("unchecked")
    static ScalingConfig parseYaml(InputStream inputStream) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(inputStream);

        if (root == null) {
            throw new ConfigurationException("Configuration file is empty");
        }

        // The scaling section may sit at root or under a 'scaling' key
        Map<String, Object> scalingMap = root.containsKey("scaling")
                ? (Map<String, Object>) root.get("scaling")
                : root;

        String name = getString(scalingMap, "name", "scaling");
        String version = getString(scalingMap, "version", "1.0");

        TaskConfig tasks = parseTaskConfig((Map<String, Object>) scalingMap.get("tasks"));
        CacheConfig cache = parseCacheConfig((Map<String, Object>) scalingMap.get("cache"));
        MetricsConfig metrics = parseMetricsConfig((Map<String, Object>) scalingMap.get("metrics"));

        ScalingConfig config = new ScalingConfig(name, version, tasks, cache, metrics);

        log.info("Loaded scaling configuration: {} v{} with {} workers, lanes {}, task timeout {}ms, "
                        + "redis {}:{} (max {} connections), {} cache categories",
                name, version, tasks.workerCount(), describeLanes(tasks), tasks.taskTimeout().toMillis(),
                cache.host(), cache.port(), cache.maxConnections(), cache.categories().size());

        return config;
    }

    @SuppressWarnings("unchecked")
    private static TaskConfig parseTaskConfig(Map<String, Object> map) {
        TaskConfig defaults = TaskConfig.defaults();
        if (map == null) {
            return defaults;
        }

        int workerCount = getInt(map, "worker-count", defaults.workerCount());
        if (workerCount <= 0) {
            throw new ConfigurationException("tasks.worker-count must be positive, got " + workerCount);
        }

        int perLane = getInt(map, "queue-capacity-per-lane", TaskConfig.DEFAULT_LANE_CAPACITY);
        Map<Priority, Integer> capacities = new EnumMap<>(Priority.class);
        for (Priority priority : Priority.values()) {
            capacities.put(priority, perLane);
        }

        // Per-lane overrides
        List<Map<String, Object>> lanesList = (List<Map<String, Object>>) map.get("lanes");
        if (lanesList != null) {
            Set<Priority> seen = new HashSet<>();
            for (Map<String, Object> laneMap : lanesList) {
                Priority priority = Priority.parse(getString(laneMap, "priority", null));
                if (!seen.add(priority)) {
                    throw new ConfigurationException("Lane '" + priority.laneName() + "' is declared twice");
                }
                capacities.put(priority, getInt(laneMap, "capacity", perLane));
                log.debug("Parsed lane override: priority={}, capacity={}", priority, capacities.get(priority));
            }
        }

        List<LaneConfig> lanes = new ArrayList<>();
        for (Map.Entry<Priority, Integer> entry : capacities.entrySet()) {
            if (entry.getValue() <= 0) {
                throw new ConfigurationException("Capacity of lane '" + entry.getKey().laneName()
                        + "' must be positive, got " + entry.getValue());
            }
            lanes.add(new LaneConfig(entry.getKey(), entry.getValue()));
        }

        long timeoutMs = getLong(map, "task-timeout-ms", defaults.taskTimeout().toMillis());
        if (timeoutMs <= 0) {
            throw new ConfigurationException("tasks.task-timeout-ms must be positive, got " + timeoutMs);
        }
        int starvationGuard = getInt(map, "starvation-guard-interval", defaults.starvationGuardInterval());
        if (starvationGuard < 0) {
            throw new ConfigurationException("tasks.starvation-guard-interval cannot be negative");
        }

        return new TaskConfig(
                workerCount,
                List.copyOf(lanes),
                Duration.ofMillis(timeoutMs),
                getInt(map, "task-retry-attempts", defaults.retryAttempts()),
                Duration.ofMillis(getLong(map, "idle-poll-ms", defaults.idlePoll().toMillis())),
                starvationGuard,
                getString(map, "thread-name-prefix", defaults.threadNamePrefix())
        );
    }

    @SuppressWarnings("unchecked")
    private static CacheConfig parseCacheConfig(Map<String, Object> map) {
        CacheConfig defaults = CacheConfig.defaults();
        if (map == null) {
            return defaults;
        }

        int minConnections = getInt(map, "min-connections", defaults.minConnections());
        int maxConnections = getInt(map, "max-connections", defaults.maxConnections());
        if (maxConnections <= 0 || minConnections < 0 || minConnections > maxConnections) {
            throw new ConfigurationException("Invalid cache pool bounds: min-connections=" + minConnections
                    + ", max-connections=" + maxConnections);
        }

        long defaultTtlSeconds = getLong(map, "default-ttl-seconds", defaults.defaultTtl().toSeconds());
        if (defaultTtlSeconds <= 0) {
            throw new ConfigurationException("cache.default-ttl-seconds must be positive");
        }

        List<CategoryConfig> categories = parseCategories(
                (List<Map<String, Object>>) map.get("categories"));

        return new CacheConfig(
                getString(map, "host", defaults.host()),
                getInt(map, "port", defaults.port()),
                getString(map, "password", null),
                getInt(map, "database", defaults.database()),
                getString(map, "namespace", defaults.namespace()),
                Duration.ofSeconds(defaultTtlSeconds),
                minConnections,
                maxConnections,
                Duration.ofMillis(getLong(map, "connection-timeout-ms", defaults.connectionTimeout().toMillis())),
                Duration.ofMillis(getLong(map, "command-timeout-ms", defaults.commandTimeout().toMillis())),
                Duration.ofSeconds(getLong(map, "health-check-interval-seconds",
                        defaults.healthCheckInterval().toSeconds())),
                categories
        );
    }

    private static List<CategoryConfig> parseCategories(List<Map<String, Object>> list) {
        if (list == null || list.isEmpty()) {
            log.debug("No cache categories configured, using defaults");
            return CacheConfig.defaultCategories();
        }
        List<CategoryConfig> categories = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (int i = 0; i < list.size(); i++) {
            Map<String, Object> item = list.get(i);
            String name = getString(item, "name", null);
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("Cache category " + i + " has no name");
            }
            if (name.contains(":") || name.contains("*")) {
                throw new ConfigurationException("Cache category name '" + name + "' cannot contain ':' or '*'");
            }
            if (!names.add(name)) {
                throw new ConfigurationException("Cache category '" + name + "' is declared twice");
            }
            long ttlSeconds = getLong(item, "ttl-seconds", 300);
            if (ttlSeconds <= 0) {
                throw new ConfigurationException("Cache category '" + name + "' needs a positive ttl-seconds");
            }
            CacheStrategy strategy = parseStrategy(getString(item, "strategy", "READ_THROUGH"), name);
            categories.add(new CategoryConfig(name, Duration.ofSeconds(ttlSeconds), strategy));
            log.debug("Parsed cache category: name={}, ttl={}s, strategy={}", name, ttlSeconds, strategy);
        }
        return List.copyOf(categories);
    }

    private static CacheStrategy parseStrategy(String value, String category) {
        try {
            return CacheStrategy.valueOf(value.toUpperCase().replace("-", "_"));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown cache strategy '" + value + "' for category '" + category + "'", e);
        }
    }

    private static MetricsConfig parseMetricsConfig(Map<String, Object> map) {
        MetricsConfig defaults = MetricsConfig.defaults();
        if (map == null) {
            return defaults;
        }
        long intervalSeconds = getLong(map, "interval-seconds", defaults.interval().toSeconds());
        if (intervalSeconds <= 0) {
            throw new ConfigurationException("metrics.interval-seconds must be positive");
        }
        return new MetricsConfig(
                Duration.ofSeconds(intervalSeconds),
                getBoolean(map, "publish-to-cache", defaults.publishToCache())
        );
    }

    private static String describeLanes(TaskConfig tasks) {
        StringBuilder sb = new StringBuilder();
        for (LaneConfig lane : tasks.lanes()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(lane.priority().laneName()).append('=').append(lane.capacity());
        }
        return sb.toString();
    }

    // Helper methods

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).intValue();
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer, got '" + value + "'", e);
        }
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Boolean) return (Boolean) value;
        return Boolean.parseBoolean(value.toString());
    }

    private static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number) return ((Number) value).longValue();
        try {
            return Long.parseLong(value.toString());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be a number, got '" + value + "'", e);
        }
    }
}
