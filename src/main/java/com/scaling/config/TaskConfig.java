package com.scaling.config;

import com.scaling.core.Priority;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Worker pool and lane configuration.
 *
 * @param workerCount             Number of workers started with the executor
 * @param lanes                   One entry per priority
 * @param taskTimeout             Default execution deadline per task
 * @param retryAttempts           Retry budget advertised to callers; the executor never retries itself
 * @param idlePoll                How long an idle worker waits for work before re-checking shutdown
 * @param starvationGuardInterval Every N-th dequeue rotates over the lanes below CRITICAL (0 = strict priority)
 * @param threadNamePrefix        Prefix for worker thread names
 */
public record TaskConfig(
        int workerCount,
        List<LaneConfig> lanes,
        Duration taskTimeout,
        int retryAttempts,
        Duration idlePoll,
        int starvationGuardInterval,
        String threadNamePrefix
) {
    public static final int DEFAULT_LANE_CAPACITY = 250;

    /**
     * Capacity of the lane for a priority.
     */
    public int capacityOf(Priority priority) {
        return lanes.stream()
                .filter(l -> l.priority() == priority)
                .mapToInt(LaneConfig::capacity)
                .findFirst()
                .orElse(DEFAULT_LANE_CAPACITY);
    }

    /**
     * Lanes with the same capacity for every priority.
     */
    public static List<LaneConfig> uniformLanes(int capacity) {
        List<LaneConfig> lanes = new ArrayList<>();
        for (Priority priority : Priority.values()) {
            lanes.add(new LaneConfig(priority, capacity));
        }
        return List.copyOf(lanes);
    }

    /**
     * Default task configuration.
     */
    public static TaskConfig defaults() {
        return new TaskConfig(
                10,                              // workerCount
                uniformLanes(DEFAULT_LANE_CAPACITY),
                Duration.ofSeconds(60),          // taskTimeout
                3,                               // retryAttempts
                Duration.ofMillis(100),          // idlePoll
                0,                               // starvationGuardInterval
                "task-worker-"                   // threadNamePrefix
        );
    }

    /**
     * Small configuration for tests.
     */
    public static TaskConfig minimal(int workerCount, int laneCapacity, Duration taskTimeout) {
        return new TaskConfig(
                workerCount,
                uniformLanes(laneCapacity),
                taskTimeout,
                0,
                Duration.ofMillis(20),
                0,
                "test-worker-"
        );
    }

    public TaskConfig withStarvationGuardInterval(int interval) {
        return new TaskConfig(workerCount, lanes, taskTimeout, retryAttempts, idlePoll, interval, threadNamePrefix);
    }
}
