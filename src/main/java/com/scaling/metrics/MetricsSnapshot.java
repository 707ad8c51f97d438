package com.scaling.metrics;

import com.scaling.core.Priority;
import com.scaling.executor.WorkerStats;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the task executor and the cache.
 *
 * @param queueDepths          Tasks waiting per lane
 * @param activeWorkers        Workers executing a task
 * @param idleWorkers          Live workers waiting for work
 * @param workers              Per-worker counters
 * @param tasksSubmitted       Tasks accepted into a lane
 * @param tasksCompleted       Tasks with a result
 * @param tasksFailed          Tasks with a failure
 * @param tasksRejected        Submissions refused by a full lane
 * @param submittedByPriority  Accepted submissions per priority
 * @param averageExecutionTime Mean execution time of successful tasks
 * @param cacheHitRate         {@code hits / (hits + misses)} of the connection manager
 * @param cacheOperations      Commands sent to the store
 * @param cacheConnected       Outcome of the last health probe
 * @param cacheLatencyMs       Smoothed PING latency
 * @param cacheConnectionErrors Failed commands and probes
 * @param layerHitRate         Hit rate of category lookups
 * @param layerInvalidations   Entries removed through the cache layer
 * @param timestamp            When the snapshot was taken
 */
public record MetricsSnapshot(
        Map<Priority, Integer> queueDepths,
        int activeWorkers,
        int idleWorkers,
        List<WorkerStats.Snapshot> workers,
        long tasksSubmitted,
        long tasksCompleted,
        long tasksFailed,
        long tasksRejected,
        Map<Priority, Long> submittedByPriority,
        Duration averageExecutionTime,
        double cacheHitRate,
        long cacheOperations,
        boolean cacheConnected,
        double cacheLatencyMs,
        long cacheConnectionErrors,
        double layerHitRate,
        long layerInvalidations,
        Instant timestamp
) {
    public int totalQueueDepth() {
        int total = 0;
        for (int depth : queueDepths.values()) {
            total += depth;
        }
        return total;
    }
}
