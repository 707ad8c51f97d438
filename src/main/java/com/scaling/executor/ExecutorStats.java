package com.scaling.executor;

/**
 * Executor statistics.
 *
 * @param submittedCount Tasks accepted into a lane
 * @param completedCount Tasks with a recorded result
 * @param failedCount    Tasks with a recorded failure
 * @param rejectedCount  Submissions refused because the lane was full
 * @param queueSize      Tasks waiting in lanes
 * @param activeWorkers  Workers executing a task
 * @param workerCount    Workers alive
 */
public record ExecutorStats(
        long submittedCount,
        long completedCount,
        long failedCount,
        long rejectedCount,
        int queueSize,
        int activeWorkers,
        int workerCount
) {
    public int idleWorkers() {
        return Math.max(0, workerCount - activeWorkers);
    }
}
