package com.scaling.core;

import java.time.Duration;
import java.time.Instant;

/**
 * Successful outcome of a task. Written once by the executing worker.
 *
 * @param taskId        Task id
 * @param value         Value returned by the work unit (may be null)
 * @param executionTime Wall time spent in the work unit
 * @param workerId      Worker that executed the task
 * @param completedAt   Completion time
 */
public record TaskResult(
        String taskId,
        Object value,
        Duration executionTime,
        int workerId,
        Instant completedAt
) {
}
