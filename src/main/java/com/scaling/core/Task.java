package com.scaling.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Callable;

/**
 * Immutable task descriptor held by a priority lane until a worker dequeues it.
 *
 * @param id          Unique task id
 * @param priority    Lane the task was submitted to
 * @param work        Work unit to execute
 * @param callback    Optional completion callback (may be null)
 * @param timeout     Execution deadline for the work unit
 * @param submittedAt Submission time
 * @param <T>         Result type
 */
public record Task<T>(
        String id,
        Priority priority,
        Callable<T> work,
        TaskCallback<? super T> callback,
        Duration timeout,
        Instant submittedAt
) {
    public Task {
        Objects.requireNonNull(id, "Task id cannot be null");
        Objects.requireNonNull(priority, "Priority cannot be null");
        Objects.requireNonNull(work, "Work unit cannot be null");
        Objects.requireNonNull(timeout, "Timeout cannot be null");
        Objects.requireNonNull(submittedAt, "submittedAt cannot be null");
    }

    public boolean hasCallback() {
        return callback != null;
    }
}
