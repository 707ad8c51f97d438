package com.scaling.core;

import java.time.Instant;

/**
 * Failed outcome of a task. Written once by the executing worker (or by a forced shutdown).
 *
 * @param taskId   Task id
 * @param kind     Failure classification
 * @param message  Human-readable description
 * @param cause    Underlying error (may be null)
 * @param failedAt Failure time
 */
public record TaskFailure(
        String taskId,
        FailureKind kind,
        String message,
        Throwable cause,
        Instant failedAt
) {
}
