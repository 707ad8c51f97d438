package com.scaling.exception;

import java.time.Duration;

/**
 * Recorded as the cause of a task that exceeded its execution deadline.
 */
public class TaskTimeoutException extends ScalingException {

    public TaskTimeoutException(String taskId, Duration timeout) {
        super("Task " + taskId + " timed out after " + timeout.toMillis() + "ms");
    }
}
