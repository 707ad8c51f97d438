package com.scaling.exception;

import java.time.Duration;

/**
 * Thrown when a caller gives up waiting for a result.
 * The task itself is unaffected and may still complete; the outcome is "not yet known".
 */
public class ResultWaitTimeoutException extends ScalingException {

    private final String taskId;

    public ResultWaitTimeoutException(String taskId, Duration waited) {
        super("No result for task " + taskId + " after " + waited.toMillis() + "ms");
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
