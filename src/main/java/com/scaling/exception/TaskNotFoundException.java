package com.scaling.exception;

/**
 * Thrown when a result is requested for a task id the registry does not hold.
 */
public class TaskNotFoundException extends ScalingException {

    public TaskNotFoundException(String taskId) {
        super("Unknown task: " + taskId);
    }
}
