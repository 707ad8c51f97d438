package com.scaling.exception;

/**
 * Thrown at submit time when the task id is already known to the registry.
 */
public class DuplicateTaskIdException extends ScalingException {

    private final String taskId;

    public DuplicateTaskIdException(String taskId) {
        super("Task id already registered: " + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
