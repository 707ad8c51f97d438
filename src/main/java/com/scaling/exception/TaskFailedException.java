package com.scaling.exception;

import com.scaling.core.TaskFailure;

/**
 * Surfaces a recorded {@link TaskFailure} to the caller of {@code getResult}.
 */
public class TaskFailedException extends ScalingException {

    private final TaskFailure failure;

    public TaskFailedException(TaskFailure failure) {
        super("Task " + failure.taskId() + " failed (" + failure.kind() + "): " + failure.message(),
                failure.cause());
        this.failure = failure;
    }

    public TaskFailure getFailure() {
        return failure;
    }
}
