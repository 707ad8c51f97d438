package com.scaling.exception;

/**
 * Exception thrown when a task cannot be accepted because the executor is shut down.
 * A full lane is not an exception: {@code submit} returns {@code false} instead.
 */
public class TaskRejectedException extends ScalingException {

    public TaskRejectedException(String message) {
        super(message);
    }
}
