package com.scaling.core;

/**
 * Lifecycle state of a registered task.
 */
public enum TaskState {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED;

    public boolean isFinished() {
        return this == SUCCEEDED || this == FAILED;
    }
}
