package com.scaling.core;

/**
 * Why a task ended without a value.
 */
public enum FailureKind {
    /** The work unit exceeded its execution deadline. */
    TIMEOUT,
    /** The work unit threw. */
    EXECUTION_ERROR,
    /** The executor was stopped before or while the task ran. */
    CANCELLED
}
