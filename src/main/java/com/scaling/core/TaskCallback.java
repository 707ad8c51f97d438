package com.scaling.core;

/**
 * Completion hook invoked by the worker after the outcome has been recorded.
 * Exactly one of {@code value} and {@code error} is meaningful: on success {@code error} is null.
 *
 * @param <T> Result type of the work unit
 */
@FunctionalInterface
public interface TaskCallback<T> {

    void onComplete(String taskId, T value, Throwable error);
}
