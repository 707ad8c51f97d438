package com.scaling.executor;

import com.scaling.core.Priority;
import com.scaling.core.TaskCallback;
import com.scaling.core.TaskState;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point for submitting prioritized work units and collecting their results.
 */
public interface TaskExecutor {

    /**
     * Start the worker pool. Tasks submitted before start stay queued until then.
     */
    void start();

    /**
     * Submit a work unit with the default task timeout and no callback.
     *
     * @see #submit(String, Callable, Priority, TaskCallback, Duration)
     */
    <T> boolean submit(String taskId, Callable<T> work, Priority priority);

    /**
     * Submit a work unit with the default task timeout.
     *
     * @see #submit(String, Callable, Priority, TaskCallback, Duration)
     */
    <T> boolean submit(String taskId, Callable<T> work, Priority priority, TaskCallback<? super T> callback);

    /**
     * Submit a work unit to the lane of the given priority. Never blocks.
     *
     * @param taskId   Unique task id
     * @param work     Work unit to execute
     * @param priority Target lane
     * @param callback Invoked after the outcome is recorded (may be null)
     * @param timeout  Execution deadline for this task
     * @return true if queued, false if the lane is full (backpressure: retry later or shed load)
     * @throws com.scaling.exception.DuplicateTaskIdException if the id is already registered
     * @throws com.scaling.exception.TaskRejectedException    if the executor is shut down
     */
    <T> boolean submit(String taskId, Callable<T> work, Priority priority,
                       TaskCallback<? super T> callback, Duration timeout);

    /**
     * Wait for the result of a task.
     *
     * @param taskId  Task id
     * @param timeout How long to wait; independent of the task's own execution deadline
     * @param <T>     Expected value type
     * @return the value produced by the work unit; repeated calls return the same value
     * @throws com.scaling.exception.ResultWaitTimeoutException if no outcome arrives in time
     * @throws com.scaling.exception.TaskFailedException        if the task failed or timed out
     * @throws com.scaling.exception.TaskNotFoundException      if the id is unknown
     * @throws InterruptedException                             if interrupted while waiting
     */
    <T> T getResult(String taskId, Duration timeout) throws InterruptedException;

    /**
     * Future completing with the task's value, or exceptionally with a
     * {@link com.scaling.exception.TaskFailedException}.
     */
    <T> CompletableFuture<T> resultFuture(String taskId);

    /**
     * Current lifecycle state, empty if the id is unknown.
     */
    Optional<TaskState> status(String taskId);

    /**
     * Graceful shutdown - rejects new submissions, workers finish queued tasks then exit.
     */
    void shutdown();

    /**
     * Immediate shutdown - interrupts workers, cancels in-flight tasks and fails queued ones as CANCELLED.
     */
    void shutdownNow();

    /**
     * Wait for all workers to exit after shutdown.
     *
     * @return true if terminated, false if timeout elapsed
     */
    boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException;

    boolean isShutdown();

    boolean isTerminated();

    /**
     * Current queue depth across lanes.
     */
    int getQueueSize();

    /**
     * Number of workers currently executing a task.
     */
    int getActiveCount();
}
