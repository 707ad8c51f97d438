package com.scaling.executor;

import com.scaling.config.TaskConfig;
import com.scaling.core.FailureKind;
import com.scaling.core.Task;
import com.scaling.core.TaskCallback;
import com.scaling.core.TaskFailure;
import com.scaling.core.TaskResult;
import com.scaling.exception.TaskTimeoutException;
import com.scaling.scheduler.PriorityLaneScheduler;
import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Worker thread that pulls tasks from the priority lanes and runs each one under its deadline.
 * <p>
 * The work unit itself runs on the shared execution pool so that a timed-out body can be
 * cancelled without taking the worker down with it.
 */
final class WorkerThread extends Thread {

    private final int workerId;
    private final TaskConfig config;
    private final PriorityLaneScheduler<Task<?>> scheduler;
    private final ExecutorService executionPool;
    private final TaskRegistry registry;
    private final WorkerStats stats;
    private final AtomicBoolean stopNow;
    private final AtomicInteger activeCount;
    private final AtomicLong totalExecutionNanos;
    private final Logger log;

    WorkerThread(
            int workerId,
            TaskConfig config,
            PriorityLaneScheduler<Task<?>> scheduler,
            ExecutorService executionPool,
            TaskRegistry registry,
            WorkerStats stats,
            AtomicBoolean stopNow,
            AtomicInteger activeCount,
            AtomicLong totalExecutionNanos,
            Logger log
    ) {
        super(config.threadNamePrefix() + workerId);
        this.workerId = workerId;
        this.config = config;
        this.scheduler = scheduler;
        this.executionPool = executionPool;
        this.registry = registry;
        this.stats = stats;
        this.stopNow = stopNow;
        this.activeCount = activeCount;
        this.totalExecutionNanos = totalExecutionNanos;
        this.log = log;
        setDaemon(false);
    }

    @Override
    public void run() {
        log.debug("Worker {} started", workerId);
        long idlePollMillis = config.idlePoll().toMillis();

        while (!stopNow.get()) {
            Optional<Task<?>> next;
            try {
                next = scheduler.getNext(idlePollMillis, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                if (stopNow.get()) {
                    log.debug("Worker {} interrupted for shutdown", workerId);
                    break;
                }
                continue;
            }

            if (next.isEmpty()) {
                if (scheduler.isShutdown()) {
                    // Lanes drained after a graceful shutdown
                    break;
                }
                continue;
            }

            activeCount.incrementAndGet();
            try {
                execute(next.get());
            } finally {
                activeCount.decrementAndGet();
            }
        }

        log.debug("Worker {} stopped", workerId);
    }

    private <T> void execute(Task<T> task) {
        stats.markBusy();
        registry.markRunning(task.id());
        log.debug("Worker {} executing task {} (priority: {})", workerId, task.id(), task.priority());

        long startNanos = System.nanoTime();
        Future<T> future = executionPool.submit(task.work());
        try {
            T value = future.get(task.timeout().toNanos(), TimeUnit.NANOSECONDS);

            Duration executionTime = Duration.ofNanos(System.nanoTime() - startNanos);
            stats.recordSuccess(executionTime);
            totalExecutionNanos.addAndGet(executionTime.toNanos());
            registry.recordResult(new TaskResult(task.id(), value, executionTime, workerId, Instant.now()));
            log.debug("Worker {} completed task {} in {}ms", workerId, task.id(), executionTime.toMillis());

            invokeCallback(task, value, null);

        } catch (TimeoutException e) {
            future.cancel(true);
            TaskTimeoutException error = new TaskTimeoutException(task.id(), task.timeout());
            log.warn("Worker {}: {}", workerId, error.getMessage());
            fail(task, FailureKind.TIMEOUT, error.getMessage(), error);

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Worker {} task {} failed: {}", workerId, task.id(), cause.getMessage(), cause);
            fail(task, FailureKind.EXECUTION_ERROR, "Task " + task.id() + " failed: " + cause.getMessage(), cause);

        } catch (CancellationException e) {
            fail(task, FailureKind.CANCELLED, "Task " + task.id() + " was cancelled", e);

        } catch (InterruptedException e) {
            future.cancel(true);
            CancellationException error = new CancellationException("Task " + task.id() + " cancelled by executor shutdown");
            log.debug("Worker {} cancelled task {} on shutdown", workerId, task.id());
            fail(task, FailureKind.CANCELLED, error.getMessage(), error);
            Thread.currentThread().interrupt();
        }
    }

    private <T> void fail(Task<T> task, FailureKind kind, String message, Throwable error) {
        stats.recordError();
        registry.recordFailure(new TaskFailure(task.id(), kind, message, error, Instant.now()));
        invokeCallback(task, null, error);
    }

    private <T> void invokeCallback(Task<T> task, T value, Throwable error) {
        TaskCallback<? super T> callback = task.callback();
        if (callback == null) {
            return;
        }
        try {
            callback.onComplete(task.id(), value, error);
        } catch (RuntimeException e) {
            log.warn("Callback for task {} threw: {}", task.id(), e.getMessage(), e);
        }
    }
}
