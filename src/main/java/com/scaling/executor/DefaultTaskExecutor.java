package com.scaling.executor;

import com.scaling.config.TaskConfig;
import com.scaling.core.FailureKind;
import com.scaling.core.Priority;
import com.scaling.core.Task;
import com.scaling.core.TaskCallback;
import com.scaling.core.TaskFailure;
import com.scaling.core.TaskState;
import com.scaling.exception.TaskRejectedException;
import com.scaling.scheduler.DefaultPriorityLaneScheduler;
import com.scaling.scheduler.PriorityLaneScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Default implementation of TaskExecutor.
 * A fixed set of workers drains four bounded priority lanes; results land in a {@link TaskRegistry}.
 */
public class DefaultTaskExecutor implements TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(DefaultTaskExecutor.class);

    private final TaskConfig config;
    private final PriorityLaneScheduler<Task<?>> scheduler;
    private final TaskRegistry registry;
    private final ExecutorService executionPool;

    private final List<WorkerThread> workers = new ArrayList<>();
    private final List<WorkerStats> workerStats = new ArrayList<>();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final AtomicBoolean stopNow = new AtomicBoolean(false);
    private final AtomicInteger activeCount = new AtomicInteger(0);
    private final AtomicLong submittedCount = new AtomicLong(0);
    private final AtomicLong rejectedCount = new AtomicLong(0);
    private final AtomicLong totalExecutionNanos = new AtomicLong(0);
    private final Map<Priority, AtomicLong> submittedByPriority = new EnumMap<>(Priority.class);

    public DefaultTaskExecutor(TaskConfig config) {
        this(config, new DefaultPriorityLaneScheduler<>(config), new TaskRegistry());
    }

    public DefaultTaskExecutor(TaskConfig config, PriorityLaneScheduler<Task<?>> scheduler, TaskRegistry registry) {
        this.config = config;
        this.scheduler = scheduler;
        this.registry = registry;
        for (Priority priority : Priority.values()) {
            submittedByPriority.put(priority, new AtomicLong());
        }

        // Work units run here; a timed-out body is interrupted without blocking its worker
        AtomicInteger threadIndex = new AtomicInteger();
        this.executionPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r);
            t.setName(config.threadNamePrefix() + "exec-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        log.info("TaskExecutor created: {} workers, default timeout {}ms, retry attempts left to callers: {}",
                config.workerCount(), config.taskTimeout().toMillis(), config.retryAttempts());
    }

    @Override
    public void start() {
        if (shutdown.get()) {
            throw new TaskRejectedException("Executor is shutdown");
        }
        if (!started.compareAndSet(false, true)) {
            return;
        }
        synchronized (workers) {
            for (int i = 0; i < config.workerCount(); i++) {
                startWorker(i);
            }
        }
        log.info("TaskExecutor started with {} workers", workers.size());
    }

    private void startWorker(int workerId) {
        WorkerStats stats = new WorkerStats(workerId, config.threadNamePrefix() + workerId);
        WorkerThread worker = new WorkerThread(
                workerId,
                config,
                scheduler,
                executionPool,
                registry,
                stats,
                stopNow,
                activeCount,
                totalExecutionNanos,
                log
        );
        workers.add(worker);
        workerStats.add(stats);
        worker.start();

        log.debug("Started worker {}", worker.getName());
    }

    @Override
    public <T> boolean submit(String taskId, Callable<T> work, Priority priority) {
        return submit(taskId, work, priority, null, config.taskTimeout());
    }

    @Override
    public <T> boolean submit(String taskId, Callable<T> work, Priority priority, TaskCallback<? super T> callback) {
        return submit(taskId, work, priority, callback, config.taskTimeout());
    }

    @Override
    public <T> boolean submit(String taskId, Callable<T> work, Priority priority,
                              TaskCallback<? super T> callback, Duration timeout) {
        if (taskId == null) {
            throw new NullPointerException("Task id cannot be null");
        }
        if (work == null) {
            throw new NullPointerException("Work unit cannot be null");
        }
        if (priority == null) {
            throw new NullPointerException("Priority cannot be null");
        }
        if (shutdown.get()) {
            throw new TaskRejectedException("Executor is shutdown, task rejected: " + taskId);
        }
        Duration effectiveTimeout = timeout != null && !timeout.isNegative() && !timeout.isZero()
                ? timeout
                : config.taskTimeout();

        Task<T> task = new Task<>(taskId, priority, work, callback, effectiveTimeout, Instant.now());

        registry.register(taskId);
        if (!scheduler.submit(priority, task)) {
            registry.unregister(taskId);
            rejectedCount.incrementAndGet();
            log.warn("Lane '{}' full, task {} rejected", priority.laneName(), taskId);
            return false;
        }

        submittedCount.incrementAndGet();
        submittedByPriority.get(priority).incrementAndGet();
        log.debug("Task {} submitted with priority {} (lane size: {})",
                taskId, priority, scheduler.size(priority));
        return true;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T getResult(String taskId, Duration timeout) throws InterruptedException {
        return (T) registry.await(taskId, timeout).value();
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> CompletableFuture<T> resultFuture(String taskId) {
        return registry.future(taskId).thenApply(result -> (T) result.value());
    }

    @Override
    public Optional<TaskState> status(String taskId) {
        return registry.state(taskId);
    }

    @Override
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down TaskExecutor, {} tasks queued", scheduler.size());
        scheduler.shutdown();
        if (!started.get()) {
            // No worker will ever drain the lanes
            cancelPending();
        }
    }

    @Override
    public void shutdownNow() {
        log.info("Shutting down TaskExecutor immediately");
        shutdown.set(true);
        stopNow.set(true);
        scheduler.shutdown();
        cancelPending();

        synchronized (workers) {
            for (WorkerThread worker : workers) {
                worker.interrupt();
            }
        }
    }

    private void cancelPending() {
        List<Task<?>> pending = scheduler.drain();
        for (Task<?> task : pending) {
            CancellationException error = new CancellationException(
                    "Task " + task.id() + " cancelled before execution");
            registry.recordFailure(new TaskFailure(task.id(), FailureKind.CANCELLED,
                    error.getMessage(), error, Instant.now()));
            notifyCancelled(task, error);
        }
        if (!pending.isEmpty()) {
            log.info("Cancelled {} queued tasks", pending.size());
        }
    }

    private <T> void notifyCancelled(Task<T> task, Throwable error) {
        if (!task.hasCallback()) {
            return;
        }
        try {
            task.callback().onComplete(task.id(), null, error);
        } catch (RuntimeException e) {
            log.warn("Callback for task {} threw: {}", task.id(), e.getMessage(), e);
        }
    }

    @Override
    public boolean isShutdown() {
        return shutdown.get();
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);

        List<WorkerThread> snapshot;
        synchronized (workers) {
            snapshot = new ArrayList<>(workers);
        }
        for (WorkerThread worker : snapshot) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            worker.join(Math.max(1L, TimeUnit.NANOSECONDS.toMillis(remaining)));
            if (worker.isAlive()) {
                return false;
            }
        }
        executionPool.shutdownNow();
        return true;
    }

    @Override
    public boolean isTerminated() {
        if (!shutdown.get()) {
            return false;
        }
        synchronized (workers) {
            for (WorkerThread worker : workers) {
                if (worker.isAlive()) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public int getQueueSize() {
        return scheduler.size();
    }

    @Override
    public int getActiveCount() {
        return activeCount.get();
    }

    /**
     * Get queue size for a specific lane.
     */
    public int getQueueSize(Priority priority) {
        return scheduler.size(priority);
    }

    /**
     * Get the configured capacity of a lane.
     */
    public int getQueueCapacity(Priority priority) {
        return scheduler.capacity(priority);
    }

    /**
     * Get number of workers that are still running.
     */
    public int getWorkerCount() {
        synchronized (workers) {
            return (int) workers.stream().filter(Thread::isAlive).count();
        }
    }

    /**
     * Per-worker statistics, in worker id order.
     */
    public List<WorkerStats.Snapshot> getWorkerStats() {
        synchronized (workers) {
            List<WorkerStats.Snapshot> snapshots = new ArrayList<>(workerStats.size());
            for (WorkerStats stats : workerStats) {
                snapshots.add(stats.snapshot());
            }
            return Collections.unmodifiableList(snapshots);
        }
    }

    /**
     * Accepted submissions per priority since start.
     */
    public Map<Priority, Long> getSubmittedByPriority() {
        Map<Priority, Long> counts = new EnumMap<>(Priority.class);
        submittedByPriority.forEach((priority, count) -> counts.put(priority, count.get()));
        return counts;
    }

    /**
     * Mean execution time over all successful tasks.
     */
    public Duration getAverageExecutionTime() {
        long completed = registry.getCompletedCount();
        if (completed == 0) {
            return Duration.ZERO;
        }
        return Duration.ofNanos(totalExecutionNanos.get() / completed);
    }

    /**
     * Get statistics about the executor.
     */
    public ExecutorStats getStats() {
        return new ExecutorStats(
                submittedCount.get(),
                registry.getCompletedCount(),
                registry.getFailedCount(),
                rejectedCount.get(),
                scheduler.size(),
                activeCount.get(),
                getWorkerCount()
        );
    }

    public TaskConfig getConfig() {
        return config;
    }
}
