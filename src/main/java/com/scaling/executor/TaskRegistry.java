package com.scaling.executor;

import com.scaling.core.TaskFailure;
import com.scaling.core.TaskResult;
import com.scaling.core.TaskState;
import com.scaling.exception.DuplicateTaskIdException;
import com.scaling.exception.ResultWaitTimeoutException;
import com.scaling.exception.TaskFailedException;
import com.scaling.exception.TaskNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks every submitted task from registration until it is pruned.
 * <p>
 * Each entry carries a one-shot future: the worker that executed the task completes it
 * exactly once with a {@link TaskResult}, or exceptionally with a {@link TaskFailedException}.
 * Waiters block on that future, never on polling.
 */
public class TaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(TaskRegistry.class);

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicLong completedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();
    private final AtomicLong runningCount = new AtomicLong();

    /**
     * Register a new task id in PENDING state.
     *
     * @throws DuplicateTaskIdException if the id is already registered
     */
    public void register(String taskId) {
        Entry previous = entries.putIfAbsent(taskId, new Entry(taskId));
        if (previous != null) {
            throw new DuplicateTaskIdException(taskId);
        }
    }

    /**
     * Drop a registration that never reached a lane (e.g. the lane was full).
     */
    void unregister(String taskId) {
        entries.computeIfPresent(taskId, (id, entry) -> entry.state == TaskState.PENDING ? null : entry);
    }

    void markRunning(String taskId) {
        Entry entry = entries.get(taskId);
        if (entry != null && entry.state == TaskState.PENDING) {
            entry.state = TaskState.RUNNING;
            runningCount.incrementAndGet();
        }
    }

    /**
     * Record a successful outcome. Later writes for the same id are ignored.
     *
     * @return true if this call recorded the outcome
     */
    boolean recordResult(TaskResult result) {
        Entry entry = entries.get(result.taskId());
        if (entry == null) {
            return false;
        }
        synchronized (entry) {
            if (entry.outcome.isDone()) {
                log.warn("Outcome for task {} already recorded, ignoring result", result.taskId());
                return false;
            }
            finish(entry, TaskState.SUCCEEDED, result.completedAt());
            completedCount.incrementAndGet();
            entry.outcome.complete(result);
        }
        return true;
    }

    /**
     * Record a failed outcome. Later writes for the same id are ignored.
     *
     * @return true if this call recorded the outcome
     */
    boolean recordFailure(TaskFailure failure) {
        Entry entry = entries.get(failure.taskId());
        if (entry == null) {
            return false;
        }
        synchronized (entry) {
            if (entry.outcome.isDone()) {
                log.warn("Outcome for task {} already recorded, ignoring failure", failure.taskId());
                return false;
            }
            entry.failure = failure;
            finish(entry, TaskState.FAILED, failure.failedAt());
            failedCount.incrementAndGet();
            entry.outcome.completeExceptionally(new TaskFailedException(failure));
        }
        return true;
    }

    private void finish(Entry entry, TaskState state, Instant at) {
        if (entry.state == TaskState.RUNNING) {
            runningCount.decrementAndGet();
        }
        entry.finishedAt = at;
        entry.state = state;
    }

    /**
     * Wait for the outcome of a task.
     *
     * @return the recorded result; repeated calls return the same instance
     * @throws TaskNotFoundException      if the id is not registered
     * @throws ResultWaitTimeoutException if no outcome is recorded within the timeout
     * @throws TaskFailedException        if a failure was recorded
     */
    public TaskResult await(String taskId, Duration timeout) throws InterruptedException {
        Entry entry = requireEntry(taskId);
        try {
            return entry.outcome.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new ResultWaitTimeoutException(taskId, timeout);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof TaskFailedException failed) {
                // Fresh exception per waiter, raised from the waiting thread
                throw new TaskFailedException(failed.getFailure());
            }
            throw new IllegalStateException("Unexpected outcome for task " + taskId, e.getCause());
        }
    }

    /**
     * Outcome future for asynchronous callers. Completing the returned copy has no effect on the registry.
     */
    public CompletableFuture<TaskResult> future(String taskId) {
        return requireEntry(taskId).outcome.copy();
    }

    public Optional<TaskState> state(String taskId) {
        Entry entry = entries.get(taskId);
        return entry != null ? Optional.of(entry.state) : Optional.empty();
    }

    public Optional<TaskResult> result(String taskId) {
        Entry entry = entries.get(taskId);
        if (entry == null || entry.state != TaskState.SUCCEEDED) {
            return Optional.empty();
        }
        return Optional.of(entry.outcome.join());
    }

    public Optional<TaskFailure> failure(String taskId) {
        Entry entry = entries.get(taskId);
        if (entry == null || entry.state != TaskState.FAILED) {
            return Optional.empty();
        }
        return Optional.ofNullable(entry.failure);
    }

    /**
     * Remove a finished task so its id can be reused.
     *
     * @return true if removed, false if unknown or still pending/running
     */
    public boolean remove(String taskId) {
        Entry entry = entries.get(taskId);
        if (entry == null || !entry.state.isFinished()) {
            return false;
        }
        return entries.remove(taskId, entry);
    }

    /**
     * Remove finished tasks older than the given age.
     *
     * @return number of entries removed
     */
    public int prune(Duration olderThan) {
        Instant cutoff = Instant.now().minus(olderThan);
        int removed = 0;
        Iterator<Entry> it = entries.values().iterator();
        while (it.hasNext()) {
            Entry entry = it.next();
            Instant finishedAt = entry.finishedAt;
            if (entry.state.isFinished() && finishedAt != null && finishedAt.isBefore(cutoff)) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Pruned {} finished tasks older than {}", removed, olderThan);
        }
        return removed;
    }

    private Entry requireEntry(String taskId) {
        Entry entry = entries.get(taskId);
        if (entry == null) {
            throw new TaskNotFoundException(taskId);
        }
        return entry;
    }

    public int size() {
        return entries.size();
    }

    public long getCompletedCount() {
        return completedCount.get();
    }

    public long getFailedCount() {
        return failedCount.get();
    }

    public long getRunningCount() {
        return runningCount.get();
    }

    private static final class Entry {
        private final String taskId;
        private final CompletableFuture<TaskResult> outcome = new CompletableFuture<>();
        private volatile TaskState state = TaskState.PENDING;
        private volatile TaskFailure failure;
        private volatile Instant finishedAt;

        private Entry(String taskId) {
            this.taskId = taskId;
        }

        @Override
        public String toString() {
            return "Entry{taskId='" + taskId + "', state=" + state + '}';
        }
    }
}
