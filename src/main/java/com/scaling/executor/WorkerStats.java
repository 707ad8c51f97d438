package com.scaling.executor;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-worker counters. Mutated only by the owning worker; read by metrics.
 */
public final class WorkerStats {

    private final int workerId;
    private final String workerName;
    private final AtomicLong tasksProcessed = new AtomicLong();
    private final AtomicLong totalExecutionNanos = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private volatile Instant lastTaskTime;
    private volatile boolean busy;

    WorkerStats(int workerId, String workerName) {
        this.workerId = workerId;
        this.workerName = workerName;
    }

    void markBusy() {
        busy = true;
    }

    void recordSuccess(Duration executionTime) {
        tasksProcessed.incrementAndGet();
        totalExecutionNanos.addAndGet(executionTime.toNanos());
        lastTaskTime = Instant.now();
        busy = false;
    }

    void recordError() {
        errors.incrementAndGet();
        lastTaskTime = Instant.now();
        busy = false;
    }

    public Snapshot snapshot() {
        return new Snapshot(
                workerId,
                workerName,
                tasksProcessed.get(),
                Duration.ofNanos(totalExecutionNanos.get()),
                lastTaskTime,
                errors.get(),
                busy
        );
    }

    /**
     * Point-in-time copy of a worker's counters.
     */
    public record Snapshot(
            int workerId,
            String workerName,
            long tasksProcessed,
            Duration totalExecutionTime,
            Instant lastTaskTime,
            long errors,
            boolean busy
    ) {}
}
