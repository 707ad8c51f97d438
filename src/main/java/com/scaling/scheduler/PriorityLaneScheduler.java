package com.scaling.scheduler;

import com.scaling.core.Priority;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Set of bounded priority lanes drained by workers.
 * Orders payloads without executing them.
 *
 * @param <T> Payload type
 */
public interface PriorityLaneScheduler<T> {

    /**
     * Offer a payload to the lane of the given priority. Never blocks.
     *
     * @return true if accepted, false if the lane is full or the scheduler is shut down
     */
    boolean submit(Priority priority, T payload);

    /**
     * Take the next payload, waiting up to the timeout when every lane is empty.
     * Lanes are checked CRITICAL first, LOW last.
     * After shutdown, remaining payloads are still handed out; an empty result
     * from a shut-down scheduler means it is fully drained.
     */
    Optional<T> getNext(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * Remove and return every pending payload, highest priority first.
     */
    List<T> drain();

    /**
     * Total pending payloads across lanes.
     */
    int size();

    /**
     * Pending payloads in one lane.
     */
    int size(Priority priority);

    /**
     * Configured capacity of one lane.
     */
    int capacity(Priority priority);

    /**
     * Remaining capacity of one lane.
     */
    int remainingCapacity(Priority priority);

    /**
     * Stop accepting submissions and wake waiting consumers.
     */
    void shutdown();

    boolean isShutdown();
}
