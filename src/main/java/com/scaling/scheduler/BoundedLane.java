package com.scaling.scheduler;

import com.scaling.core.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;

/**
 * Bounded FIFO lane for one priority.
 * <p>
 * Offers never block: a full lane rejects immediately so callers see backpressure
 * instead of queuing without bound.
 *
 * @param <T> Payload type
 */
final class BoundedLane<T> {

    private static final Logger log = LoggerFactory.getLogger(BoundedLane.class);

    private final Priority priority;
    private final int capacity;
    private final ArrayBlockingQueue<T> queue;

    BoundedLane(Priority priority, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Lane capacity must be positive: " + capacity);
        }
        this.priority = priority;
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
        log.info("Lane '{}' initialized with capacity: {}", priority.laneName(), capacity);
    }

    boolean offer(T item) {
        boolean added = queue.offer(item);
        if (added) {
            log.trace("Item enqueued to '{}', size: {}", priority.laneName(), queue.size());
        }
        return added;
    }

    Optional<T> poll() {
        return Optional.ofNullable(queue.poll());
    }

    List<T> drain() {
        List<T> drained = new ArrayList<>();
        queue.drainTo(drained);
        return drained;
    }

    Priority priority() {
        return priority;
    }

    int size() {
        return queue.size();
    }

    int capacity() {
        return capacity;
    }

    int remainingCapacity() {
        return queue.remainingCapacity();
    }
}
