package com.scaling.scheduler;

import com.scaling.config.TaskConfig;
import com.scaling.core.Priority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory scheduler with one bounded FIFO lane per {@link Priority}.
 * <p>
 * Draining is strict-priority: CRITICAL, HIGH, NORMAL, LOW, first non-empty lane wins.
 * Sustained high-priority load can therefore postpone LOW work indefinitely.
 * When a starvation guard interval N is configured, every N-th dequeue is taken from
 * the lanes below CRITICAL in rotation (HIGH, NORMAL, LOW, skipping empty ones), so a
 * non-empty lower lane is served at least once every 3N dequeues.
 */
public class DefaultPriorityLaneScheduler<T> implements PriorityLaneScheduler<T> {

    private static final Logger log = LoggerFactory.getLogger(DefaultPriorityLaneScheduler.class);

    private final Map<Priority, BoundedLane<T>> lanes;
    private final List<BoundedLane<T>> drainOrder;
    private final List<BoundedLane<T>> lowerLanes;
    private final int starvationGuardInterval;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final Object monitor = new Object();

    // guarded by monitor
    private long dequeueCount;
    private int guardCursor;

    public DefaultPriorityLaneScheduler(TaskConfig config) {
        this.lanes = new EnumMap<>(Priority.class);
        this.drainOrder = new ArrayList<>();
        for (Priority priority : Priority.values()) {
            BoundedLane<T> lane = new BoundedLane<>(priority, config.capacityOf(priority));
            lanes.put(priority, lane);
            drainOrder.add(lane);
        }
        this.lowerLanes = List.copyOf(drainOrder.subList(1, drainOrder.size()));
        this.starvationGuardInterval = config.starvationGuardInterval();

        log.info("DefaultPriorityLaneScheduler initialized with {} lanes, starvation guard: {}",
                lanes.size(), starvationGuardInterval > 0 ? "1-in-" + starvationGuardInterval : "off");
    }

    @Override
    public boolean submit(Priority priority, T payload) {
        if (priority == null) {
            throw new NullPointerException("Priority cannot be null");
        }
        if (payload == null) {
            throw new NullPointerException("Payload cannot be null");
        }
        if (shutdown.get()) {
            log.warn("Scheduler is shutdown, rejecting payload for lane '{}'", priority.laneName());
            return false;
        }

        BoundedLane<T> lane = lanes.get(priority);
        synchronized (monitor) {
            if (!lane.offer(payload)) {
                log.warn("Lane '{}' is full (capacity={}), rejecting payload", priority.laneName(), lane.capacity());
                return false;
            }
            monitor.notifyAll();
        }
        return true;
    }

    @Override
    public Optional<T> getNext(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);

        synchronized (monitor) {
            while (true) {
                Optional<T> item = pollLanes();
                if (item.isPresent() || shutdown.get()) {
                    return item;
                }

                // All lanes empty, wait with remaining timeout
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return Optional.empty();
                }
                long waitMillis = Math.max(1L, TimeUnit.NANOSECONDS.toMillis(remaining));
                monitor.wait(waitMillis);
            }
        }
    }

    // caller holds monitor
    private Optional<T> pollLanes() {
        boolean guardTurn = starvationGuardInterval > 0
                && (dequeueCount + 1) % starvationGuardInterval == 0;
        if (guardTurn) {
            Optional<T> item = pollLowerLane();
            if (item.isPresent()) {
                dequeueCount++;
                return item;
            }
        }

        for (BoundedLane<T> lane : drainOrder) {
            Optional<T> item = lane.poll();
            if (item.isPresent()) {
                dequeueCount++;
                return item;
            }
        }
        return Optional.empty();
    }

    // caller holds monitor; the cursor moves past the lane that was served
    private Optional<T> pollLowerLane() {
        int count = lowerLanes.size();
        for (int i = 0; i < count; i++) {
            int index = (guardCursor + i) % count;
            BoundedLane<T> lane = lowerLanes.get(index);
            Optional<T> item = lane.poll();
            if (item.isPresent()) {
                guardCursor = (index + 1) % count;
                log.trace("Starvation guard dequeued from lane '{}'", lane.priority().laneName());
                return item;
            }
        }
        return Optional.empty();
    }

    @Override
    public List<T> drain() {
        List<T> drained = new ArrayList<>();
        synchronized (monitor) {
            for (BoundedLane<T> lane : drainOrder) {
                drained.addAll(lane.drain());
            }
        }
        return drained;
    }

    @Override
    public int size() {
        return drainOrder.stream().mapToInt(BoundedLane::size).sum();
    }

    @Override
    public int size(Priority priority) {
        return lanes.get(priority).size();
    }

    @Override
    public int capacity(Priority priority) {
        return lanes.get(priority).capacity();
    }

    @Override
    public int remainingCapacity(Priority priority) {
        return lanes.get(priority).remainingCapacity();
    }

    @Override
    public void shutdown() {
        shutdown.set(true);
        synchronized (monitor) {
            monitor.notifyAll();
        }
        log.info("DefaultPriorityLaneScheduler shutdown, {} items remaining", size());
    }

    @Override
    public boolean isShutdown() {
        return shutdown.get();
    }
}
