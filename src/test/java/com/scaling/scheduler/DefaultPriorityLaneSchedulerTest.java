package com.scaling.scheduler;

import com.scaling.config.LaneConfig;
import com.scaling.config.TaskConfig;
import com.scaling.core.Priority;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultPriorityLaneScheduler.
 */
class DefaultPriorityLaneSchedulerTest {

    private static DefaultPriorityLaneScheduler<String> scheduler(int capacity) {
        return new DefaultPriorityLaneScheduler<>(TaskConfig.minimal(1, capacity, Duration.ofSeconds(1)));
    }

    private static List<String> drainAll(PriorityLaneScheduler<String> scheduler) throws InterruptedException {
        List<String> taken = new ArrayList<>();
        Optional<String> next;
        while ((next = scheduler.getNext(10, TimeUnit.MILLISECONDS)).isPresent()) {
            taken.add(next.get());
        }
        return taken;
    }

    @Test
    @DisplayName("Should dequeue in strict priority order regardless of arrival")
    void shouldDequeueInPriorityOrder() throws InterruptedException {
        DefaultPriorityLaneScheduler<String> scheduler = scheduler(10);

        scheduler.submit(Priority.LOW, "low");
        scheduler.submit(Priority.NORMAL, "normal");
        scheduler.submit(Priority.HIGH, "high");
        scheduler.submit(Priority.CRITICAL, "critical");

        assertEquals(List.of("critical", "high", "normal", "low"), drainAll(scheduler));
    }

    @Test
    @DisplayName("Should keep FIFO order within a lane")
    void shouldKeepFifoWithinLane() throws InterruptedException {
        DefaultPriorityLaneScheduler<String> scheduler = scheduler(10);

        for (int i = 0; i < 5; i++) {
            scheduler.submit(Priority.NORMAL, "n" + i);
        }

        assertEquals(List.of("n0", "n1", "n2", "n3", "n4"), drainAll(scheduler));
    }

    @Test
    @DisplayName("Should reject when a lane is at capacity without affecting other lanes")
    void shouldRejectWhenLaneFull() {
        DefaultPriorityLaneScheduler<String> scheduler = scheduler(2);

        assertTrue(scheduler.submit(Priority.LOW, "a"));
        assertTrue(scheduler.submit(Priority.LOW, "b"));
        assertFalse(scheduler.submit(Priority.LOW, "c"));
        assertTrue(scheduler.submit(Priority.HIGH, "d"));

        assertEquals(2, scheduler.size(Priority.LOW));
        assertEquals(0, scheduler.remainingCapacity(Priority.LOW));
        assertEquals(3, scheduler.size());
    }

    @Test
    @DisplayName("Should honor per-lane capacities")
    void shouldHonorPerLaneCapacity() {
        TaskConfig config = new TaskConfig(1,
                List.of(new LaneConfig(Priority.CRITICAL, 3), new LaneConfig(Priority.HIGH, 1),
                        new LaneConfig(Priority.NORMAL, 1), new LaneConfig(Priority.LOW, 1)),
                Duration.ofSeconds(1), 0, Duration.ofMillis(10), 0, "t-");
        DefaultPriorityLaneScheduler<String> scheduler = new DefaultPriorityLaneScheduler<>(config);

        assertEquals(3, scheduler.capacity(Priority.CRITICAL));
        assertEquals(1, scheduler.capacity(Priority.LOW));
        assertTrue(scheduler.submit(Priority.CRITICAL, "c1"));
        assertTrue(scheduler.submit(Priority.CRITICAL, "c2"));
        assertTrue(scheduler.submit(Priority.CRITICAL, "c3"));
        assertFalse(scheduler.submit(Priority.CRITICAL, "c4"));
    }

    @Test
    @DisplayName("Should return empty after the poll timeout when all lanes are empty")
    void shouldTimeOutWhenEmpty() throws InterruptedException {
        DefaultPriorityLaneScheduler<String> scheduler = scheduler(2);

        long start = System.nanoTime();
        Optional<String> next = scheduler.getNext(50, TimeUnit.MILLISECONDS);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(next.isEmpty());
        assertTrue(elapsedMillis >= 40, "waited " + elapsedMillis + "ms");
    }

    @Test
    @DisplayName("Should wake a waiting consumer when an item arrives")
    void shouldWakeWaitingConsumer() throws InterruptedException {
        DefaultPriorityLaneScheduler<String> scheduler = scheduler(2);
        AtomicReference<Optional<String>> received = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        Thread consumer = new Thread(() -> {
            try {
                received.set(scheduler.getNext(5, TimeUnit.SECONDS));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            done.countDown();
        });
        consumer.start();
        Thread.sleep(50);
        scheduler.submit(Priority.NORMAL, "wake");

        assertTrue(done.await(2, TimeUnit.SECONDS));
        assertEquals(Optional.of("wake"), received.get());
    }

    @Test
    @DisplayName("Should hand out remaining items after shutdown and reject new ones")
    void shouldDrainAfterShutdown() throws InterruptedException {
        DefaultPriorityLaneScheduler<String> scheduler = scheduler(5);
        scheduler.submit(Priority.LOW, "queued");

        scheduler.shutdown();

        assertTrue(scheduler.isShutdown());
        assertFalse(scheduler.submit(Priority.CRITICAL, "late"));
        assertEquals(Optional.of("queued"), scheduler.getNext(10, TimeUnit.MILLISECONDS));
        assertTrue(scheduler.getNext(1, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    @DisplayName("Should drain all lanes in priority order")
    void shouldDrainInPriorityOrder() {
        DefaultPriorityLaneScheduler<String> scheduler = scheduler(5);
        scheduler.submit(Priority.LOW, "low");
        scheduler.submit(Priority.CRITICAL, "critical");

        assertEquals(List.of("critical", "low"), scheduler.drain());
        assertEquals(0, scheduler.size());
    }

    @Test
    @DisplayName("Starvation guard should serve a waiting LOW lane every N-th dequeue")
    void starvationGuardShouldServeLowerLanes() throws InterruptedException {
        TaskConfig config = TaskConfig.minimal(1, 20, Duration.ofSeconds(1)).withStarvationGuardInterval(3);
        DefaultPriorityLaneScheduler<String> scheduler = new DefaultPriorityLaneScheduler<>(config);

        for (int i = 0; i < 6; i++) {
            scheduler.submit(Priority.CRITICAL, "c" + i);
        }
        scheduler.submit(Priority.LOW, "l0");
        scheduler.submit(Priority.LOW, "l1");

        List<String> order = drainAll(scheduler);

        assertEquals(List.of("c0", "c1", "l0", "c2", "c3", "l1", "c4", "c5"), order);
    }

    @Test
    @DisplayName("Starvation guard should rotate between the lanes below CRITICAL")
    void starvationGuardShouldRotateLowerLanes() throws InterruptedException {
        TaskConfig config = TaskConfig.minimal(1, 20, Duration.ofSeconds(1)).withStarvationGuardInterval(2);
        DefaultPriorityLaneScheduler<String> scheduler = new DefaultPriorityLaneScheduler<>(config);

        for (int i = 0; i < 6; i++) {
            scheduler.submit(Priority.CRITICAL, "c" + i);
        }
        scheduler.submit(Priority.HIGH, "h0");
        scheduler.submit(Priority.HIGH, "h1");
        scheduler.submit(Priority.LOW, "l0");
        scheduler.submit(Priority.LOW, "l1");

        List<String> order = drainAll(scheduler);

        assertEquals(List.of("c0", "h0", "c1", "l0", "c2", "h1", "c3", "l1", "c4", "c5"), order);
    }
}
