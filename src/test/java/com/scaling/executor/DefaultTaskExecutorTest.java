package com.scaling.executor;

import com.scaling.config.TaskConfig;
import com.scaling.core.FailureKind;
import com.scaling.core.Priority;
import com.scaling.core.TaskState;
import com.scaling.exception.DuplicateTaskIdException;
import com.scaling.exception.ResultWaitTimeoutException;
import com.scaling.exception.TaskFailedException;
import com.scaling.exception.TaskNotFoundException;
import com.scaling.exception.TaskRejectedException;
import com.scaling.exception.TaskTimeoutException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultTaskExecutor.
 */
class DefaultTaskExecutorTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private DefaultTaskExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null && !executor.isShutdown()) {
            executor.shutdownNow();
        }
    }

    private DefaultTaskExecutor create(int workers, int laneCapacity, Duration timeout) {
        executor = new DefaultTaskExecutor(TaskConfig.minimal(workers, laneCapacity, timeout));
        return executor;
    }

    @Test
    @DisplayName("Should execute a task and return its value")
    void shouldExecuteTask() throws Exception {
        create(2, 10, Duration.ofSeconds(1)).start();

        assertTrue(executor.submit("t1", () -> "done", Priority.NORMAL));

        assertEquals("done", executor.getResult("t1", WAIT));
        assertEquals(TaskState.SUCCEEDED, executor.status("t1").orElseThrow());
    }

    @Test
    @DisplayName("Should return false once a lane is full")
    void shouldApplyBackpressure() {
        create(1, 2, Duration.ofSeconds(1));

        assertTrue(executor.submit("a", () -> 1, Priority.LOW));
        assertTrue(executor.submit("b", () -> 2, Priority.LOW));
        assertFalse(executor.submit("c", () -> 3, Priority.LOW));

        assertTrue(executor.status("c").isEmpty(), "rejected task must not stay registered");
        assertTrue(executor.submit("d", () -> 4, Priority.HIGH), "other lanes keep accepting");
        assertEquals(1, executor.getStats().rejectedCount());
        assertEquals(3, executor.getStats().submittedCount());
        assertEquals(2, executor.getQueueSize(Priority.LOW));
        assertEquals(2, executor.getQueueCapacity(Priority.LOW));
    }

    @Test
    @DisplayName("Should allow resubmitting an id rejected by a full lane")
    void shouldAllowResubmitAfterRejection() throws Exception {
        create(1, 1, Duration.ofSeconds(1));
        executor.submit("a", () -> 1, Priority.LOW);
        assertFalse(executor.submit("b", () -> 2, Priority.LOW));

        assertTrue(executor.submit("b", () -> 2, Priority.HIGH));
        executor.start();

        assertEquals(2, (int) executor.getResult("b", WAIT));
    }

    @Test
    @DisplayName("Should reject duplicate task ids")
    void shouldRejectDuplicateIds() {
        create(1, 10, Duration.ofSeconds(1));
        executor.submit("dup", () -> 1, Priority.NORMAL);

        DuplicateTaskIdException e = assertThrows(DuplicateTaskIdException.class,
                () -> executor.submit("dup", () -> 2, Priority.CRITICAL));
        assertEquals("dup", e.getTaskId());
    }

    @Test
    @DisplayName("Should run a later critical task before an earlier low task")
    void shouldPreferHigherPriority() throws Exception {
        create(1, 10, Duration.ofSeconds(1));
        List<String> order = new CopyOnWriteArrayList<>();

        executor.submit("low", () -> order.add("low"), Priority.LOW);
        executor.submit("critical", () -> order.add("critical"), Priority.CRITICAL);
        executor.start();

        executor.getResult("low", WAIT);
        assertEquals(List.of("critical", "low"), order);
    }

    @Test
    @DisplayName("Should complete in priority order on a single worker")
    void shouldCompleteInPriorityOrder() throws Exception {
        create(1, 10, Duration.ofSeconds(1));
        List<String> completed = new CopyOnWriteArrayList<>();

        executor.submit("normal", sleepThenReturn(50, "n"), Priority.NORMAL, (id, v, e) -> completed.add(id));
        executor.submit("low", sleepThenReturn(50, "l"), Priority.LOW, (id, v, e) -> completed.add(id));
        executor.submit("critical", sleepThenReturn(50, "c"), Priority.CRITICAL, (id, v, e) -> completed.add(id));
        executor.start();

        assertEquals("l", executor.getResult("low", WAIT));
        assertEquals("c", executor.getResult("critical", WAIT));
        assertEquals("n", executor.getResult("normal", WAIT));

        waitFor(() -> completed.size() == 3);
        assertEquals(List.of("critical", "normal", "low"), completed);

        WorkerStats.Snapshot worker = executor.getWorkerStats().get(0);
        assertEquals(0, worker.workerId());
        assertEquals(3, worker.tasksProcessed());
        assertEquals(0, worker.errors());
        assertNotNull(worker.lastTaskTime());
        assertTrue(executor.getAverageExecutionTime().toMillis() >= 40);
    }

    @Test
    @DisplayName("Should record a timeout failure when a task exceeds its deadline")
    void shouldTimeOutLongTask() {
        create(1, 10, Duration.ofSeconds(5)).start();

        executor.submit("slow", sleepThenReturn(2000, "late"), Priority.HIGH, null, Duration.ofMillis(100));

        TaskFailedException e = assertThrows(TaskFailedException.class, () -> executor.getResult("slow", WAIT));
        assertEquals(FailureKind.TIMEOUT, e.getFailure().kind());
        assertInstanceOf(TaskTimeoutException.class, e.getCause());
        assertEquals(1, executor.getStats().failedCount());
    }

    @Test
    @DisplayName("Should keep the worker alive after a timeout")
    void shouldContinueAfterTimeout() throws Exception {
        create(1, 10, Duration.ofMillis(100)).start();

        executor.submit("slow", sleepThenReturn(2000, "late"), Priority.NORMAL);
        executor.submit("fast", () -> "ok", Priority.NORMAL);

        assertThrows(TaskFailedException.class, () -> executor.getResult("slow", WAIT));
        assertEquals("ok", executor.getResult("fast", WAIT));
        assertEquals(1, executor.getWorkerCount());
    }

    @Test
    @DisplayName("Should record an execution error and invoke the callback with it")
    void shouldRecordExecutionError() throws Exception {
        create(1, 10, Duration.ofSeconds(1)).start();
        AtomicReference<Throwable> callbackError = new AtomicReference<>();
        CountDownLatch called = new CountDownLatch(1);

        executor.submit("boom", () -> {
            throw new IllegalStateException("broken");
        }, Priority.NORMAL, (id, value, error) -> {
            callbackError.set(error);
            called.countDown();
        });

        TaskFailedException e = assertThrows(TaskFailedException.class, () -> executor.getResult("boom", WAIT));
        assertEquals(FailureKind.EXECUTION_ERROR, e.getFailure().kind());
        assertInstanceOf(IllegalStateException.class, e.getCause());

        assertTrue(called.await(2, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, callbackError.get());
        assertEquals(1, executor.getWorkerStats().get(0).errors());
    }

    @Test
    @DisplayName("Should invoke the callback with the value on success")
    void shouldInvokeCallbackOnSuccess() throws Exception {
        create(1, 10, Duration.ofSeconds(1)).start();
        AtomicReference<Integer> received = new AtomicReference<>();
        CountDownLatch called = new CountDownLatch(1);

        executor.submit("sum", () -> 40 + 2, Priority.HIGH, (id, value, error) -> {
            assertNull(error);
            received.set(value);
            called.countDown();
        });

        assertTrue(called.await(2, TimeUnit.SECONDS));
        assertEquals(42, received.get());
    }

    @Test
    @DisplayName("Should not let a throwing callback affect the recorded result")
    void shouldIsolateCallbackErrors() throws Exception {
        create(1, 10, Duration.ofSeconds(1)).start();

        executor.submit("cb", () -> "value", Priority.NORMAL, (id, value, error) -> {
            throw new RuntimeException("callback failure");
        });
        executor.submit("next", () -> "next", Priority.NORMAL);

        assertEquals("value", executor.getResult("cb", WAIT));
        assertEquals("next", executor.getResult("next", WAIT));
    }

    @Test
    @DisplayName("Should return the identical value on repeated reads")
    void shouldReturnSameValueOnRepeatedReads() throws Exception {
        create(1, 10, Duration.ofSeconds(1)).start();
        executor.submit("obj", Object::new, Priority.NORMAL);

        Object first = executor.getResult("obj", WAIT);
        Object second = executor.getResult("obj", WAIT);

        assertSame(first, second);
    }

    @Test
    @DisplayName("Should give up waiting independently of the task deadline")
    void shouldTimeOutWaitingForResult() throws Exception {
        create(1, 10, Duration.ofSeconds(5)).start();
        executor.submit("slow", sleepThenReturn(500, "eventually"), Priority.NORMAL);

        assertThrows(ResultWaitTimeoutException.class, () -> executor.getResult("slow", Duration.ofMillis(50)));
        assertEquals("eventually", executor.getResult("slow", WAIT));
    }

    @Test
    @DisplayName("Should fail on unknown task ids")
    void shouldFailOnUnknownId() {
        create(1, 10, Duration.ofSeconds(1));

        assertThrows(TaskNotFoundException.class, () -> executor.getResult("missing", WAIT));
        assertTrue(executor.status("missing").isEmpty());
    }

    @Test
    @DisplayName("Should complete the result future")
    void shouldCompleteResultFuture() throws Exception {
        create(1, 10, Duration.ofSeconds(1)).start();
        executor.submit("async", () -> "later", Priority.NORMAL);

        CompletableFuture<String> future = executor.resultFuture("async");

        assertEquals("later", future.get(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Should reject submissions after shutdown")
    void shouldRejectAfterShutdown() {
        create(1, 10, Duration.ofSeconds(1)).start();
        executor.shutdown();

        assertThrows(TaskRejectedException.class, () -> executor.submit("late", () -> 1, Priority.CRITICAL));
    }

    @Test
    @DisplayName("Graceful shutdown should finish queued tasks")
    void shouldDrainOnGracefulShutdown() throws Exception {
        create(1, 10, Duration.ofSeconds(1));
        for (int i = 0; i < 3; i++) {
            executor.submit("t" + i, sleepThenReturn(20, i), Priority.NORMAL);
        }
        executor.start();
        executor.shutdown();

        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
        assertTrue(executor.isTerminated());
        assertEquals(3, executor.getStats().completedCount());
        assertEquals(2, (int) executor.getResult("t2", WAIT));
    }

    @Test
    @DisplayName("shutdownNow should cancel queued tasks")
    void shutdownNowShouldCancelQueued() throws Exception {
        create(1, 10, Duration.ofSeconds(1));
        CountDownLatch cancelled = new CountDownLatch(2);
        executor.submit("q1", () -> 1, Priority.NORMAL, (id, v, e) -> cancelled.countDown());
        executor.submit("q2", () -> 2, Priority.LOW, (id, v, e) -> cancelled.countDown());

        executor.shutdownNow();

        assertTrue(cancelled.await(1, TimeUnit.SECONDS));
        TaskFailedException e = assertThrows(TaskFailedException.class, () -> executor.getResult("q1", WAIT));
        assertEquals(FailureKind.CANCELLED, e.getFailure().kind());
        assertEquals(TaskState.FAILED, executor.status("q2").orElseThrow());
        assertEquals(0, executor.getQueueSize());
    }

    @Test
    @DisplayName("shutdownNow should cancel a running task")
    void shutdownNowShouldCancelRunning() throws Exception {
        create(1, 10, Duration.ofSeconds(10)).start();
        CountDownLatch started = new CountDownLatch(1);
        executor.submit("running", () -> {
            started.countDown();
            Thread.sleep(5000);
            return "never";
        }, Priority.NORMAL);
        assertTrue(started.await(2, TimeUnit.SECONDS));

        executor.shutdownNow();

        TaskFailedException e = assertThrows(TaskFailedException.class, () -> executor.getResult("running", WAIT));
        assertEquals(FailureKind.CANCELLED, e.getFailure().kind());
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Should count submissions per priority")
    void shouldCountSubmissionsPerPriority() {
        create(1, 10, Duration.ofSeconds(1));
        executor.submit("c1", () -> 1, Priority.CRITICAL);
        executor.submit("c2", () -> 1, Priority.CRITICAL);
        executor.submit("l1", () -> 1, Priority.LOW);

        assertEquals(2L, executor.getSubmittedByPriority().get(Priority.CRITICAL));
        assertEquals(0L, executor.getSubmittedByPriority().get(Priority.HIGH));
        assertEquals(1L, executor.getSubmittedByPriority().get(Priority.LOW));
    }

    private static <T> Callable<T> sleepThenReturn(long millis, T value) {
        return () -> {
            Thread.sleep(millis);
            return value;
        };
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2000;
        while (!condition.getAsBoolean() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertTrue(condition.getAsBoolean());
    }
}
