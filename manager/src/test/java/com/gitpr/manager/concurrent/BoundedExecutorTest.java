package com.gitpr.manager.concurrent;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BoundedExecutorTest {

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    @DisplayName("Never runs more than the configured number of tasks at once")
    void respectsConcurrencyCeiling() throws Exception {
        BoundedExecutor executor = new BoundedExecutor(3, "test");
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        AtomicInteger completed = new AtomicInteger();

        List<Task> tasks = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            tasks.add(() -> {
                int now = inFlight.incrementAndGet();
                maxInFlight.accumulateAndGet(now, Math::max);
                Thread.sleep(30);
                inFlight.decrementAndGet();
                completed.incrementAndGet();
            });
        }

        executor.execute(tasks);

        assertEquals(20, completed.get());
        assertTrue(maxInFlight.get() <= 3, "max in flight was " + maxInFlight.get());
        assertTrue(maxInFlight.get() > 1, "tasks should overlap");
    }

    @Test
    @DisplayName("A failing task does not affect its siblings")
    void failureIsolation() throws Exception {
        BoundedExecutor executor = new BoundedExecutor(2, "test");
        AtomicInteger completed = new AtomicInteger();

        executor.execute(List.<Task>of(
                completed::incrementAndGet,
                () -> {
                    throw new IllegalStateException("boom");
                },
                completed::incrementAndGet,
                completed::incrementAndGet));

        assertEquals(3, completed.get());
    }

    @Test
    @DisplayName("Non-positive concurrency falls back to the default")
    void defaultConcurrency() {
        assertEquals(BoundedExecutor.DEFAULT_CONCURRENCY, new BoundedExecutor(0, "test").getConcurrency());
        assertEquals(7, new BoundedExecutor(7, "test").getConcurrency());
    }

    @Test
    @DisplayName("An empty batch returns immediately")
    void emptyBatch() throws Exception {
        new BoundedExecutor(2, "test").execute(List.of());
    }

    // =========================================================================
    // Cancellation
    // =========================================================================

    @Test
    @DisplayName("A pre-interrupted caller runs no tasks")
    void preInterrupted() {
        BoundedExecutor executor = new BoundedExecutor(2, "test");
        AtomicInteger started = new AtomicInteger();

        Thread.currentThread().interrupt();

        assertThrows(InterruptedException.class,
                () -> executor.execute(List.<Task>of(started::incrementAndGet, started::incrementAndGet)));
        assertEquals(0, started.get());
    }

    @Test
    @DisplayName("Interrupting the caller stops running tasks and drops pending ones")
    void interruptCancelsBatch() throws Exception {
        BoundedExecutor executor = new BoundedExecutor(2, "test");
        AtomicInteger started = new AtomicInteger();
        AtomicInteger interrupted = new AtomicInteger();
        CountDownLatch running = new CountDownLatch(2);

        List<Task> tasks = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            tasks.add(() -> {
                started.incrementAndGet();
                running.countDown();
                try {
                    Thread.sleep(10_000);
                } catch (InterruptedException e) {
                    interrupted.incrementAndGet();
                    throw e;
                }
            });
        }

        Exception[] outcome = new Exception[1];
        Thread caller = new Thread(() -> {
            try {
                executor.execute(tasks);
            } catch (Exception e) {
                outcome[0] = e;
            }
        });
        caller.start();
        assertTrue(running.await(2, TimeUnit.SECONDS));
        caller.interrupt();
        caller.join(5_000);

        assertFalse(caller.isAlive());
        assertInstanceOf(InterruptedException.class, outcome[0]);
        assertEquals(2, started.get());
        assertEquals(2, interrupted.get());
    }
}
