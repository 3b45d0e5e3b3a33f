package com.gitpr.manager.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a batch of independent tasks with at most {@code concurrency} of them in
 * flight. Each worker picks up the next pending task as soon as it finishes one;
 * there are no batch barriers.
 *
 * <p>The executor is payload-agnostic: it only reports whether scheduling
 * succeeded. Task failures are logged and swallowed into the task's own result
 * handling. Completion order is unspecified.</p>
 *
 * <p>Cancellation is interruption of the calling thread: tasks not yet started are
 * dropped, running tasks are interrupted and expected to return promptly, and
 * {@link #execute} throws {@link InterruptedException} once they have.</p>
 */
public class BoundedExecutor {

    public static final int DEFAULT_CONCURRENCY = 5;

    private static final long DRAIN_TIMEOUT_SECONDS = 30;

    private final int concurrency;
    private final String name;
    private final Logger logger;

    public BoundedExecutor(int concurrency, String name) {
        this(concurrency, name, LoggerFactory.getLogger(BoundedExecutor.class));
    }

    public BoundedExecutor(int concurrency, String name, Logger logger) {
        this.concurrency = concurrency > 0 ? concurrency : DEFAULT_CONCURRENCY;
        this.name = name;
        this.logger = logger;
    }

    public int getConcurrency() {
        return concurrency;
    }

    /**
     * Runs all tasks and waits for them to finish.
     *
     * @throws InterruptedException if the calling thread was interrupted before or
     *                              while the batch ran
     */
    public void execute(List<? extends Task> tasks) throws InterruptedException {
        if (tasks.isEmpty()) {
            return;
        }
        if (Thread.interrupted()) {
            throw new InterruptedException(name + ": cancelled before any task ran");
        }

        int workers = Math.min(concurrency, tasks.size());
        ExecutorService pool = Executors.newFixedThreadPool(workers, threadFactory());
        List<Future<?>> futures = new ArrayList<>(tasks.size());
        try {
            for (int i = 0; i < tasks.size(); i++) {
                futures.add(pool.submit(wrap(i, tasks.get(i))));
            }
            logger.debug("{}: dispatched {} tasks on {} workers", name, tasks.size(), workers);

            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    // wrap() already contains task failures; anything here is an executor fault
                    logger.error("{}: task terminated abnormally", name, e.getCause());
                }
            }
        } catch (InterruptedException e) {
            List<Runnable> dropped = pool.shutdownNow();
            logger.warn("{}: cancelled, {} pending tasks not started", name, dropped.size());
            if (!pool.awaitTermination(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("{}: running tasks did not stop within {}s", name, DRAIN_TIMEOUT_SECONDS);
            }
            throw e;
        } finally {
            pool.shutdown();
        }
    }

    private Runnable wrap(int index, Task task) {
        return () -> {
            logger.debug("{}: starting task {}", name, index);
            try {
                task.run();
                logger.debug("{}: task {} completed", name, index);
            } catch (InterruptedException e) {
                logger.debug("{}: task {} interrupted", name, index);
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                logger.error("{}: task {} failed", name, index, e);
            }
        };
    }

    private ThreadFactory threadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
