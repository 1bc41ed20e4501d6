package com.reportsync.core.async;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs blocking calls on a fixed pool and hands their results back to the {@link CooperativeScheduler}.
 * <p>
 * At most {@code poolSize} calls run at once. There is no timeout and no cancellation: a call that never
 * returns keeps its pool slot. Callers that need a bound race the returned future with
 * {@link #withTimeout(CompletableFuture, Duration)}.
 */
public final class BlockingBridge implements AutoCloseable {
    private static final Logger log = LogManager.getLogger(BlockingBridge.class);
    public static final int DEFAULT_POOL_SIZE = 5;

    private final CooperativeScheduler scheduler;
    private final ExecutorService pool;
    private final int poolSize;

    public BlockingBridge(CooperativeScheduler scheduler) {
        this(scheduler, DEFAULT_POOL_SIZE);
    }

    public BlockingBridge(CooperativeScheduler scheduler, int poolSize) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be positive");
        }
        this.poolSize = poolSize;
        AtomicInteger seq = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(poolSize, runnable -> {
            Thread t = new Thread(runnable, "reportsync-bridge-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.debug("BlockingBridge initialized with poolSize={}", poolSize);
    }

    public int poolSize() {
        return poolSize;
    }

    /**
     * Submits {@code call} to the pool. The returned future completes on the scheduler thread
     * with the call's value or the exception it threw.
     */
    public <T> CompletableFuture<T> runBlocking(Callable<T> call) {
        Objects.requireNonNull(call, "call cannot be null");
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            pool.execute(() -> {
                T value;
                try {
                    value = call.call();
                } catch (Throwable t) {
                    scheduler.dispatch(() -> result.completeExceptionally(t));
                    return;
                }
                scheduler.dispatch(() -> result.complete(value));
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    public CompletableFuture<Void> run(BlockingAction action) {
        Objects.requireNonNull(action, "action cannot be null");
        return runBlocking(() -> {
            action.run();
            return null;
        });
    }

    /**
     * Fails the returned future with {@link TimeoutException} if {@code future} has not completed after
     * {@code timeout}. The underlying blocking call is not interrupted.
     */
    public <T> CompletableFuture<T> withTimeout(CompletableFuture<T> future, Duration timeout) {
        CompletableFuture<T> raced = new CompletableFuture<>();
        future.whenComplete((value, error) -> {
            if (error != null) {
                raced.completeExceptionally(Futures.unwrap(error));
            } else {
                raced.complete(value);
            }
        });
        ScheduledFuture<?> timer = scheduler.schedule(timeout, () ->
                raced.completeExceptionally(new TimeoutException("blocking call did not finish within " + timeout)));
        if (timer == null) {
            log.debug("Scheduler is shut down, waiting for the call without a timeout.");
            return raced;
        }
        raced.whenComplete((value, error) -> timer.cancel(false));
        return raced;
    }

    public void shutdown(long timeoutSeconds) {
        ExecutorShutdown.shutdown("Blocking bridge pool", pool, timeoutSeconds);
    }

    @Override
    public void close() {
        shutdown(5L);
    }

    @FunctionalInterface
    public interface BlockingAction {
        void run() throws Exception;
    }
}
