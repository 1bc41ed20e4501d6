package com.reportsync.core.async;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Single-threaded scheduler for the session workflow. Tasks on it must never block:
 * blocking work goes through {@link BlockingBridge}, waits go through {@link #delay(Duration)}.
 */
public final class CooperativeScheduler implements AutoCloseable {
    public static final String THREAD_NAME = "reportsync-session-scheduler";

    private final ScheduledThreadPoolExecutor executor;
    private volatile Thread schedulerThread;

    public CooperativeScheduler() {
        this.executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread t = new Thread(runnable, THREAD_NAME);
            t.setDaemon(true);
            schedulerThread = t;
            return t;
        });
        this.executor.setRemoveOnCancelPolicy(true);
    }

    public Executor executor() {
        return executor;
    }

    public boolean inSchedulerThread() {
        return Thread.currentThread() == schedulerThread;
    }

    /**
     * Starts {@code task} on the scheduler thread and returns its future.
     */
    public <T> CompletableFuture<T> submit(Supplier<CompletableFuture<T>> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                CompletableFuture<T> started;
                try {
                    started = task.get();
                } catch (Throwable t) {
                    result.completeExceptionally(t);
                    return;
                }
                if (started == null) {
                    result.complete(null);
                    return;
                }
                started.whenComplete((value, error) -> {
                    if (error != null) {
                        result.completeExceptionally(Futures.unwrap(error));
                    } else {
                        result.complete(value);
                    }
                });
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    /**
     * Suspends without holding the scheduler thread. Completes on the scheduler thread.
     */
    public CompletableFuture<Void> delay(Duration duration) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        try {
            executor.schedule(() -> done.complete(null), toMillis(duration), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            done.completeExceptionally(e);
        }
        return done;
    }

    /**
     * Runs {@code action} on the scheduler thread after {@code duration}. Cancelling the returned
     * future removes the timer from the queue. Returns null when the scheduler no longer accepts work.
     */
    ScheduledFuture<?> schedule(Duration duration, Runnable action) {
        try {
            return executor.schedule(action, toMillis(duration), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            return null;
        }
    }

    int queuedTasks() {
        return executor.getQueue().size();
    }

    /**
     * Runs {@code action} on the scheduler thread, or inline when the scheduler no longer accepts work.
     */
    void dispatch(Runnable action) {
        try {
            executor.execute(action);
        } catch (RejectedExecutionException e) {
            action.run();
        }
    }

    public boolean isShutdown() {
        return executor.isShutdown();
    }

    public void shutdown(long timeoutSeconds) {
        ExecutorShutdown.shutdown("Session scheduler", executor, timeoutSeconds);
    }

    @Override
    public void close() {
        shutdown(5L);
    }

    private static long toMillis(Duration duration) {
        return duration == null ? 0L : Math.max(0L, duration.toMillis());
    }
}
