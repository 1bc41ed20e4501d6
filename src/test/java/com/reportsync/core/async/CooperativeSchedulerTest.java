package com.reportsync.core.async;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CooperativeSchedulerTest {

    @Test
    void submitShouldRunTaskOnSchedulerThread() throws Exception {
        try (CooperativeScheduler scheduler = new CooperativeScheduler()) {
            String thread = scheduler.submit(() -> CompletableFuture.completedFuture(Thread.currentThread().getName()))
                    .get(5, TimeUnit.SECONDS);

            assertEquals(CooperativeScheduler.THREAD_NAME, thread);
        }
    }

    @Test
    void submitShouldSurfaceSynchronousFailure() {
        try (CooperativeScheduler scheduler = new CooperativeScheduler()) {
            ExecutionException e = assertThrows(ExecutionException.class, () -> scheduler.<Void>submit(() -> {
                throw new IllegalStateException("broken workflow");
            }).get(5, TimeUnit.SECONDS));

            assertEquals("broken workflow", e.getCause().getMessage());
        }
    }

    @Test
    void delaysShouldInterleaveOnOneThread() throws Exception {
        try (CooperativeScheduler scheduler = new CooperativeScheduler()) {
            StringBuffer order = new StringBuffer();
            CompletableFuture<Void> slow = scheduler.delay(Duration.ofMillis(60)).thenRun(() -> order.append("slow;"));
            CompletableFuture<Void> fast = scheduler.delay(Duration.ofMillis(10)).thenRun(() -> order.append("fast;"));

            CompletableFuture.allOf(slow, fast).get(5, TimeUnit.SECONDS);

            assertEquals("fast;slow;", order.toString());
        }
    }

    @Test
    void delayShouldFailAfterShutdown() {
        CooperativeScheduler scheduler = new CooperativeScheduler();
        scheduler.shutdown(1L);

        assertTrue(scheduler.isShutdown());
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> scheduler.delay(Duration.ofMillis(1)).get(5, TimeUnit.SECONDS));
        assertInstanceOf(RejectedExecutionException.class, e.getCause());
    }
}
