package com.reportsync.core.async;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BlockingBridgeTest {
    private CooperativeScheduler scheduler;
    private BlockingBridge bridge;

    @BeforeEach
    void setUp() {
        scheduler = new CooperativeScheduler();
        bridge = new BlockingBridge(scheduler, 2);
    }

    @AfterEach
    void tearDown() {
        bridge.close();
        scheduler.close();
    }

    @Test
    void runBlockingShouldCapConcurrencyAtPoolSize() throws Exception {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        List<CompletableFuture<Integer>> calls = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            int id = i;
            calls.add(bridge.runBlocking(() -> {
                int now = running.incrementAndGet();
                maxRunning.accumulateAndGet(now, Math::max);
                Thread.sleep(50);
                running.decrementAndGet();
                return id;
            }));
        }

        CompletableFuture.allOf(calls.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);

        assertTrue(maxRunning.get() <= 2, "max concurrency=" + maxRunning.get());
        for (int i = 0; i < 5; i++) {
            assertEquals(i, calls.get(i).getNow(-1));
        }
    }

    @Test
    void runBlockingShouldResumeOnSchedulerThread() throws Exception {
        AtomicBoolean onScheduler = new AtomicBoolean(false);

        bridge.runBlocking(() -> "done")
                .thenAccept(v -> onScheduler.set(scheduler.inSchedulerThread()))
                .get(5, TimeUnit.SECONDS);

        assertTrue(onScheduler.get());
    }

    @Test
    void runBlockingShouldSurfaceCallFailure() {
        IllegalStateException failure = new IllegalStateException("driver gone");

        ExecutionException e = assertThrows(ExecutionException.class, () -> bridge.run(() -> {
            throw failure;
        }).get(5, TimeUnit.SECONDS));

        assertSame(failure, e.getCause());
    }

    @Test
    void schedulerShouldStayResponsiveWhileBridgeCallsBlock() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<Void> blocked = bridge.run(release::await);

        scheduler.delay(Duration.ofMillis(10)).get(5, TimeUnit.SECONDS);
        release.countDown();
        blocked.get(5, TimeUnit.SECONDS);
    }

    @Test
    void withTimeoutShouldFailSlowCalls() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CompletableFuture<Void> slow = bridge.run(release::await);

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> bridge.withTimeout(slow, Duration.ofMillis(30)).get(5, TimeUnit.SECONDS));

        assertInstanceOf(TimeoutException.class, e.getCause());
        release.countDown();
        slow.get(5, TimeUnit.SECONDS);
    }

    @Test
    void withTimeoutShouldPassFastResultsThrough() throws Exception {
        String value = bridge.withTimeout(bridge.runBlocking(() -> "fast"), Duration.ofSeconds(5)).get(5, TimeUnit.SECONDS);

        assertEquals("fast", value);
    }

    @Test
    void withTimeoutShouldCancelTimerOnceCallFinishes() throws Exception {
        String value = bridge.withTimeout(bridge.runBlocking(() -> "fast"), Duration.ofHours(1)).get(5, TimeUnit.SECONDS);

        assertEquals("fast", value);
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (scheduler.queuedTasks() > 0 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(0, scheduler.queuedTasks());
    }

    @Test
    void withTimeoutShouldWaitForCallWhenSchedulerIsShutDown() throws Exception {
        CompletableFuture<String> pending = new CompletableFuture<>();
        scheduler.close();

        CompletableFuture<String> raced = bridge.withTimeout(pending, Duration.ofMillis(10));
        Thread.sleep(50);

        assertFalse(raced.isDone());
        pending.complete("late");
        assertEquals("late", raced.get(5, TimeUnit.SECONDS));
    }

    @Test
    void constructorShouldRejectNonPositivePool() {
        assertThrows(IllegalArgumentException.class, () -> new BlockingBridge(scheduler, 0));
    }
}
