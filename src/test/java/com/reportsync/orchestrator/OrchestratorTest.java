package com.reportsync.orchestrator;

import com.reportsync.core.RunTelemetry;
import com.reportsync.core.async.CooperativeScheduler;
import com.reportsync.session.SessionOutcome;
import com.reportsync.session.SessionState;
import com.reportsync.session.SessionWorkflow;
import com.reportsync.sync.FakeApplicationDriver;
import com.reportsync.sync.ResourceOutcome;
import com.reportsync.sync.ResourceSyncWorker;
import com.reportsync.sync.SyncReport;
import com.reportsync.sync.SyncSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OrchestratorTest {
    private static final List<Path> FILES = List.of(Path.of("data/a.xlsx"), Path.of("data/b.xlsx"));

    private CooperativeScheduler scheduler;
    private FakeApplicationDriver driver;
    private ResourceSyncWorker worker;

    @BeforeEach
    void setUp() {
        scheduler = new CooperativeScheduler();
        driver = new FakeApplicationDriver();
        worker = new ResourceSyncWorker(driver, path -> true, new SyncSettings(3, Duration.ZERO, Duration.ofMillis(20)));
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    void runAllShouldJoinBothDomainsWithPollingAwait() {
        AtomicReference<SyncReport> handedOver = new AtomicReference<>();
        RunTelemetry telemetry = new RunTelemetry("FULL", "test", null);
        Orchestrator orchestrator = new Orchestrator(worker, scheduler, new LivenessPollingAwait(10), handedOver::set, telemetry);

        OrchestrationReport report = orchestrator.runAll(FILES, delayedWorkflow(Duration.ofMillis(5)));

        assertTrue(report.ok(), report.summary());
        assertTrue(report.sessionOutcome.success);
        assertEquals(2, report.syncReport.count(ResourceOutcome.Status.SYNCED));
        assertSame(report.syncReport, handedOver.get());
        assertFalse(worker.isAlive());
        List<String> steps = telemetry.stepRecords().stream().map(RunTelemetry.StepRecord::name).collect(Collectors.toList());
        assertEquals(List.of(
                RunTelemetry.STEP_RESOURCE_SYNC,
                RunTelemetry.STEP_SESSION_WORKFLOW,
                RunTelemetry.STEP_WORKER_AWAIT,
                RunTelemetry.STEP_DOWNSTREAM
        ), steps);
    }

    @Test
    void runAllShouldWaitForSlowWorkerWithFutureAwait() throws Exception {
        driver.holdSave = new CountDownLatch(1);
        CountDownLatch hold = driver.holdSave;
        Thread releaser = new Thread(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            hold.countDown();
        });
        Orchestrator orchestrator = new Orchestrator(worker, scheduler, new CompletionFutureAwait(), DownstreamStage.NONE, null);
        releaser.start();

        OrchestrationReport report = orchestrator.runAll(FILES, delayedWorkflow(Duration.ZERO));

        assertEquals(2, report.syncReport.count(ResourceOutcome.Status.SYNCED));
        assertEquals(2, driver.saves.size());
        releaser.join();
    }

    @Test
    void failedSessionShouldNotAbortResourceSync() {
        Orchestrator orchestrator = new Orchestrator(worker, scheduler, new LivenessPollingAwait(10), DownstreamStage.NONE, null);
        SessionWorkflow broken = () -> CompletableFuture.failedFuture(new IllegalStateException("browser crashed"));

        OrchestrationReport report = orchestrator.runAll(FILES, broken);

        assertFalse(report.ok());
        assertFalse(report.sessionOutcome.success);
        assertEquals("browser crashed", report.sessionOutcome.error);
        assertEquals(2, report.syncReport.count(ResourceOutcome.Status.SYNCED));
    }

    @Test
    void downstreamFailureShouldBeReported() {
        DownstreamStage failing = r -> {
            throw new IllegalStateException("kpi stage unavailable");
        };
        Orchestrator orchestrator = new Orchestrator(worker, scheduler, new CompletionFutureAwait(), failing, null);

        OrchestrationReport report = orchestrator.runAll(FILES, null);

        assertFalse(report.sessionRan());
        assertEquals("kpi stage unavailable", report.downstreamError);
        assertEquals(2, report.syncReport.count(ResourceOutcome.Status.SYNCED));
    }

    @Test
    void stopShouldBeSafeToRepeat() {
        Orchestrator orchestrator = new Orchestrator(worker, scheduler, null, null, null);

        orchestrator.stop();
        orchestrator.stop();
        OrchestrationReport report = orchestrator.runAll(FILES, null);

        assertTrue(report.syncReport.stopped);
        assertTrue(driver.opens.isEmpty());
    }

    @Test
    void namedShouldResolveAwaitStrategies() {
        assertInstanceOf(CompletionFutureAwait.class, WorkerAwaitStrategy.named("future", 1000));
        LivenessPollingAwait poll = assertInstanceOf(LivenessPollingAwait.class, WorkerAwaitStrategy.named("", 250));
        assertEquals(250, poll.intervalMs());
        assertThrows(IllegalArgumentException.class, () -> WorkerAwaitStrategy.named("bogus", 1000));
    }

    private SessionWorkflow delayedWorkflow(Duration delay) {
        return () -> scheduler.delay(delay).thenApply(v -> SessionOutcome.completed(SessionState.DATE_FILTERED));
    }
}
