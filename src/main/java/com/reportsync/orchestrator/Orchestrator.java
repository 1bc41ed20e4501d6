package com.reportsync.orchestrator;

import com.reportsync.core.RunTelemetry;
import com.reportsync.core.async.CooperativeScheduler;
import com.reportsync.core.async.Futures;
import com.reportsync.session.SessionOutcome;
import com.reportsync.session.SessionState;
import com.reportsync.session.SessionWorkflow;
import com.reportsync.sync.ResourceOutcome;
import com.reportsync.sync.ResourceSyncWorker;
import com.reportsync.sync.SyncReport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Runs the resource sync thread and the session workflow side by side and joins both.
 * <p>
 * The session workflow is awaited first, then the worker through the configured {@link WorkerAwaitStrategy}.
 * The {@link DownstreamStage} is called last with the sync report. Neither domain's failure aborts the other.
 */
public final class Orchestrator {
    private static final Logger log = LogManager.getLogger(Orchestrator.class);

    private final ResourceSyncWorker worker;
    private final CooperativeScheduler scheduler;
    private final WorkerAwaitStrategy awaitStrategy;
    private final DownstreamStage downstream;
    private final RunTelemetry telemetry;

    public Orchestrator(
            ResourceSyncWorker worker,
            CooperativeScheduler scheduler,
            WorkerAwaitStrategy awaitStrategy,
            DownstreamStage downstream,
            RunTelemetry telemetry
    ) {
        this.worker = Objects.requireNonNull(worker, "worker cannot be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.awaitStrategy = awaitStrategy == null ? new LivenessPollingAwait(LivenessPollingAwait.DEFAULT_INTERVAL_MS) : awaitStrategy;
        this.downstream = downstream == null ? DownstreamStage.NONE : downstream;
        this.telemetry = telemetry == null ? new RunTelemetry("FULL", "manual", null) : telemetry;
    }

    /**
     * @param sessionWorkflow null skips the session side
     */
    public OrchestrationReport runAll(List<Path> resourcePaths, SessionWorkflow sessionWorkflow) {
        List<Path> paths = resourcePaths == null ? List.of() : resourcePaths;
        telemetry.startStep(RunTelemetry.STEP_RESOURCE_SYNC);
        worker.start(paths);

        SessionOutcome sessionOutcome = null;
        if (sessionWorkflow != null) {
            telemetry.startStep(RunTelemetry.STEP_SESSION_WORKFLOW);
            sessionOutcome = awaitSession(scheduler.submit(sessionWorkflow::run));
            telemetry.endStep(RunTelemetry.STEP_SESSION_WORKFLOW, 1, sessionOutcome.success ? 1 : 0,
                    sessionOutcome.success ? 0 : 1, sessionOutcome.toString());
        }

        telemetry.startStep(RunTelemetry.STEP_WORKER_AWAIT);
        try {
            awaitStrategy.await(worker);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for resource sync. Requesting stop.");
            worker.stopSignal().set();
        }
        telemetry.endStep(RunTelemetry.STEP_WORKER_AWAIT, 0, 0, 0);

        SyncReport syncReport = SyncReport.empty();
        String syncError = "";
        try {
            syncReport = worker.completion().getNow(null);
            if (syncReport == null) {
                syncError = "resource sync did not finish";
                syncReport = SyncReport.empty();
            }
        } catch (CompletionException e) {
            syncError = Futures.describe(e);
            log.error("Resource sync failed: {}", syncError);
        }
        int synced = syncReport.count(ResourceOutcome.Status.SYNCED);
        int abandoned = syncReport.count(ResourceOutcome.Status.ABANDONED);
        telemetry.setResourceStats(synced, abandoned);
        telemetry.endStep(RunTelemetry.STEP_RESOURCE_SYNC, paths.size(), synced,
                abandoned + (syncError.isEmpty() ? 0 : 1), syncReport.summary());

        String downstreamError = "";
        telemetry.startStep(RunTelemetry.STEP_DOWNSTREAM);
        try {
            downstream.accept(syncReport);
            telemetry.endStep(RunTelemetry.STEP_DOWNSTREAM, 1, 1, 0);
        } catch (Exception e) {
            downstreamError = Futures.describe(e);
            log.error("Downstream stage failed: {}", downstreamError, e);
            telemetry.endStep(RunTelemetry.STEP_DOWNSTREAM, 1, 0, 1, downstreamError);
        }

        OrchestrationReport report = new OrchestrationReport(syncReport, sessionOutcome, syncError, downstreamError);
        log.info("All tasks finished. {}", report.summary());
        return report;
    }

    /**
     * Requests the resource sync to stop between resources and waits for its thread. Idempotent.
     */
    public void stop() {
        worker.stop();
    }

    private SessionOutcome awaitSession(CompletableFuture<SessionOutcome> session) {
        try {
            SessionOutcome outcome = session.get();
            return outcome == null ? SessionOutcome.completed(null) : outcome;
        } catch (ExecutionException e) {
            String error = Futures.describe(e);
            log.error("Session workflow failed: {}", error, Futures.unwrap(e));
            return SessionOutcome.failed(SessionState.FAILED, "", error);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the session workflow.");
            return SessionOutcome.failed(SessionState.FAILED, "", "interrupted");
        }
    }
}
