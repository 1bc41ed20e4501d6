package com.reportsync.orchestrator;

import com.reportsync.sync.ResourceSyncWorker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Checks the sync thread's liveness on a fixed interval, logging on every poll.
 */
public final class LivenessPollingAwait implements WorkerAwaitStrategy {
    private static final Logger log = LogManager.getLogger(LivenessPollingAwait.class);
    public static final long DEFAULT_INTERVAL_MS = 1000L;

    private final long intervalMs;

    public LivenessPollingAwait(long intervalMs) {
        this.intervalMs = intervalMs <= 0L ? DEFAULT_INTERVAL_MS : intervalMs;
    }

    public long intervalMs() {
        return intervalMs;
    }

    @Override
    public void await(ResourceSyncWorker worker) throws InterruptedException {
        while (worker.isAlive()) {
            log.info("Waiting for resource sync to finish...");
            Thread.sleep(intervalMs);
        }
    }
}
