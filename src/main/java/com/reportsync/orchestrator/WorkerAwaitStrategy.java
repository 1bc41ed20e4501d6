package com.reportsync.orchestrator;

import com.reportsync.sync.ResourceSyncWorker;

import java.util.Locale;

/**
 * How the orchestrator waits for the resource sync thread after the session workflow has finished.
 * Returns once the worker has finished; its result is read from {@link ResourceSyncWorker#completion()}.
 */
@FunctionalInterface
public interface WorkerAwaitStrategy {

    void await(ResourceSyncWorker worker) throws InterruptedException;

    static WorkerAwaitStrategy named(String name, long pollIntervalMs) {
        String key = name == null ? "" : name.trim().toUpperCase(Locale.ROOT);
        if ("FUTURE".equals(key)) {
            return new CompletionFutureAwait();
        }
        if (key.isEmpty() || "POLL".equals(key)) {
            return new LivenessPollingAwait(pollIntervalMs);
        }
        throw new IllegalArgumentException("unknown await strategy: " + name);
    }
}
