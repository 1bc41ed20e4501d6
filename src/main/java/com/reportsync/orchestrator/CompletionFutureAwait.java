package com.reportsync.orchestrator;

import com.reportsync.core.async.Futures;
import com.reportsync.sync.ResourceSyncWorker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.ExecutionException;

/**
 * Blocks on the worker's completion future instead of polling.
 */
public final class CompletionFutureAwait implements WorkerAwaitStrategy {
    private static final Logger log = LogManager.getLogger(CompletionFutureAwait.class);

    @Override
    public void await(ResourceSyncWorker worker) throws InterruptedException {
        try {
            worker.completion().get();
        } catch (ExecutionException e) {
            log.debug("Resource sync completed exceptionally: {}", Futures.describe(e));
        }
    }
}
