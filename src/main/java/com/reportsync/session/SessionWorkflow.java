package com.reportsync.session;

import java.util.concurrent.CompletableFuture;

/**
 * A task for the cooperative scheduler. {@link #run()} is called on the scheduler thread and must not block.
 */
@FunctionalInterface
public interface SessionWorkflow {

    CompletableFuture<SessionOutcome> run();
}
