package com.reportsync.orchestrator;

import com.reportsync.sync.SyncReport;

/**
 * Hand-over point after both the resource sync and the session workflow have finished.
 */
@FunctionalInterface
public interface DownstreamStage {

    DownstreamStage NONE = report -> {
    };

    void accept(SyncReport report) throws Exception;
}
