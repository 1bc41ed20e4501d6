package com.reportsync.orchestrator;

import com.reportsync.session.SessionOutcome;
import com.reportsync.sync.SyncReport;

public final class OrchestrationReport {
    public final SyncReport syncReport;
    public final SessionOutcome sessionOutcome;
    public final String syncError;
    public final String downstreamError;

    public OrchestrationReport(SyncReport syncReport, SessionOutcome sessionOutcome, String syncError, String downstreamError) {
        this.syncReport = syncReport == null ? SyncReport.empty() : syncReport;
        this.sessionOutcome = sessionOutcome;
        this.syncError = syncError == null ? "" : syncError;
        this.downstreamError = downstreamError == null ? "" : downstreamError;
    }

    public boolean sessionRan() {
        return sessionOutcome != null;
    }

    public boolean ok() {
        return syncError.isEmpty()
                && downstreamError.isEmpty()
                && (sessionOutcome == null || sessionOutcome.success);
    }

    public String summary() {
        return "sync[" + syncReport.summary() + (syncError.isEmpty() ? "" : ", error=" + syncError) + "]"
                + " session[" + (sessionOutcome == null ? "skipped" : sessionOutcome.toString()) + "]"
                + (downstreamError.isEmpty() ? "" : " downstream_error=" + downstreamError);
    }
}
