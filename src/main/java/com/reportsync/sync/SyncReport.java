package com.reportsync.sync;

import java.util.List;

public final class SyncReport {
    public final List<ResourceOutcome> outcomes;
    public final int applicationRecreations;
    public final int applicationTeardowns;
    public final boolean stopped;

    public SyncReport(List<ResourceOutcome> outcomes, int applicationRecreations, int applicationTeardowns, boolean stopped) {
        this.outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        this.applicationRecreations = Math.max(0, applicationRecreations);
        this.applicationTeardowns = Math.max(0, applicationTeardowns);
        this.stopped = stopped;
    }

    public static SyncReport empty() {
        return new SyncReport(List.of(), 0, 0, false);
    }

    public int count(ResourceOutcome.Status status) {
        int n = 0;
        for (ResourceOutcome outcome : outcomes) {
            if (outcome.status == status) {
                n++;
            }
        }
        return n;
    }

    public String summary() {
        return "synced=" + count(ResourceOutcome.Status.SYNCED)
                + ", skipped=" + count(ResourceOutcome.Status.SKIPPED_MISSING)
                + ", abandoned=" + count(ResourceOutcome.Status.ABANDONED)
                + ", not_started=" + count(ResourceOutcome.Status.NOT_STARTED)
                + ", app_recreations=" + applicationRecreations
                + ", stopped=" + stopped;
    }
}
