package com.reportsync.sync;

import java.nio.file.Path;

public final class ResourceOutcome {
    public enum Status {
        SYNCED,
        SKIPPED_MISSING,
        ABANDONED,
        NOT_STARTED
    }

    public final Path path;
    public final Status status;
    public final int attempts;
    public final String error;

    private ResourceOutcome(Path path, Status status, int attempts, String error) {
        this.path = path;
        this.status = status == null ? Status.NOT_STARTED : status;
        this.attempts = Math.max(0, attempts);
        this.error = error == null ? "" : error;
    }

    public static ResourceOutcome synced(Path path, int attempts) {
        return new ResourceOutcome(path, Status.SYNCED, attempts, "");
    }

    public static ResourceOutcome skippedMissing(Path path) {
        return new ResourceOutcome(path, Status.SKIPPED_MISSING, 0, "");
    }

    public static ResourceOutcome abandoned(Path path, int attempts, String error) {
        return new ResourceOutcome(path, Status.ABANDONED, attempts, error);
    }

    public static ResourceOutcome notStarted(Path path, String reason) {
        return new ResourceOutcome(path, Status.NOT_STARTED, 0, reason);
    }

    @Override
    public String toString() {
        return path + " " + status + " attempts=" + attempts + (error.isEmpty() ? "" : " error=" + error);
    }
}
