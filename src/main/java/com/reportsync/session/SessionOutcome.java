package com.reportsync.session;

public final class SessionOutcome {
    public final boolean success;
    public final SessionState reachedState;
    public final String failedOperation;
    public final String error;

    private SessionOutcome(boolean success, SessionState reachedState, String failedOperation, String error) {
        this.success = success;
        this.reachedState = reachedState == null ? SessionState.CLOSED : reachedState;
        this.failedOperation = failedOperation == null ? "" : failedOperation;
        this.error = error == null ? "" : error;
    }

    public static SessionOutcome completed(SessionState reachedState) {
        return new SessionOutcome(true, reachedState, "", "");
    }

    public static SessionOutcome failed(SessionState reachedState, String failedOperation, String error) {
        return new SessionOutcome(false, reachedState, failedOperation, error);
    }

    @Override
    public String toString() {
        if (success) {
            return "success state=" + reachedState;
        }
        return "failed state=" + reachedState
                + (failedOperation.isEmpty() ? "" : " operation=" + failedOperation)
                + (error.isEmpty() ? "" : " error=" + error);
    }
}
