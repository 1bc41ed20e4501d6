package com.reportsync.session;

/**
 * An operation was invoked in a session state that does not allow it. Never retried.
 */
public class SessionStateException extends IllegalStateException {
    private final SessionState state;

    public SessionStateException(String operation, SessionState state) {
        super(operation + " is not allowed in session state " + state);
        this.state = state;
    }

    public SessionState state() {
        return state;
    }
}
