package com.reportsync.session;

public enum SessionState {
    NOT_STARTED,
    LOGGED_IN,
    TEMPLATE_SELECTED,
    DATE_FILTERED,
    CLOSED,
    FAILED
}
