package com.reportsync.core.retry;

/**
 * Terminal failure of one logical operation after every configured attempt failed.
 * The cause is the failure of the last attempt.
 */
public class OperationExhaustedException extends RuntimeException {
    private final String operationName;
    private final int attempts;

    public OperationExhaustedException(String operationName, int attempts, Throwable lastCause) {
        super("Operation '" + operationName + "' failed after " + attempts + " attempts"
                + (lastCause == null || lastCause.getMessage() == null ? "" : ": " + lastCause.getMessage()), lastCause);
        this.operationName = operationName == null ? "" : operationName;
        this.attempts = attempts;
    }

    public String operationName() {
        return operationName;
    }

    public int attempts() {
        return attempts;
    }
}
