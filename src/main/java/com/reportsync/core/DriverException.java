package com.reportsync.core;

/**
 * Opaque failure raised by a blocking driver call (external application or remote session).
 * Retryable by default.
 */
public class DriverException extends RuntimeException {

    public DriverException(String message) {
        super(message);
    }

    public DriverException(String message, Throwable cause) {
        super(message, cause);
    }
}
