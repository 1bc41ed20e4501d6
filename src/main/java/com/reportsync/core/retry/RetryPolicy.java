package com.reportsync.core.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Fixed-delay retry decision. The delay does not grow with the attempt number.
 */
public final class RetryPolicy {
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_DELAY = Duration.ofSeconds(2);

    private final int maxAttempts;
    private final Duration baseDelay;

    public RetryPolicy(int maxAttempts, Duration baseDelay) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        Objects.requireNonNull(baseDelay, "baseDelay cannot be null");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_DELAY);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public Duration baseDelay() {
        return baseDelay;
    }

    /**
     * @param attempt number of attempts already made, including the one that just failed (1-based)
     */
    public Decision decide(int attempt, boolean failureIsRetryable) {
        return decide(attempt, maxAttempts, baseDelay, failureIsRetryable);
    }

    public static Decision decide(int attempt, int maxAttempts, Duration baseDelay, boolean failureIsRetryable) {
        if (!failureIsRetryable) {
            return Decision.fail(Decision.REASON_NON_RETRYABLE);
        }
        if (attempt >= maxAttempts) {
            return Decision.fail(Decision.REASON_EXHAUSTED);
        }
        return Decision.retryAfter(baseDelay == null ? Duration.ZERO : baseDelay);
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts + ", baseDelay=" + baseDelay + "}";
    }

    public static final class Decision {
        public static final String REASON_RETRY = "RETRY";
        public static final String REASON_EXHAUSTED = "EXHAUSTED";
        public static final String REASON_NON_RETRYABLE = "NON_RETRYABLE";

        public final boolean retry;
        public final Duration delay;
        public final String reason;

        private Decision(boolean retry, Duration delay, String reason) {
            this.retry = retry;
            this.delay = delay == null ? Duration.ZERO : delay;
            this.reason = reason == null ? "" : reason;
        }

        public static Decision retryAfter(Duration delay) {
            return new Decision(true, delay, REASON_RETRY);
        }

        public static Decision fail(String reason) {
            return new Decision(false, Duration.ZERO, reason);
        }

        @Override
        public String toString() {
            return retry ? "Retry(" + delay + ")" : "Fail(" + reason + ")";
        }
    }
}
