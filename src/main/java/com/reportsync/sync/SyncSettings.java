package com.reportsync.sync;

import com.reportsync.config.Config;

import java.time.Duration;

public final class SyncSettings {
    public static final int DEFAULT_MAX_RETRIES = 5;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(2);
    public static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofSeconds(5);

    public final int maxRetries;
    public final Duration retryDelay;
    public final Duration refreshInterval;

    public SyncSettings(int maxRetries, Duration retryDelay, Duration refreshInterval) {
        this.maxRetries = Math.max(1, maxRetries);
        this.retryDelay = nonNegative(retryDelay, DEFAULT_RETRY_DELAY);
        this.refreshInterval = nonNegative(refreshInterval, DEFAULT_REFRESH_INTERVAL);
    }

    public static SyncSettings defaults() {
        return new SyncSettings(DEFAULT_MAX_RETRIES, DEFAULT_RETRY_DELAY, DEFAULT_REFRESH_INTERVAL);
    }

    public static SyncSettings fromConfig(Config config) {
        return new SyncSettings(
                config.getInt("sync.max_retries", DEFAULT_MAX_RETRIES),
                config.getDurationMillis("sync.retry_delay_ms", DEFAULT_RETRY_DELAY.toMillis()),
                config.getDurationMillis("sync.refresh_interval_ms", DEFAULT_REFRESH_INTERVAL.toMillis())
        );
    }

    private static Duration nonNegative(Duration value, Duration fallback) {
        if (value == null || value.isNegative()) {
            return fallback;
        }
        return value;
    }

    @Override
    public String toString() {
        return "max_retries=" + maxRetries + ", retry_delay=" + retryDelay + ", refresh_interval=" + refreshInterval;
    }
}
