package com.reportsync.core;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Captures one run's step timings, item counts and errors. Safe to update from both the sync thread and the
 * session scheduler.
 */
public final class RunTelemetry {
    public static final String STEP_RESOURCE_SYNC = "RESOURCE_SYNC";
    public static final String STEP_SESSION_WORKFLOW = "SESSION_WORKFLOW";
    public static final String STEP_WORKER_AWAIT = "WORKER_AWAIT";
    public static final String STEP_DOWNSTREAM = "DOWNSTREAM";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String runMode;
    private final String trigger;
    private final Instant startedAt;
    private Instant finishedAt;
    private int resourcesSynced;
    private int resourcesAbandoned;
    private int errorsTotal;

    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Deque<Long>> stepStartsNanos = new HashMap<>();

    public RunTelemetry(String runMode, String trigger, Instant startedAt) {
        this.runMode = blankTo(runMode, "FULL");
        this.trigger = blankTo(trigger, "manual");
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
    }

    public synchronized String runMode() {
        return runMode;
    }

    public synchronized Instant startedAt() {
        return startedAt;
    }

    public synchronized Instant finishedAt() {
        return finishedAt;
    }

    public synchronized void startStep(String name) {
        String key = sanitizeStepName(name);
        steps.putIfAbsent(key, new StepStat(key));
        stepStartsNanos.computeIfAbsent(key, ignored -> new ArrayDeque<>()).push(System.nanoTime());
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount) {
        endStep(name, itemsIn, itemsOut, errorCount, "");
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount, String note) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        Deque<Long> stack = stepStartsNanos.get(key);
        long startedNanos = stack == null || stack.isEmpty() ? 0L : stack.pop();
        if (startedNanos > 0L) {
            stat.elapsedMs += Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
        }
        stat.itemsIn += Math.max(0L, itemsIn);
        stat.itemsOut += Math.max(0L, itemsOut);
        stat.errorCount += Math.max(0L, errorCount);
        appendNote(stat, note);
        if (errorCount > 0L) {
            errorsTotal += (int) errorCount;
        }
    }

    public synchronized void setResourceStats(int synced, int abandoned) {
        this.resourcesSynced = Math.max(0, synced);
        this.resourcesAbandoned = Math.max(0, abandoned);
    }

    public synchronized int errorsTotal() {
        return errorsTotal;
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(stat.name, stat.elapsedMs, stat.itemsIn, stat.itemsOut, stat.errorCount, stat.note));
        }
        return out;
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("run_mode=").append(runMode).append('\n');
        sb.append("trigger=").append(trigger).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis())).append('\n');
        sb.append("resources_synced=").append(resourcesSynced).append('\n');
        sb.append("resources_abandoned=").append(resourcesAbandoned).append('\n');
        sb.append("errors_total=").append(errorsTotal).append('\n');
        sb.append("steps:\n");
        for (StepStat stat : steps.values()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s elapsed_ms=%d in=%d out=%d err=%d",
                    stat.name,
                    stat.elapsedMs,
                    stat.itemsIn,
                    stat.itemsOut,
                    stat.errorCount
            ));
            if (!stat.note.isBlank()) {
                sb.append(" note=").append(stat.note);
            }
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    private static void appendNote(StepStat stat, String note) {
        String text = note == null ? "" : note.trim();
        if (text.isEmpty()) {
            return;
        }
        if (stat.note.isEmpty()) {
            stat.note = text;
        } else if (!stat.note.contains(text)) {
            stat.note = stat.note + "; " + text;
        }
    }

    private static String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private static String blankTo(String value, String fallback) {
        String text = value == null ? "" : value.trim();
        return text.isEmpty() ? fallback : text;
    }

    private static final class StepStat {
        private final String name;
        private long elapsedMs;
        private long itemsIn;
        private long itemsOut;
        private long errorCount;
        private String note = "";

        private StepStat(String name) {
            this.name = name;
        }
    }

    public record StepRecord(String name, long elapsedMs, long itemsIn, long itemsOut, long errorCount, String note) {
    }
}
