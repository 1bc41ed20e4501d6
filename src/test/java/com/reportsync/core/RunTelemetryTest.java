package com.reportsync.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunTelemetryTest {

    @Test
    void summaryShouldContainRequiredFields() {
        RunTelemetry telemetry = new RunTelemetry("FULL", "manual", Instant.parse("2026-02-23T00:00:00Z"));
        telemetry.startStep(RunTelemetry.STEP_RESOURCE_SYNC);
        telemetry.endStep(RunTelemetry.STEP_RESOURCE_SYNC, 3, 2, 1, "synced=2, abandoned=1");
        telemetry.startStep(RunTelemetry.STEP_SESSION_WORKFLOW);
        telemetry.endStep(RunTelemetry.STEP_SESSION_WORKFLOW, 1, 1, 0);
        telemetry.setResourceStats(2, 1);
        telemetry.finish();

        String summary = telemetry.getSummary();

        assertTrue(summary.contains("run_mode=FULL"));
        assertTrue(summary.contains("trigger=manual"));
        assertTrue(summary.contains("total_elapsed_ms="));
        assertTrue(summary.contains("resources_synced=2"));
        assertTrue(summary.contains("errors_total=1"));
        assertTrue(summary.contains("steps:"));
        assertTrue(summary.contains(RunTelemetry.STEP_RESOURCE_SYNC + " elapsed_ms="));
        assertTrue(summary.contains("note=synced=2, abandoned=1"));
    }

    @Test
    void endStepShouldAccumulateRepeatedSteps() {
        RunTelemetry telemetry = new RunTelemetry(null, null, null);
        telemetry.startStep("downstream");
        telemetry.endStep("downstream", 1, 1, 0);
        telemetry.startStep("downstream");
        telemetry.endStep("downstream", 1, 0, 1);

        List<RunTelemetry.StepRecord> records = telemetry.stepRecords();

        assertEquals(1, records.size());
        assertEquals(RunTelemetry.STEP_DOWNSTREAM, records.get(0).name());
        assertEquals(2, records.get(0).itemsIn());
        assertEquals(1, records.get(0).errorCount());
        assertEquals("FULL", telemetry.runMode());
    }
}
