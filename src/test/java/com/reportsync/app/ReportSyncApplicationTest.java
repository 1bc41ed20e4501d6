package com.reportsync.app;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ReportSyncApplicationTest {

    @Test
    void helpShouldExitZero() {
        assertEquals(0, new ReportSyncApplication().run(new String[]{"--help"}));
    }

    @Test
    void unknownOptionShouldBeUsageError() {
        assertEquals(2, new ReportSyncApplication().run(new String[]{"--bogus"}));
    }

    @Test
    void conflictingModesShouldBeUsageError() {
        assertEquals(2, new ReportSyncApplication().run(new String[]{"--sync-only", "--session-only"}));
    }
}
