package com.reportsync.session;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SessionSettingsTest {

    @Test
    void builderShouldFillDefaultsForUnsetValues() {
        SessionSettings settings = SessionSettings.builder().build();

        assertEquals("", settings.reporterUrl);
        assertEquals(URI.create("http://127.0.0.1:9515"), settings.webDriverUrl);
        assertEquals(3, settings.retryMaxAttempts);
        assertEquals(Duration.ofSeconds(2), settings.retryDelay);
        assertEquals(Duration.ofSeconds(10), settings.elementTimeout);
        assertEquals(List.of("0", "1"), settings.dateInputs);
        assertEquals("2", settings.tabId);
    }

    @Test
    void builderShouldNormaliseOutOfRangeValues() {
        SessionSettings settings = SessionSettings.builder()
                .reporterUrl("  https://portal.example/report  ")
                .retryMaxAttempts(0)
                .retryDelay(Duration.ofMillis(-5))
                .tabId(" ")
                .build();

        assertEquals("https://portal.example/report", settings.reporterUrl);
        assertEquals(1, settings.retryMaxAttempts);
        assertEquals(Duration.ZERO, settings.retryDelay);
        assertEquals("2", settings.tabId);
    }

    @Test
    void toBuilderShouldKeepOtherValues() {
        SessionSettings base = ReportPortalSessionTest.settings("https://portal.example/report");

        SessionSettings changed = base.toBuilder().tabId("3").build();

        assertEquals("3", changed.tabId);
        assertEquals(base.reporterUrl, changed.reporterUrl);
        assertEquals(base.template, changed.template);
        assertEquals(base.retryDelay, changed.retryDelay);
    }
}
