package com.reportsync.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigTest {

    @TempDir
    Path workingDir;

    @Test
    void loadShouldReadClasspathDefaultsAsUtf8() {
        Config config = Config.load(workingDir, Map.of());

        assertEquals(List.of("パブリック", "対応状況集計表用-TVS"), config.getList("session.template"));
        assertEquals(5, config.getInt("sync.max_retries"));
        assertEquals(Duration.ofSeconds(2), config.getDurationMillis("sync.retry_delay_ms", 0L));
        assertEquals("resource", config.sourceOf("sync.max_retries"));
    }

    @Test
    void workingDirectoryFileShouldOverrideClasspath() throws Exception {
        Files.writeString(workingDir.resolve("config.properties"),
                "sync.max_retries=2\nsync.files=a.xlsx;b.xlsx\nsession.headless=yes\n", StandardCharsets.UTF_8);

        Config config = Config.load(workingDir, Map.of());

        assertEquals(2, config.getInt("sync.max_retries"));
        assertEquals("override", config.sourceOf("sync.max_retries"));
        assertEquals(List.of(workingDir.resolve("a.xlsx"), workingDir.resolve("b.xlsx")), config.getPathList("sync.files"));
        assertTrue(config.getBoolean("session.headless"));
    }

    @Test
    void environmentShouldOverrideReporterSettings() {
        Config config = Config.load(workingDir, Map.of(
                "REPORTER_URL", "https://portal.example/login",
                "REPORTER_ID", " op-42 "
        ));

        assertEquals("https://portal.example/login", config.getString("session.reporter.url"));
        assertEquals("op-42", config.getString("session.reporter.id"));
        assertEquals("env", config.sourceOf("session.reporter.url"));
    }

    @Test
    void requireStringShouldRejectMissingValue() {
        Config config = Config.load(workingDir, Map.of());

        assertThrows(IllegalArgumentException.class, () -> config.requireString("session.reporter.url"));
    }

    @Test
    void negativeDurationShouldFallBack() throws Exception {
        Files.writeString(workingDir.resolve("config.properties"), "session.settle_ms=-5\n", StandardCharsets.UTF_8);

        Config config = Config.load(workingDir, Map.of());

        assertEquals(Duration.ofMillis(5000), config.getDurationMillis("session.settle_ms", 5000L));
    }

    @Test
    void fromConfigurationPropertiesShouldFlattenNestedMaps() {
        Config config = Config.fromConfigurationProperties(workingDir, Map.of(
                "session", Map.of("retry", Map.of("max_attempts", 4), "date_inputs", List.of("0", "1", "2")),
                "bridge", Map.of("pool_size", 3)
        ));

        assertEquals(4, config.getInt("session.retry.max_attempts"));
        assertEquals(List.of("0", "1", "2"), config.getList("session.date_inputs"));
        assertEquals(3, config.getInt("bridge.pool_size"));
        assertEquals(10, config.getInt("session.element_timeout_sec"));
    }
}
