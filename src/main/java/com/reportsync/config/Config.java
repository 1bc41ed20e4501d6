package com.reportsync.config;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.lang.reflect.Array;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Layered key/value configuration.
 * Lookup order: environment overrides, working-directory {@code config.properties},
 * classpath {@code config.properties}, built-in defaults.
 */
public final class Config {

    private static final Map<String, String> DEFAULTS = buildDefaults();
    private static final Map<String, String> ENV_OVERRIDES = Map.of(
            "session.reporter.url", "REPORTER_URL",
            "session.reporter.id", "REPORTER_ID"
    );

    private final Properties props = new Properties();
    private final Properties resourceProps = new Properties();
    private final Properties overrideProps = new Properties();
    private final Map<String, String> env;
    private final Path workingDir;

    private Config(Path workingDir, Map<String, String> env) {
        this.workingDir = workingDir;
        this.env = env == null ? Map.of() : env;
    }

    public static Config load(Path workingDir) {
        return load(workingDir, System.getenv());
    }

    public static Config load(Path workingDir, Map<String, String> env) {
        Config config = new Config(workingDir, env);

        try (InputStream in = Config.class.getClassLoader().getResourceAsStream("config.properties")) {
            if (in != null) {
                loadUtf8(config.resourceProps, in);
                config.props.putAll(config.resourceProps);
            }
        } catch (IOException ignored) {
            // Ignore broken classpath config and continue with defaults/local file.
        }

        Path local = workingDir.resolve("config.properties");
        if (Files.exists(local)) {
            try (InputStream in = Files.newInputStream(local)) {
                loadUtf8(config.overrideProps, in);
                config.props.putAll(config.overrideProps);
            } catch (IOException e) {
                System.err.println("WARN: failed to read config.properties: " + e.getMessage());
            }
        }

        return config;
    }

    /**
     * Build Config from Spring-bound configuration properties.
     */
    public static Config fromConfigurationProperties(Path workingDir, Map<String, ?> rawProperties) {
        return fromConfigurationProperties(workingDir, rawProperties, Map.of());
    }

    public static Config fromConfigurationProperties(Path workingDir, Map<String, ?> rawProperties, Map<String, String> env) {
        Config config = new Config(workingDir, env);
        flattenInto(config, "", rawProperties);
        return config;
    }

    public Path workingDir() {
        return workingDir;
    }

    public String getString(String key) {
        String fromEnv = envOverride(key);
        if (!fromEnv.isEmpty()) {
            return fromEnv;
        }
        String raw = props.getProperty(key);
        if (raw != null) {
            String trimmed = raw.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return DEFAULTS.getOrDefault(key, "");
    }

    public String getString(String key, String fallback) {
        String value = getString(key);
        if (value.isEmpty()) {
            return fallback;
        }
        return value;
    }

    public boolean getBoolean(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return false;
        }
        return "true".equalsIgnoreCase(value)
                || "1".equals(value)
                || "yes".equalsIgnoreCase(value)
                || "y".equalsIgnoreCase(value);
    }

    public boolean getBoolean(String key, boolean fallback) {
        if (getString(key).isEmpty()) {
            return fallback;
        }
        return getBoolean(key);
    }

    public int getInt(String key) {
        return getInt(key, parseInt(DEFAULTS.get(key), 0));
    }

    public int getInt(String key, int fallback) {
        String value = getString(key);
        return parseInt(value, fallback);
    }

    public long getLong(String key, long fallback) {
        String value = getString(key);
        try {
            return Long.parseLong(value);
        } catch (Exception ignored) {
            return fallback;
        }
    }

    /**
     * Reads a millisecond value. Negative values fall back.
     */
    public Duration getDurationMillis(String key, long fallbackMillis) {
        long ms = getLong(key, fallbackMillis);
        return Duration.ofMillis(ms < 0L ? Math.max(0L, fallbackMillis) : ms);
    }

    public Path getPath(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return workingDir;
        }
        return workingDir.resolve(value).normalize();
    }

    public List<String> getList(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        String[] tokens = value.split("[,;]");
        for (String token : tokens) {
            String trimmed = token.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    public List<Path> getPathList(String key) {
        List<Path> out = new ArrayList<>();
        for (String item : getList(key)) {
            out.add(workingDir.resolve(item).normalize());
        }
        return out;
    }

    public String requireString(String key) {
        String value = getString(key);
        if (value.isEmpty()) {
            throw new IllegalArgumentException("missing required config: " + key);
        }
        return value;
    }

    public Map<String, String> defaults() {
        return DEFAULTS;
    }

    public ResolvedValue resolve(String key) {
        return new ResolvedValue(
                key == null ? "" : key,
                getString(key),
                sourceOf(key)
        );
    }

    public String sourceOf(String key) {
        if (key == null || key.trim().isEmpty()) {
            return "default";
        }
        if (!envOverride(key).isEmpty()) {
            return "env";
        }
        String local = nonBlank(overrideProps.getProperty(key));
        if (!local.isEmpty()) {
            return "override";
        }
        String resource = nonBlank(resourceProps.getProperty(key));
        if (!resource.isEmpty()) {
            return "resource";
        }
        return "default";
    }

    private String envOverride(String key) {
        String envName = key == null ? null : ENV_OVERRIDES.get(key);
        if (envName == null) {
            return "";
        }
        return nonBlank(env.get(envName));
    }

    private String nonBlank(String raw) {
        if (raw == null) {
            return "";
        }
        String t = raw.trim();
        return t.isEmpty() ? "" : t;
    }

    private static void loadUtf8(Properties target, InputStream in) throws IOException {
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            target.load(reader);
        }
    }

    private static void flattenInto(Config config, String prefix, Object value) {
        if (config == null || value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                String key = entry.getKey() == null ? "" : entry.getKey().toString().trim();
                if (key.isEmpty()) {
                    continue;
                }
                String fullKey = prefix.isEmpty() ? key : prefix + "." + key;
                flattenInto(config, fullKey, entry.getValue());
            }
            return;
        }
        if (value instanceof List<?> list) {
            List<String> parts = new ArrayList<>();
            for (Object item : list) {
                parts.add(stringify(item));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        if (value.getClass().isArray()) {
            int len = Array.getLength(value);
            List<String> parts = new ArrayList<>(len);
            for (int i = 0; i < len; i++) {
                parts.add(stringify(Array.get(value, i)));
            }
            putBoundValue(config, prefix, String.join(",", parts));
            return;
        }
        putBoundValue(config, prefix, stringify(value));
    }

    private static void putBoundValue(Config config, String key, String value) {
        if (config == null || key == null || key.trim().isEmpty()) {
            return;
        }
        String normalizedKey = key.trim();
        String normalizedValue = value == null ? "" : value;
        config.overrideProps.setProperty(normalizedKey, normalizedValue);
        config.props.setProperty(normalizedKey, normalizedValue);
    }

    private static String stringify(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    private static int parseInt(String value, int fallback) {
        try {
            return Integer.parseInt(value.trim());
        } catch (Exception ignored) {
            return fallback;
        }
    }


    private static Map<String, String> buildDefaults() {
        Map<String, String> defaults = new HashMap<>();

        defaults.put("outputs.dir", "outputs");
        defaults.put("app.zone", "Asia/Tokyo");

        defaults.put("sync.enabled", "true");
        defaults.put("sync.files", "data/TS_todays_activity.xlsx,data/TS_todays_support.xlsx,data/TS_todays_close.xlsx");
        defaults.put("sync.max_retries", "5");
        defaults.put("sync.retry_delay_ms", "2000");
        defaults.put("sync.refresh_interval_ms", "5000");

        defaults.put("session.enabled", "true");
        defaults.put("session.headless", "false");
        defaults.put("session.webdriver.url", "http://127.0.0.1:9515");
        defaults.put("session.reporter.url", "");
        defaults.put("session.reporter.id", "");
        defaults.put("session.retry.max_attempts", "3");
        defaults.put("session.retry.delay_ms", "2000");
        defaults.put("session.element_timeout_sec", "10");
        defaults.put("session.settle_ms", "5000");
        defaults.put("session.step_settle_ms", "2000");
        defaults.put("session.tab_settle_ms", "1000");
        defaults.put("session.template", "パブリック,対応状況集計表用-TVS");
        defaults.put("session.date_inputs", "0,1");
        defaults.put("session.tab_id", "2");

        defaults.put("bridge.pool_size", "5");

        defaults.put("orchestrator.poll_interval_ms", "1000");
        defaults.put("orchestrator.await_strategy", "POLL");

        return Collections.unmodifiableMap(defaults);
    }

    public static final class ResolvedValue {
        public final String key;
        public final String value;
        public final String source;

        public ResolvedValue(String key, String value, String source) {
            this.key = key == null ? "" : key;
            this.value = value == null ? "" : value;
            this.source = source == null ? "default" : source;
        }
    }
}
