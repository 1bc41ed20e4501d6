package com.reportsync.app;

import com.reportsync.app.properties.BridgeProperties;
import com.reportsync.app.properties.OrchestratorProperties;
import com.reportsync.app.properties.SessionProperties;
import com.reportsync.app.properties.SyncProperties;
import com.reportsync.config.Config;
import com.reportsync.core.async.BlockingBridge;
import com.reportsync.core.async.CooperativeScheduler;
import com.reportsync.orchestrator.WorkerAwaitStrategy;
import com.reportsync.session.RemoteSessionDriverFactory;
import com.reportsync.session.SessionSettings;
import com.reportsync.session.webdriver.SeleniumSessionDriver;
import com.reportsync.sync.SyncSettings;
import com.reportsync.sync.driver.ApplicationDriver;
import com.reportsync.sync.poi.PoiWorkbookDriver;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@EnableConfigurationProperties({
        SyncProperties.class,
        SessionProperties.class,
        BridgeProperties.class,
        OrchestratorProperties.class
})
public class ReportSyncBootstrapConfig {

    @Bean
    public Config reportSyncConfig(
            SyncProperties syncProperties,
            SessionProperties sessionProperties,
            BridgeProperties bridgeProperties,
            OrchestratorProperties orchestratorProperties
    ) {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("sync", syncTree(syncProperties));
        raw.put("session", sessionTree(sessionProperties));
        raw.put("bridge", Map.of("pool_size", bridgeProperties.getPoolSize()));
        raw.put("orchestrator", Map.of(
                "poll_interval_ms", orchestratorProperties.getPollIntervalMs(),
                "await_strategy", firstNonBlank(orchestratorProperties.getAwaitStrategy(), "POLL")
        ));
        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        return Config.fromConfigurationProperties(workingDir, raw, System.getenv());
    }

    @Bean
    public SyncSettings syncSettings(Config config) {
        return SyncSettings.fromConfig(config);
    }

    @Bean
    public SessionSettings sessionSettings(Config config) {
        return SessionSettings.fromConfig(config);
    }

    @Bean
    public WorkerAwaitStrategy workerAwaitStrategy(Config config) {
        return WorkerAwaitStrategy.named(
                config.getString("orchestrator.await_strategy", "POLL"),
                config.getLong("orchestrator.poll_interval_ms", 1000L)
        );
    }

    @Bean(destroyMethod = "close")
    public CooperativeScheduler cooperativeScheduler() {
        return new CooperativeScheduler();
    }

    @Bean(destroyMethod = "close")
    public BlockingBridge blockingBridge(CooperativeScheduler scheduler, Config config) {
        return new BlockingBridge(scheduler, Math.max(1, config.getInt("bridge.pool_size", BlockingBridge.DEFAULT_POOL_SIZE)));
    }

    @Bean
    public ApplicationDriver applicationDriver() {
        return new PoiWorkbookDriver();
    }

    @Bean
    @Lazy
    public RemoteSessionDriverFactory remoteSessionDriverFactory(SessionSettings sessionSettings) {
        return SeleniumSessionDriver.factory(sessionSettings.webDriverUrl, sessionSettings.headless);
    }

    private Map<String, Object> syncTree(SyncProperties p) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("enabled", p.isEnabled());
        out.put("files", p.getFiles());
        out.put("max_retries", p.getMaxRetries());
        out.put("retry_delay_ms", p.getRetryDelayMs());
        out.put("refresh_interval_ms", p.getRefreshIntervalMs());
        return out;
    }

    private Map<String, Object> sessionTree(SessionProperties p) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("enabled", p.isEnabled());
        out.put("headless", p.isHeadless());
        if (p.getWebdriver() != null) {
            out.put("webdriver", Map.of("url", firstNonBlank(p.getWebdriver().getUrl(), "http://127.0.0.1:9515")));
        }
        if (p.getReporter() != null) {
            Map<String, Object> reporter = new LinkedHashMap<>();
            reporter.put("url", firstNonBlank(p.getReporter().getUrl()));
            reporter.put("id", firstNonBlank(p.getReporter().getId()));
            out.put("reporter", reporter);
        }
        if (p.getRetry() != null) {
            out.put("retry", Map.of(
                    "max_attempts", p.getRetry().getMaxAttempts(),
                    "delay_ms", p.getRetry().getDelayMs()
            ));
        }
        out.put("element_timeout_sec", p.getElementTimeoutSec());
        out.put("settle_ms", p.getSettleMs());
        out.put("step_settle_ms", p.getStepSettleMs());
        out.put("tab_settle_ms", p.getTabSettleMs());
        out.put("template", p.getTemplate());
        out.put("date_inputs", p.getDateInputs());
        out.put("tab_id", firstNonBlank(p.getTabId(), "2"));
        return out;
    }

    private String firstNonBlank(String... values) {
        if (values == null) {
            return "";
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return "";
    }
}
