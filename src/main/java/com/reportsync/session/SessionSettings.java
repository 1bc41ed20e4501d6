package com.reportsync.session;

import com.reportsync.config.Config;
import lombok.Builder;
import lombok.Value;

import java.net.URI;
import java.time.Duration;
import java.util.List;

@Value
public class SessionSettings {
    private static final String DEFAULT_WEBDRIVER_URL = "http://127.0.0.1:9515";

    public final String reporterUrl;
    public final String operatorId;
    public final URI webDriverUrl;
    public final boolean headless;
    public final int retryMaxAttempts;
    public final Duration retryDelay;
    public final Duration elementTimeout;
    public final Duration settle;
    public final Duration stepSettle;
    public final Duration tabSettle;
    public final TemplateSpec template;
    public final List<String> dateInputs;
    public final String tabId;

    @Builder(toBuilder = true)
    private SessionSettings(String reporterUrl,
                            String operatorId,
                            URI webDriverUrl,
                            boolean headless,
                            Integer retryMaxAttempts,
                            Duration retryDelay,
                            Duration elementTimeout,
                            Duration settle,
                            Duration stepSettle,
                            Duration tabSettle,
                            TemplateSpec template,
                            List<String> dateInputs,
                            String tabId) {
        this.reporterUrl = reporterUrl == null ? "" : reporterUrl.trim();
        this.operatorId = operatorId == null ? "" : operatorId.trim();
        this.webDriverUrl = webDriverUrl == null ? URI.create(DEFAULT_WEBDRIVER_URL) : webDriverUrl;
        this.headless = headless;
        this.retryMaxAttempts = retryMaxAttempts == null ? 3 : Math.max(1, retryMaxAttempts);
        this.retryDelay = orDefault(retryDelay, Duration.ofSeconds(2));
        this.elementTimeout = orDefault(elementTimeout, Duration.ofSeconds(10));
        this.settle = orDefault(settle, Duration.ofSeconds(5));
        this.stepSettle = orDefault(stepSettle, Duration.ofSeconds(2));
        this.tabSettle = orDefault(tabSettle, Duration.ofSeconds(1));
        this.template = template == null ? new TemplateSpec("", "") : template;
        this.dateInputs = dateInputs == null || dateInputs.isEmpty() ? List.of("0", "1") : List.copyOf(dateInputs);
        this.tabId = tabId == null || tabId.isBlank() ? "2" : tabId.trim();
    }

    public static SessionSettings fromConfig(Config config) {
        return builder()
                .reporterUrl(config.getString("session.reporter.url"))
                .operatorId(config.getString("session.reporter.id"))
                .webDriverUrl(URI.create(config.getString("session.webdriver.url", DEFAULT_WEBDRIVER_URL)))
                .headless(config.getBoolean("session.headless", false))
                .retryMaxAttempts(config.getInt("session.retry.max_attempts", 3))
                .retryDelay(config.getDurationMillis("session.retry.delay_ms", 2000L))
                .elementTimeout(Duration.ofSeconds(Math.max(0, config.getInt("session.element_timeout_sec", 10))))
                .settle(config.getDurationMillis("session.settle_ms", 5000L))
                .stepSettle(config.getDurationMillis("session.step_settle_ms", 2000L))
                .tabSettle(config.getDurationMillis("session.tab_settle_ms", 1000L))
                .template(TemplateSpec.parse(config.getList("session.template")))
                .dateInputs(config.getList("session.date_inputs"))
                .tabId(config.getString("session.tab_id", "2"))
                .build();
    }

    private static Duration orDefault(Duration value, Duration fallback) {
        if (value == null) {
            return fallback;
        }
        return value.isNegative() ? Duration.ZERO : value;
    }
}
