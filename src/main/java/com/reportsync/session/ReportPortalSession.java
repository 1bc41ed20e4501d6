package com.reportsync.session;

import com.reportsync.core.DriverException;
import com.reportsync.core.async.BlockingBridge;
import com.reportsync.core.async.CooperativeScheduler;
import com.reportsync.core.async.Futures;
import com.reportsync.core.retry.AsyncOperation;
import com.reportsync.core.retry.AsyncRetry;
import com.reportsync.core.retry.RetryPolicy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.openqa.selenium.Keys;

import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Remote report portal session driven from the {@link CooperativeScheduler}.
 * <p>
 * Every operation except {@link #close()} is retried on {@link DriverException} and moves the session to
 * {@link SessionState#FAILED} when it finally fails. Driver calls run on the {@link BlockingBridge}; settle
 * waits are scheduler delays. Operations must be called one at a time.
 */
public final class ReportPortalSession {
    private static final Logger log = LogManager.getLogger(ReportPortalSession.class);
    private static final DateTimeFormatter PORTAL_DATE = DateTimeFormatter.ofPattern("yyyy/MM/dd");

    private static final Set<SessionState> TAB_STATES = EnumSet.of(SessionState.TEMPLATE_SELECTED, SessionState.DATE_FILTERED);

    private final CooperativeScheduler scheduler;
    private final BlockingBridge bridge;
    private final RemoteSessionDriverFactory driverFactory;
    private final SessionSettings settings;
    private final AsyncRetry retry;
    private volatile SessionState state = SessionState.NOT_STARTED;
    private volatile RemoteSessionDriver driver;

    public ReportPortalSession(
            CooperativeScheduler scheduler,
            BlockingBridge bridge,
            RemoteSessionDriverFactory driverFactory,
            SessionSettings settings
    ) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.bridge = Objects.requireNonNull(bridge, "bridge cannot be null");
        this.driverFactory = Objects.requireNonNull(driverFactory, "driverFactory cannot be null");
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
        this.retry = new AsyncRetry(
                scheduler,
                new RetryPolicy(settings.retryMaxAttempts, settings.retryDelay),
                List.of(DriverException.class)
        );
    }

    public SessionState state() {
        return state;
    }

    public CompletableFuture<Void> open() {
        if (state == SessionState.NOT_STARTED && driver != null) {
            return CompletableFuture.failedFuture(new SessionStateException("open", state));
        }
        return step("open", EnumSet.of(SessionState.NOT_STARTED), null, () ->
                bridge.runBlocking(driverFactory::create).thenAccept(created -> driver = created));
    }

    public CompletableFuture<Void> login() {
        if (driver == null && state == SessionState.NOT_STARTED) {
            return CompletableFuture.failedFuture(new SessionStateException("login", state));
        }
        return step("login", EnumSet.of(SessionState.NOT_STARTED), SessionState.LOGGED_IN, () -> {
            if (settings.reporterUrl.isEmpty()) {
                return CompletableFuture.failedFuture(new IllegalStateException("reporter url is not configured"));
            }
            RemoteSessionDriver d = driver;
            return bridge.run(() -> {
                d.navigate(settings.reporterUrl);
                ElementHandle operator = d.locateElement("logon-operator-id", settings.elementTimeout);
                d.sendKeys(operator, settings.operatorId);
                d.click(d.locateElement("logon-btn", settings.elementTimeout));
            }).thenCompose(v -> settle(settings.stepSettle));
        });
    }

    public CompletableFuture<Void> callTemplate(TemplateSpec template) {
        Objects.requireNonNull(template, "template cannot be null");
        return step("callTemplate", EnumSet.of(SessionState.LOGGED_IN), SessionState.TEMPLATE_SELECTED, () -> {
            RemoteSessionDriver d = driver;
            return bridge.run(() -> {
                d.click(d.locateElement("template-title-span", settings.elementTimeout));
                d.selectOptionByText(d.locateElement("download-open-range-select", settings.elementTimeout), template.rangeLabel());
                d.selectOption(d.locateElement("template-download-select", settings.elementTimeout), template.templateValue());
                d.click(d.locateElement("template-creation-btn", settings.elementTimeout));
            }).thenCompose(v -> settle(settings.stepSettle));
        });
    }

    public CompletableFuture<Void> filterByDate(DateFilter filter) {
        Objects.requireNonNull(filter, "filter cannot be null");
        return step("filterByDate", TAB_STATES, SessionState.DATE_FILTERED, () -> {
            RemoteSessionDriver d = driver;
            String id = filter.inputId();
            return bridge.run(() -> {
                ElementHandle from = d.locateElement("panel-td-input-from-date-" + id, settings.elementTimeout);
                typeReplacing(d, from, PORTAL_DATE.format(filter.start()));
                ElementHandle to = d.locateElement("panel-td-input-to-date-" + id, settings.elementTimeout);
                typeReplacing(d, to, PORTAL_DATE.format(filter.end()));
                d.click(d.locateElement("panel-td-create-report-" + id, settings.elementTimeout));
            }).thenCompose(v -> settle(settings.stepSettle));
        });
    }

    /**
     * Switches the report tab. The session state does not change.
     */
    public CompletableFuture<Void> selectTab(String tabId) {
        String id = tabId == null || tabId.isBlank() ? settings.tabId : tabId.trim();
        return step("selectTab", TAB_STATES, null, () -> {
            RemoteSessionDriver d = driver;
            return bridge.run(() -> d.click(d.locateElement("normal-title" + id, settings.elementTimeout)))
                    .thenCompose(v -> settle(settings.tabSettle));
        });
    }

    /**
     * Disposes the remote session. Valid in any state and never fails; disposal errors are logged.
     */
    public CompletableFuture<Void> close() {
        if (state == SessionState.CLOSED) {
            return CompletableFuture.completedFuture(null);
        }
        state = SessionState.CLOSED;
        RemoteSessionDriver d = driver;
        driver = null;
        if (d == null) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> done = new CompletableFuture<>();
        bridge.run(d::dispose).whenComplete((v, error) -> {
            if (error != null) {
                log.warn("Error while closing browser session: {}", Futures.describe(error));
            } else {
                log.info("Browser session closed.");
            }
            done.complete(null);
        });
        return done;
    }

    public CompletableFuture<Void> settle(Duration duration) {
        return scheduler.delay(duration);
    }

    private CompletableFuture<Void> step(
            String name,
            Set<SessionState> allowed,
            SessionState next,
            Supplier<CompletableFuture<Void>> body
    ) {
        SessionState current = state;
        if (!allowed.contains(current)) {
            return CompletableFuture.failedFuture(new SessionStateException(name, current));
        }
        AsyncOperation<Void, Void> operation = retry.wrap(name, ignored -> body.get());
        CompletableFuture<Void> result = new CompletableFuture<>();
        operation.apply(null).whenComplete((v, error) -> {
            if (error != null) {
                Throwable cause = Futures.unwrap(error);
                if (state != SessionState.CLOSED) {
                    state = SessionState.FAILED;
                }
                log.error("Session operation {} failed: {}", name, Futures.describe(cause));
                result.completeExceptionally(cause);
                return;
            }
            if (next != null) {
                state = next;
            }
            log.info("Session operation {} done. state={}", name, state);
            result.complete(null);
        });
        return result;
    }

    private static void typeReplacing(RemoteSessionDriver d, ElementHandle field, String text) {
        d.sendKeys(field, Keys.chord(Keys.CONTROL, "a"));
        d.sendKeys(field, Keys.DELETE);
        d.sendKeys(field, text);
    }
}
