package com.reportsync.session;

import com.reportsync.core.async.Futures;
import com.reportsync.core.retry.OperationExhaustedException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Daily report download: open, login, call the template, then filter every configured date input to the
 * report date, switching to the report tab before each input after the first. The session is always closed.
 */
public final class ReportWorkflow implements SessionWorkflow {
    private static final Logger log = LogManager.getLogger(ReportWorkflow.class);

    private final ReportPortalSession session;
    private final SessionSettings settings;
    private final LocalDate reportDate;

    public ReportWorkflow(ReportPortalSession session, SessionSettings settings, LocalDate reportDate) {
        this.session = Objects.requireNonNull(session, "session cannot be null");
        this.settings = Objects.requireNonNull(settings, "settings cannot be null");
        this.reportDate = Objects.requireNonNull(reportDate, "reportDate cannot be null");
    }

    @Override
    public CompletableFuture<SessionOutcome> run() {
        log.info("Report workflow started. date={}", reportDate);
        CompletableFuture<Void> chain = session.open()
                .thenCompose(v -> session.login())
                .thenCompose(v -> session.callTemplate(settings.template));
        List<String> inputs = settings.dateInputs;
        for (int i = 0; i < inputs.size(); i++) {
            String inputId = inputs.get(i);
            boolean switchTab = i > 0;
            chain = chain
                    .thenCompose(v -> switchTab ? session.selectTab(settings.tabId) : CompletableFuture.completedFuture(null))
                    .thenCompose(v -> session.filterByDate(DateFilter.sameDay(reportDate, inputId)))
                    .thenCompose(v -> session.settle(settings.settle));
        }
        return chain
                .handle((v, error) -> outcomeOf(error))
                .thenCompose(outcome -> session.close().thenApply(v -> {
                    log.info("Report workflow finished. {}", outcome);
                    return outcome;
                }));
    }

    private SessionOutcome outcomeOf(Throwable error) {
        SessionState reached = session.state();
        if (error == null) {
            return SessionOutcome.completed(reached);
        }
        Throwable cause = Futures.unwrap(error);
        if (cause instanceof OperationExhaustedException exhausted) {
            log.error("Report workflow gave up: {}", exhausted.getMessage());
            return SessionOutcome.failed(reached, exhausted.operationName(), Futures.describe(exhausted.getCause()));
        }
        log.error("Report workflow failed: {}", Futures.describe(cause), cause);
        return SessionOutcome.failed(reached, "", Futures.describe(cause));
    }
}
