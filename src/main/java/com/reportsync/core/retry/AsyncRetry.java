package com.reportsync.core.retry;

import com.reportsync.core.async.CooperativeScheduler;
import com.reportsync.core.async.Futures;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Wraps asynchronous operations with a {@link RetryPolicy}.
 * <p>
 * Retryable failures are logged and retried after the policy delay, which is a scheduler suspension.
 * Non-retryable failures pass through unchanged and do not consume an attempt. Once the policy gives up
 * on a retryable failure, the wrapped operation fails with a single {@link OperationExhaustedException}.
 */
public final class AsyncRetry {
    private static final Logger log = LogManager.getLogger(AsyncRetry.class);

    private final CooperativeScheduler scheduler;
    private final RetryPolicy policy;
    private final List<Class<? extends Throwable>> retryableKinds;

    public AsyncRetry(CooperativeScheduler scheduler, RetryPolicy policy, List<Class<? extends Throwable>> retryableKinds) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        this.retryableKinds = retryableKinds == null ? List.of() : List.copyOf(retryableKinds);
    }

    public RetryPolicy policy() {
        return policy;
    }

    /**
     * Same policy and scheduler, different set of retryable failure kinds.
     */
    public AsyncRetry retryingOn(List<Class<? extends Throwable>> kinds) {
        return new AsyncRetry(scheduler, policy, kinds);
    }

    public <I, O> AsyncOperation<I, O> wrap(String operationName, AsyncOperation<I, O> operation) {
        Objects.requireNonNull(operation, "operation cannot be null");
        String name = operationName == null || operationName.isBlank() ? "operation" : operationName.trim();
        return input -> {
            CompletableFuture<O> result = new CompletableFuture<>();
            attempt(name, operation, input, 1, result);
            return result;
        };
    }

    boolean isRetryable(Throwable error) {
        for (Class<? extends Throwable> kind : retryableKinds) {
            if (kind.isInstance(error)) {
                return true;
            }
        }
        return false;
    }

    private <I, O> void attempt(
            String name,
            AsyncOperation<I, O> operation,
            I input,
            int attempt,
            CompletableFuture<O> result
    ) {
        CompletableFuture<O> stage;
        try {
            stage = operation.apply(input);
        } catch (Throwable t) {
            stage = CompletableFuture.failedFuture(t);
        }
        if (stage == null) {
            stage = CompletableFuture.failedFuture(new IllegalStateException(name + " returned no future"));
        }
        stage.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }
            Throwable cause = Futures.unwrap(error);
            if (!isRetryable(cause)) {
                result.completeExceptionally(cause);
                return;
            }
            log.warn("Attempt {} failed for {}: {}", attempt, name, Futures.describe(cause));
            RetryPolicy.Decision decision = policy.decide(attempt, true);
            if (!decision.retry) {
                log.error("All {} attempts failed for {}", attempt, name);
                result.completeExceptionally(new OperationExhaustedException(name, attempt, cause));
                return;
            }
            scheduler.delay(decision.delay).whenComplete((ignored, delayError) -> {
                if (delayError != null) {
                    // Scheduler shut down mid-retry.
                    result.completeExceptionally(new OperationExhaustedException(name, attempt, cause));
                    return;
                }
                attempt(name, operation, input, attempt + 1, result);
            });
        });
    }
}
