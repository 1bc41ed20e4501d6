package com.reportsync.core.retry;

import java.util.concurrent.CompletableFuture;

/**
 * A fallible asynchronous operation. Implementations must be safe to invoke again with the same input.
 */
@FunctionalInterface
public interface AsyncOperation<I, O> {

    CompletableFuture<O> apply(I input);
}
