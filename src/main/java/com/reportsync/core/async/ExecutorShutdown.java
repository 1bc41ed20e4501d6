package com.reportsync.core.async;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

final class ExecutorShutdown {
    private static final Logger log = LogManager.getLogger(ExecutorShutdown.class);

    private ExecutorShutdown() {
    }

    static void shutdown(String name, ExecutorService executor, long timeoutSeconds) {
        if (executor.isTerminated()) {
            return;
        }
        log.debug("Shutting down {}...", name);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                int dropped = executor.shutdownNow().size();
                log.warn("{} did not terminate in {} seconds. {} tasks were dropped.", name, timeoutSeconds, dropped);
            } else {
                log.debug("{} terminated gracefully.", name);
            }
        } catch (InterruptedException ie) {
            log.warn("{} shutdown interrupted. Forcing shutdown now.", name);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
