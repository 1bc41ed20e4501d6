package com.reportsync.sync;

import com.reportsync.sync.driver.ApplicationDriver;
import com.reportsync.sync.driver.ApplicationHandle;
import com.reportsync.sync.driver.ResourceHandle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * Refreshes a list of resources on a dedicated thread through one external application instance.
 * <p>
 * Each resource gets up to {@code maxRetries} open/refresh/save/close attempts on the current application.
 * When a resource exhausts its attempts it is abandoned, and the application is torn down and constructed
 * again before the next resource. At most one application is live at any time; it never leaves this thread.
 * The {@link StopSignal} is checked between resources only.
 */
public final class ResourceSyncWorker {
    private static final Logger log = LogManager.getLogger(ResourceSyncWorker.class);
    public static final String THREAD_NAME = "reportsync-resource-sync";

    private final ApplicationDriver driver;
    private final Predicate<Path> exists;
    private final SyncSettings settings;
    private final StopSignal stopSignal = new StopSignal();
    private final CompletableFuture<SyncReport> completion = new CompletableFuture<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopJoined = new AtomicBoolean(false);
    private volatile Thread thread;

    public ResourceSyncWorker(ApplicationDriver driver, SyncSettings settings) {
        this(driver, Files::exists, settings);
    }

    public ResourceSyncWorker(ApplicationDriver driver, Predicate<Path> exists, SyncSettings settings) {
        this.driver = Objects.requireNonNull(driver, "driver cannot be null");
        this.exists = Objects.requireNonNull(exists, "exists cannot be null");
        this.settings = settings == null ? SyncSettings.defaults() : settings;
    }

    /**
     * Starts one run on a background thread. A worker runs at most once.
     */
    public void start(List<Path> resourcePaths) {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("resource sync worker already started");
        }
        List<Path> paths = resourcePaths == null ? List.of() : List.copyOf(resourcePaths);
        Thread t = new Thread(() -> {
            try {
                completion.complete(run(paths));
            } catch (Throwable e) {
                log.error("Resource sync thread failed unexpectedly: {}", e.getMessage(), e);
                completion.completeExceptionally(e);
            }
        }, THREAD_NAME);
        t.setDaemon(true);
        thread = t;
        t.start();
        log.info("Resource sync thread started. resources={}", paths.size());
    }

    public boolean isAlive() {
        Thread t = thread;
        return t != null && t.isAlive();
    }

    public CompletableFuture<SyncReport> completion() {
        return completion;
    }

    public StopSignal stopSignal() {
        return stopSignal;
    }

    public void join() throws InterruptedException {
        Thread t = thread;
        if (t != null) {
            t.join();
        }
    }

    /**
     * Requests a stop and waits for the sync thread to finish its current resource. Safe to call repeatedly
     * and from several threads; every caller returns only after the thread has ended.
     */
    public void stop() {
        stopSignal.set();
        Thread t = thread;
        if (t == null || t == Thread.currentThread() || !t.isAlive()) {
            return;
        }
        boolean first = stopJoined.compareAndSet(false, true);
        try {
            t.join();
            if (first) {
                log.info("Resource sync thread stopped.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the resource sync thread to stop.");
        }
    }

    public SyncReport run(List<Path> resourcePaths) {
        return run(resourcePaths, settings.maxRetries, settings.retryDelay);
    }

    public SyncReport run(List<Path> resourcePaths, int maxRetries, Duration retryDelay) {
        List<Path> paths = resourcePaths == null ? List.of() : resourcePaths;
        int attemptsPerResource = Math.max(1, maxRetries);
        Duration delay = retryDelay == null || retryDelay.isNegative() ? Duration.ZERO : retryDelay;
        List<ResourceOutcome> outcomes = new ArrayList<>();
        if (paths.isEmpty()) {
            log.info("No resources to sync.");
            return SyncReport.empty();
        }

        int recreations = 0;
        int teardowns = 0;
        boolean stopped = false;
        ApplicationHandle application = constructApplication();
        try {
            for (int i = 0; i < paths.size(); i++) {
                Path path = paths.get(i);
                if (application == null) {
                    markRemaining(outcomes, paths, i, "application unavailable");
                    break;
                }
                if (stopSignal.isSet()) {
                    log.info("Resource sync stop requested. {} resources left unprocessed.", paths.size() - i);
                    markRemaining(outcomes, paths, i, "stop requested");
                    stopped = true;
                    break;
                }
                if (!exists.test(path)) {
                    log.warn("Resource does not exist, skipping: {}", path);
                    outcomes.add(ResourceOutcome.skippedMissing(path));
                    continue;
                }

                log.info("Sync started: {}", path);
                ResourceOutcome outcome = syncWithRetries(application, path, attemptsPerResource, delay);
                outcomes.add(outcome);
                if (Thread.currentThread().isInterrupted()) {
                    markRemaining(outcomes, paths, i + 1, "interrupted");
                    stopped = true;
                    break;
                }
                if (outcome.status == ResourceOutcome.Status.ABANDONED) {
                    log.error("Sync of {} failed {} times. Restarting the application.", path, outcome.attempts);
                    teardownQuietly(application);
                    teardowns++;
                    application = constructApplication();
                    if (application != null) {
                        recreations++;
                    }
                }
            }
        } finally {
            if (application != null) {
                teardownQuietly(application);
                teardowns++;
            }
        }
        SyncReport report = new SyncReport(outcomes, recreations, teardowns, stopped);
        log.info("Resource sync finished. {}", report.summary());
        return report;
    }

    private ResourceOutcome syncWithRetries(ApplicationHandle application, Path path, int maxRetries, Duration retryDelay) {
        int attempts = 0;
        String lastError = "";
        while (attempts < maxRetries) {
            ResourceHandle resource = null;
            try {
                log.debug("Opening {}", path);
                resource = driver.open(application, path);
                log.debug("Refreshing {}", path);
                driver.refresh(resource);
                if (!sleepInterruptibly(settings.refreshInterval)) {
                    closeQuietly(resource);
                    return ResourceOutcome.abandoned(path, attempts + 1, "interrupted");
                }
                log.debug("Saving {}", path);
                driver.save(resource);
                driver.close(resource);
                log.debug("Closed {}", path);
                resource = null;
                log.info("Sync completed: {}", path);
                return ResourceOutcome.synced(path, attempts + 1);
            } catch (RuntimeException e) {
                attempts++;
                lastError = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                log.error("Error while syncing {} (attempt {}): {}", path, attempts, lastError);
                closeQuietly(resource);
                if (attempts >= maxRetries) {
                    break;
                }
                log.info("Retrying sync of {}", path);
                if (!sleepInterruptibly(retryDelay)) {
                    return ResourceOutcome.abandoned(path, attempts, "interrupted");
                }
            }
        }
        return ResourceOutcome.abandoned(path, attempts, lastError);
    }

    private ApplicationHandle constructApplication() {
        try {
            log.info("Starting external application (hidden).");
            return driver.construct(true);
        } catch (RuntimeException e) {
            log.error("Failed to start external application: {}", e.getMessage(), e);
            return null;
        }
    }

    private void teardownQuietly(ApplicationHandle application) {
        try {
            driver.teardown(application);
            log.info("External application shut down.");
        } catch (RuntimeException e) {
            log.warn("Error while shutting down external application: {}", e.getMessage());
        }
    }

    private void closeQuietly(ResourceHandle resource) {
        if (resource == null) {
            return;
        }
        try {
            driver.close(resource);
        } catch (RuntimeException e) {
            log.warn("Failed to close {} after error: {}", resource.path(), e.getMessage());
        }
    }

    private static void markRemaining(List<ResourceOutcome> outcomes, List<Path> paths, int from, String reason) {
        for (int j = from; j < paths.size(); j++) {
            outcomes.add(ResourceOutcome.notStarted(paths.get(j), reason));
        }
    }

    private static boolean sleepInterruptibly(Duration duration) {
        long ms = duration == null ? 0L : duration.toMillis();
        if (ms <= 0L) {
            return !Thread.currentThread().isInterrupted();
        }
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
