package com.reportsync.sync.poi;

import com.reportsync.core.DriverException;
import com.reportsync.sync.driver.ApplicationDriver;
import com.reportsync.sync.driver.ApplicationHandle;
import com.reportsync.sync.driver.ResourceHandle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.poi.ss.usermodel.FormulaEvaluator;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ApplicationDriver} over Apache POI workbooks.
 * <p>
 * The "application" is a registry of open workbooks. Refresh recalculates every formula cell and flags the
 * workbook for a full recalculation when a spreadsheet program next opens it. Save writes a sibling temp file
 * and moves it over the original.
 */
public final class PoiWorkbookDriver implements ApplicationDriver {
    private static final Logger log = LogManager.getLogger(PoiWorkbookDriver.class);
    private static final AtomicInteger SEQ = new AtomicInteger();

    @Override
    public ApplicationHandle construct(boolean hidden) {
        PoiApplication app = new PoiApplication("poi-" + SEQ.incrementAndGet(), hidden);
        log.debug("Workbook application {} created (hidden={})", app.id, hidden);
        return app;
    }

    @Override
    public ResourceHandle open(ApplicationHandle application, Path path) {
        PoiApplication app = requireLive(application);
        if (path == null) {
            throw new DriverException("workbook path is required");
        }
        Workbook workbook;
        try (InputStream in = Files.newInputStream(path)) {
            workbook = WorkbookFactory.create(in);
        } catch (IOException | RuntimeException e) {
            throw new DriverException("failed to open workbook " + path + ": " + e.getMessage(), e);
        }
        PoiWorkbook resource = new PoiWorkbook(app, path, workbook);
        app.open.add(resource);
        return resource;
    }

    @Override
    public void refresh(ResourceHandle resource) {
        PoiWorkbook book = requireOpen(resource);
        try {
            FormulaEvaluator evaluator = book.workbook.getCreationHelper().createFormulaEvaluator();
            evaluator.clearAllCachedResultValues();
            evaluator.evaluateAll();
            book.workbook.setForceFormulaRecalculation(true);
        } catch (RuntimeException e) {
            throw new DriverException("refresh failed for " + book.path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void save(ResourceHandle resource) {
        PoiWorkbook book = requireOpen(resource);
        Path target = book.path.toAbsolutePath();
        Path dir = target.getParent();
        Path tmp = null;
        try {
            tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
            try (OutputStream out = Files.newOutputStream(tmp)) {
                book.workbook.write(out);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            tmp = null;
        } catch (IOException | RuntimeException e) {
            throw new DriverException("save failed for " + book.path + ": " + e.getMessage(), e);
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.warn("Could not remove temp file {}: {}", tmp, e.getMessage());
                }
            }
        }
    }

    @Override
    public void close(ResourceHandle resource) {
        PoiWorkbook book = cast(resource);
        if (book.closed) {
            return;
        }
        book.owner.open.remove(book);
        closeWorkbook(book);
    }

    @Override
    public void teardown(ApplicationHandle application) {
        if (!(application instanceof PoiApplication app)) {
            throw new DriverException("not a workbook application: " + application);
        }
        if (!app.alive) {
            return;
        }
        app.alive = false;
        List<PoiWorkbook> leftovers = new ArrayList<>(app.open);
        app.open.clear();
        for (PoiWorkbook book : leftovers) {
            closeWorkbook(book);
        }
        log.debug("Workbook application {} torn down, closed {} workbooks", app.id, leftovers.size());
    }

    private void closeWorkbook(PoiWorkbook book) {
        book.closed = true;
        try {
            book.workbook.close();
        } catch (IOException e) {
            throw new DriverException("close failed for " + book.path + ": " + e.getMessage(), e);
        }
    }

    private static PoiApplication requireLive(ApplicationHandle application) {
        if (!(application instanceof PoiApplication app)) {
            throw new DriverException("not a workbook application: " + application);
        }
        if (!app.alive) {
            throw new DriverException("workbook application " + app.id + " has been torn down");
        }
        return app;
    }

    private static PoiWorkbook requireOpen(ResourceHandle resource) {
        PoiWorkbook book = cast(resource);
        if (book.closed || !book.owner.alive) {
            throw new DriverException("workbook " + book.path + " is no longer open");
        }
        return book;
    }

    private static PoiWorkbook cast(ResourceHandle resource) {
        if (!(resource instanceof PoiWorkbook book)) {
            throw new DriverException("not a workbook handle: " + resource);
        }
        return book;
    }

    static final class PoiApplication implements ApplicationHandle {
        private final String id;
        private final boolean hidden;
        private final Set<PoiWorkbook> open = ConcurrentHashMap.newKeySet();
        private volatile boolean alive = true;

        private PoiApplication(String id, boolean hidden) {
            this.id = id;
            this.hidden = hidden;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }

        int openCount() {
            return open.size();
        }

        @Override
        public String toString() {
            return "PoiApplication{" + id + ", hidden=" + hidden + ", alive=" + alive + "}";
        }
    }

    static final class PoiWorkbook implements ResourceHandle {
        private final PoiApplication owner;
        private final Path path;
        private final Workbook workbook;
        private volatile boolean closed;

        private PoiWorkbook(PoiApplication owner, Path path, Workbook workbook) {
            this.owner = owner;
            this.path = path;
            this.workbook = workbook;
        }

        @Override
        public Path path() {
            return path;
        }

        @Override
        public ApplicationHandle owner() {
            return owner;
        }

        boolean isClosed() {
            return closed;
        }
    }
}
