package com.reportsync.sync.driver;

import java.nio.file.Path;

/**
 * Blocking automation API of the external application. Every call may throw
 * {@link com.reportsync.core.DriverException}.
 */
public interface ApplicationDriver {

    /**
     * @param hidden start without any interactive surface (no window, no alerts)
     */
    ApplicationHandle construct(boolean hidden);

    ResourceHandle open(ApplicationHandle application, Path path);

    void refresh(ResourceHandle resource);

    void save(ResourceHandle resource);

    void close(ResourceHandle resource);

    void teardown(ApplicationHandle application);
}
