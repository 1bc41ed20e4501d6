package com.reportsync.sync.driver;

import java.nio.file.Path;

/**
 * Opaque reference to one resource opened inside an {@link ApplicationHandle}.
 * Invalid once its owner is torn down.
 */
public interface ResourceHandle {

    Path path();

    ApplicationHandle owner();
}
