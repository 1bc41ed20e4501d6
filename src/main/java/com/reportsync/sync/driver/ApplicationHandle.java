package com.reportsync.sync.driver;

/**
 * Opaque reference to one running instance of the external application.
 */
public interface ApplicationHandle {

    String id();

    boolean isAlive();
}
