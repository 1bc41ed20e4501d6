package com.reportsync.session;

@FunctionalInterface
public interface RemoteSessionDriverFactory {

    /**
     * Creates a new remote session. Blocking.
     */
    RemoteSessionDriver create();
}
