package com.reportsync.session;

import java.util.Objects;

/**
 * Reference to an element located in the remote session.
 */
public final class ElementHandle {
    public final String id;
    public final String selector;

    public ElementHandle(String id, String selector) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.selector = selector == null ? "" : selector;
    }

    @Override
    public String toString() {
        return selector.isEmpty() ? id : selector + "#" + id;
    }
}
