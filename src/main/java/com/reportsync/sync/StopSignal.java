package com.reportsync.sync;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Monotonic stop flag shared with the sync thread. Never cleared once set.
 */
public final class StopSignal {
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    /**
     * @return true only for the call that actually set the flag
     */
    public boolean set() {
        return stopped.compareAndSet(false, true);
    }

    public boolean isSet() {
        return stopped.get();
    }
}
