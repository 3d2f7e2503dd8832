package com.flagship.mill_sync.sync;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation of a sync pass. Checked between records and
 * right after every remote call.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
