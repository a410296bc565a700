package org.dxworks.docmark.batch;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared flag that stops a batch from starting further items. Items already
 * running are interrupted only when the batch aborts on an error.
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
