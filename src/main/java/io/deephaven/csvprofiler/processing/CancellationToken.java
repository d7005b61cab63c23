package io.deephaven.csvprofiler.processing;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A flag another thread can raise to stop a run. The driver polls it between chunks.
 */
public final class CancellationToken {
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
