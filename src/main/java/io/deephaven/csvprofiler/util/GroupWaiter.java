package io.deephaven.csvprofiler.util;

import io.deephaven.csvprofiler.util.CsvProfilerException.Reason;

import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;

/**
 * This simple class submits tasks to an {@link Executor} and allows the caller to wait until (1) all of them complete,
 * (2) any of them throws, whichever happens first. With a direct executor every task has already run by the time
 * {@link #waitAll} is called.
 */
public class GroupWaiter {
    /**
     * The {@link Executor} that runs the {@link Callable}s.
     */
    private final Executor executor;
    /**
     * The number of {@link Callable}s that have been submitted via {@link GroupWaiter#submit}.
     */
    private int numSubmissions = 0;
    /**
     * The number of {@link Callable}s that have succeeded.
     */
    private int numSuccesses = 0;
    /**
     * Not null if any {@link Callable}s has thrown. Contains the first thrown {@link Throwable}.
     */
    private Throwable error;

    /**
     * Constructor.
     *
     * @param executor the {@link Executor} that runs the {@link Callable}s.
     */
    public GroupWaiter(final Executor executor) {
        this.executor = executor;
    }

    /**
     * Submits a {@link Callable} to the {@link Executor}, wrapping it in code which keeps track of whether it
     * ultimately succeeds or throws.
     */
    public <T> void submit(Callable<T> callable) {
        synchronized (this) {
            ++numSubmissions;
        }
        final Callable<T> wrapped = () -> {
            try {
                final T result = callable.call();
                noteSuccess();
                return result;
            } catch (Throwable t) {
                // Want to catch all Errors here and specifically OutOfMemoryError
                noteFailure(t);
                throw new CsvProfilerException(Reason.INTERNAL, "Caught exception", t);
            }
        };
        executor.execute(new FutureTask<>(wrapped));
    }

    /**
     * Waits until (1) all submitted {@link Callable}s complete, or (2) any of them throws. In the latter case, this
     * method rethrows the {@link Throwable} wrapped in a {@link CsvProfilerException}.
     */
    public synchronized void waitAll() throws CsvProfilerException, InterruptedException {
        while (true) {
            if (error != null) {
                throw new CsvProfilerException(Reason.INTERNAL, "Column task failed: " + error, error);
            }
            if (numSuccesses == numSubmissions) {
                return;
            }
            wait();
        }
    }

    private synchronized void noteSuccess() {
        ++numSuccesses;
        if (numSuccesses == numSubmissions) {
            notifyAll();
        }
    }

    private synchronized void noteFailure(Throwable throwable) {
        if (error != null) {
            return;
        }
        error = throwable;
        notifyAll();
    }
}
