package io.deephaven.csvprofiler.util;

/**
 * The exception raised when a profiling run cannot produce a result. Row-level and resource-level problems never
 * surface this way; they are recorded as warnings on the result instead.
 */
public class CsvProfilerException extends Exception {
    /** Why the run failed. */
    public enum Reason {
        /** The source could not be opened or read (missing file, permission denied, I/O failure). */
        SOURCE_UNREADABLE,
        /** The source contained no content to profile. */
        EMPTY_INPUT,
        /** The caller cancelled the run. Partial state was discarded. */
        CANCELLED,
        /** An unexpected failure inside the engine. */
        INTERNAL
    }

    private final Reason reason;

    /**
     * Constructor.
     *
     * @param reason The failure category.
     * @param message The exception message.
     */
    public CsvProfilerException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    /**
     * Constructor.
     *
     * @param reason The failure category.
     * @param message The exception message.
     * @param cause The inner exception.
     */
    public CsvProfilerException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /**
     * @return The failure category.
     */
    public Reason reason() {
        return reason;
    }
}
