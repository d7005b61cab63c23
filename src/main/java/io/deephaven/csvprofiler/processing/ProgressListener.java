package io.deephaven.csvprofiler.processing;

/**
 * Receives progress reports at chunk boundaries. Called on the driver thread; implementations should return quickly.
 */
@FunctionalInterface
public interface ProgressListener {
    /** A listener that ignores every report. */
    ProgressListener NONE = (stage, rowsProcessed, percentage, message) -> {
    };

    /**
     * @param stage The pipeline stage, e.g. "detecting", "profiling" or "complete".
     * @param rowsProcessed Data rows read so far.
     * @param percentage Estimated completion in [0, 100]; derived from bytes consumed when the source size is known.
     * @param message A human-readable status line.
     */
    void onProgress(String stage, long rowsProcessed, int percentage, String message);
}
