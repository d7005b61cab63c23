package io.deephaven.csvprofiler;

import io.deephaven.csvprofiler.detection.DetectionResult;
import io.deephaven.csvprofiler.detection.DialectDetector;
import io.deephaven.csvprofiler.detection.DialectProfile;
import io.deephaven.csvprofiler.processing.CancellationToken;
import io.deephaven.csvprofiler.processing.ChunkedDriver;
import io.deephaven.csvprofiler.processing.ProgressListener;
import io.deephaven.csvprofiler.profile.DatasetProfile;
import io.deephaven.csvprofiler.reading.ByteSource;
import io.deephaven.csvprofiler.util.CsvProfilerException;
import io.deephaven.csvprofiler.util.CsvProfilerException.Reason;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A class for profiling delimited text. The input is read twice: a bounded prefix to detect the dialect, then the
 * whole input in one streaming pass that updates every column's statistics. Memory use is bounded by the settings in
 * {@link CsvProfilerSpecs}, not by the size of the input.
 */
public final class CsvProfiler {
    /**
     * Profile the file at {@code path} with default progress and no cancellation.
     *
     * @param specs A {@link CsvProfilerSpecs} object providing options for the run.
     * @param path The file to profile.
     * @return The profile.
     * @throws CsvProfilerException If the file cannot be read or contains no records.
     */
    public static DatasetProfile profile(final CsvProfilerSpecs specs, final Path path) throws CsvProfilerException {
        return profile(specs, ByteSource.ofPath(path), ProgressListener.NONE, new CancellationToken());
    }

    /**
     * Profile the file at {@code path}.
     *
     * @param specs A {@link CsvProfilerSpecs} object providing options for the run.
     * @param path The file to profile.
     * @param progress Receives a report after detection and after every chunk.
     * @param cancellation Polled between chunks.
     * @return The profile.
     * @throws CsvProfilerException If the file cannot be read, contains no records, or the run is cancelled.
     */
    public static DatasetProfile profile(final CsvProfilerSpecs specs, final Path path,
            final ProgressListener progress, final CancellationToken cancellation) throws CsvProfilerException {
        return profile(specs, ByteSource.ofPath(path), progress, cancellation);
    }

    /**
     * Profile {@code source}: detect its dialect (honoring the overrides in {@code specs}) and run the streaming pass.
     *
     * @param specs A {@link CsvProfilerSpecs} object providing options for the run.
     * @param source The input. It is opened twice.
     * @param progress Receives a report after detection and after every chunk.
     * @param cancellation Polled after detection and between chunks.
     * @return The profile.
     * @throws CsvProfilerException If the source cannot be read, contains no records, or the run is cancelled.
     */
    public static DatasetProfile profile(final CsvProfilerSpecs specs, final ByteSource source,
            final ProgressListener progress, final CancellationToken cancellation) throws CsvProfilerException {
        final long startNanos = System.nanoTime();
        final DialectProfile dialect = detect(specs, source).profile();
        progress.onProgress("detecting", 0, 0, "Detected " + dialect);
        if (cancellation.isCancelled()) {
            throw new CsvProfilerException(Reason.CANCELLED, "Profiling cancelled after detection");
        }
        return new ChunkedDriver(specs, progress, cancellation).run(source, dialect, startNanos);
    }

    /**
     * Detect the dialect of {@code source} without profiling it.
     *
     * @param specs A {@link CsvProfilerSpecs} object providing the detection limits and overrides.
     * @param source The input.
     * @return The chosen dialect and the ranked candidates behind it.
     * @throws CsvProfilerException If the source cannot be read.
     */
    public static DetectionResult detect(final CsvProfilerSpecs specs, final ByteSource source)
            throws CsvProfilerException {
        try {
            return new DialectDetector(specs).detect(source);
        } catch (IOException e) {
            throw new CsvProfilerException(Reason.SOURCE_UNREADABLE,
                    "Could not read " + source.description() + ": " + e.getMessage(), e);
        }
    }

    private CsvProfiler() {}
}
