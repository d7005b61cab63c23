package io.deephaven.csvprofiler.profile;

/**
 * Measurements of one profiling run.
 */
public final class PerformanceMetrics {
    private final long elapsedMillis;
    private final long peakMemoryBytes;
    private final long rowsRead;
    private final long bytesRead;
    private final int chunksProcessed;
    private final int finalChunkSize;
    private final boolean samplingMode;

    public PerformanceMetrics(long elapsedMillis, long peakMemoryBytes, long rowsRead, long bytesRead,
            int chunksProcessed, int finalChunkSize, boolean samplingMode) {
        this.elapsedMillis = elapsedMillis;
        this.peakMemoryBytes = peakMemoryBytes;
        this.rowsRead = rowsRead;
        this.bytesRead = bytesRead;
        this.chunksProcessed = chunksProcessed;
        this.finalChunkSize = finalChunkSize;
        this.samplingMode = samplingMode;
    }

    public long elapsedMillis() {
        return elapsedMillis;
    }

    /** The highest heap usage the memory monitor reported during the run. */
    public long peakMemoryBytes() {
        return peakMemoryBytes;
    }

    public long bytesRead() {
        return bytesRead;
    }

    public double rowsPerSecond() {
        return elapsedMillis == 0 ? rowsRead * 1000.0 : rowsRead * 1000.0 / elapsedMillis;
    }

    public int chunksProcessed() {
        return chunksProcessed;
    }

    public int finalChunkSize() {
        return finalChunkSize;
    }

    /** Whether the run fell back to sampling rows because memory stayed above the ceiling. */
    public boolean samplingMode() {
        return samplingMode;
    }
}
