package io.deephaven.csvprofiler.processing;

/**
 * The mutable state of one run's execution loop: the adaptive chunk size, memory samples, progress counters and the
 * sampling-mode flag. Lives for one run.
 */
public final class StreamingSession {
    public static final double SHRINK_FACTOR = 0.6;
    public static final double GROW_FACTOR = 1.1;
    /** Below this fraction of the memory threshold the chunk size grows. */
    public static final double GROW_BELOW_FRACTION = 0.3;

    private static final long BYTES_PER_MB = 1024L * 1024L;

    /** What {@link #afterChunk} did. */
    public enum Adjustment {
        NONE, SHRUNK, GREW, ENTERED_SAMPLING
    }

    private final int minChunkSize;
    private final int maxChunkSize;
    private final long thresholdBytes;
    private final long ceilingBytes;
    private final CancellationToken cancellation;

    private int chunkSize;
    private long peakMemoryBytes;
    private int memorySamples;
    private int chunksProcessed;
    private long rowsRead;
    private long rowsAnalysed;
    private boolean samplingMode;

    public StreamingSession(final int initialChunkSize, final int minChunkSize, final int maxChunkSize,
            final long memoryThresholdMb, final long memoryCeilingMb, final CancellationToken cancellation) {
        this.chunkSize = initialChunkSize;
        this.minChunkSize = minChunkSize;
        this.maxChunkSize = maxChunkSize;
        this.thresholdBytes = memoryThresholdMb * BYTES_PER_MB;
        this.ceilingBytes = memoryCeilingMb * BYTES_PER_MB;
        this.cancellation = cancellation;
    }

    /**
     * Account for a processed chunk and adapt the chunk size to the memory reading taken after it. Above the threshold
     * the chunk shrinks by {@value #SHRINK_FACTOR} down to the minimum; once at the minimum, a reading above the
     * ceiling switches the run to sampling mode. Below {@value #GROW_BELOW_FRACTION} of the threshold the chunk grows
     * by {@value #GROW_FACTOR} up to the maximum.
     *
     * @param rowsInChunk Rows fed to the accumulators in this chunk.
     * @param usedBytes The heap usage measured after the chunk.
     * @return The adjustment made.
     */
    public Adjustment afterChunk(final int rowsInChunk, final long usedBytes) {
        ++chunksProcessed;
        rowsAnalysed += rowsInChunk;
        ++memorySamples;
        peakMemoryBytes = Math.max(peakMemoryBytes, usedBytes);
        if (usedBytes > thresholdBytes) {
            if (chunkSize > minChunkSize) {
                chunkSize = Math.max(minChunkSize, (int) (chunkSize * SHRINK_FACTOR));
                return Adjustment.SHRUNK;
            }
            if (usedBytes > ceilingBytes && !samplingMode) {
                samplingMode = true;
                return Adjustment.ENTERED_SAMPLING;
            }
            return Adjustment.NONE;
        }
        if (usedBytes < thresholdBytes * GROW_BELOW_FRACTION && chunkSize < maxChunkSize) {
            chunkSize = Math.min(maxChunkSize, Math.max(chunkSize + 1, (int) Math.round(chunkSize * GROW_FACTOR)));
            return Adjustment.GREW;
        }
        return Adjustment.NONE;
    }

    public void rowRead() {
        ++rowsRead;
    }

    public int chunkSize() {
        return chunkSize;
    }

    public long peakMemoryBytes() {
        return peakMemoryBytes;
    }

    public int memorySamples() {
        return memorySamples;
    }

    public int chunksProcessed() {
        return chunksProcessed;
    }

    /** Data rows read from the source, sampled or not. */
    public long rowsRead() {
        return rowsRead;
    }

    /** Data rows fed to the accumulators. */
    public long rowsAnalysed() {
        return rowsAnalysed;
    }

    public boolean samplingMode() {
        return samplingMode;
    }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }
}
