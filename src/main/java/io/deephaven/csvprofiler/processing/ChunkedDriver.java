package io.deephaven.csvprofiler.processing;

import io.deephaven.csvprofiler.CsvProfilerSpecs;
import io.deephaven.csvprofiler.detection.DialectProfile;
import io.deephaven.csvprofiler.processing.StreamingSession.Adjustment;
import io.deephaven.csvprofiler.profile.ColumnProfile;
import io.deephaven.csvprofiler.profile.DatasetProfile;
import io.deephaven.csvprofiler.profile.PerformanceMetrics;
import io.deephaven.csvprofiler.profile.ProfileWarning.Severity;
import io.deephaven.csvprofiler.reading.ByteSource;
import io.deephaven.csvprofiler.reading.RawRow;
import io.deephaven.csvprofiler.reading.RowReader;
import io.deephaven.csvprofiler.stats.ColumnAccumulator;
import io.deephaven.csvprofiler.stats.PairwiseCorrelations;
import io.deephaven.csvprofiler.util.CsvProfilerException;
import io.deephaven.csvprofiler.util.CsvProfilerException.Reason;
import io.deephaven.csvprofiler.util.GroupWaiter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.OptionalLong;
import java.util.SplittableRandom;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs the profiling pass over a source whose dialect is known. Rows are read into a chunk buffer up to the session's
 * current chunk size and fed to the column accumulators; after each chunk the heap is sampled, the chunk size adapts,
 * progress is reported and cancellation is polled. With {@link CsvProfilerSpecs#concurrent()} the columns of a chunk
 * are updated on a fixed thread pool, partitioned by column index. Pairwise correlations are always updated on the
 * calling thread once every column of the chunk is done.
 */
public final class ChunkedDriver {
    private static final Logger LOGGER = LogManager.getLogger(ChunkedDriver.class);

    /** Columns whose inferred type has less support than this get a warning. */
    public static final double LOW_TYPE_CONFIDENCE = 0.5;
    public static final String STAGE = "profiling";

    private final CsvProfilerSpecs specs;
    private final ProgressListener progress;
    private final CancellationToken cancellation;

    public ChunkedDriver(final CsvProfilerSpecs specs, final ProgressListener progress,
            final CancellationToken cancellation) {
        this.specs = specs;
        this.progress = progress;
        this.cancellation = cancellation;
    }

    /**
     * Profile {@code source}.
     *
     * @param source The input.
     * @param dialect The detected (or overridden) dialect.
     * @param startNanos The {@link System#nanoTime()} at which the run started, detection included.
     * @return The profile.
     * @throws CsvProfilerException If the source cannot be read, has no records, or the run is cancelled.
     */
    public DatasetProfile run(final ByteSource source, final DialectProfile dialect, final long startNanos)
            throws CsvProfilerException {
        final WarningCollector warnings = new WarningCollector();
        final RowReader.Listener listener = new RowReader.Listener() {
            @Override
            public void decodeError(final long lineNumber, final int malformedSequences) {
                warnings.addCapped("decode error",
                        String.format("Line %d contains %d byte sequence(s) that are not valid %s", lineNumber,
                                malformedSequences, dialect.encoding()),
                        null);
            }
        };

        final int numThreads = specs.concurrent() ? Runtime.getRuntime().availableProcessors() : 1;
        final Executor exec;
        final ExecutorService executorService;
        if (specs.concurrent()) {
            exec = executorService = Executors.newFixedThreadPool(numThreads);
        } else {
            exec = DirectExecutor.INSTANCE;
            executorService = null;
        }
        try (final RowReader reader = new RowReader(source, dialect, specs.ignoreSurroundingSpaces(), listener)) {
            return profileRows(source, dialect, reader, warnings, exec, numThreads, startNanos);
        } catch (IOException e) {
            throw new CsvProfilerException(Reason.SOURCE_UNREADABLE,
                    "Could not read " + source.description() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CsvProfilerException(Reason.CANCELLED, "Interrupted while profiling " + source.description(),
                    e);
        } finally {
            if (executorService != null) {
                executorService.shutdown();
            }
        }
    }

    private DatasetProfile profileRows(final ByteSource source, final DialectProfile dialect, final RowReader reader,
            final WarningCollector warnings, final Executor exec, final int numThreads, final long startNanos)
            throws IOException, InterruptedException, CsvProfilerException {
        final int numCols = reader.columnCount();
        if (numCols == 0) {
            throw new CsvProfilerException(Reason.EMPTY_INPUT, source.description() + " contains no records");
        }
        LOGGER.info("Profiling {} ({} columns, delimiter '{}', encoding {}, header {})", source.description(),
                numCols, dialect.delimiter(), dialect.encoding(), dialect.hasHeaderRow());

        final ColumnAccumulator.Settings settings = new ColumnAccumulator.Settings(
                new HashSet<>(specs.nullValueLiterals()), specs.quantileTargets(), specs.reservoirCapacity(),
                specs.topKCapacity(), specs.extremeValueCapacity(), specs.inferenceSampleRows(),
                specs.categoricalMaxDistinct(), specs.randomSeed());
        final List<String> headers = reader.headers();
        final ColumnAccumulator[] columns = new ColumnAccumulator[numCols];
        for (int ii = 0; ii < numCols; ++ii) {
            columns[ii] = new ColumnAccumulator(ii, headers.get(ii), settings, specs.customDoubleParser());
        }
        final PairwiseCorrelations correlations =
                new PairwiseCorrelations(columns, specs.typeSettlingRows(), specs.maxCorrelationColumns());
        final StreamingSession session = new StreamingSession(specs.chunkSize(), specs.minChunkSize(),
                specs.maxChunkSize(), specs.memoryThresholdMb(), specs.memoryCeilingMb(), cancellation);
        final SplittableRandom sampler = new SplittableRandom(specs.randomSeed());
        final OptionalLong sizeHint = source.sizeHint();
        final int numPartitions = Math.min(numThreads, numCols);

        final List<RawRow> chunk = new ArrayList<>();
        final double[] rowValues = new double[numCols];
        boolean truncated = false;
        boolean exhausted = false;
        while (!exhausted) {
            if (session.isCancelled()) {
                LOGGER.info("Profiling of {} cancelled after {} rows", source.description(), session.rowsRead());
                throw new CsvProfilerException(Reason.CANCELLED,
                        "Profiling cancelled after " + session.rowsRead() + " rows");
            }
            chunk.clear();
            final int chunkSize = session.chunkSize();
            int rowsInChunk = 0;
            while (rowsInChunk < chunkSize) {
                if (session.rowsRead() == specs.maxRows()) {
                    exhausted = true;
                    if (reader.next() != null) {
                        truncated = true;
                        warnings.add(Severity.WARNING, String.format(
                                "Stopped after %d data rows (maxRows); the rest of the input was not read",
                                specs.maxRows()));
                    }
                    break;
                }
                final RawRow row = reader.next();
                if (row == null) {
                    exhausted = true;
                    break;
                }
                session.rowRead();
                ++rowsInChunk;
                if (row.isRagged()) {
                    warnings.addCapped("ragged row", String.format("Line %d has %d fields, expected %d",
                            row.lineNumber(), row.fieldCount(), numCols), null);
                }
                if (session.samplingMode() && sampler.nextDouble() >= specs.samplingRate()) {
                    continue;
                }
                chunk.add(row);
            }
            if (rowsInChunk == 0) {
                break;
            }

            updateColumns(columns, chunk, exec, numPartitions, rowValues, correlations);

            final long usedBytes = specs.memoryMonitor().usedBytes();
            final Adjustment adjustment = session.afterChunk(chunk.size(), usedBytes);
            switch (adjustment) {
                case SHRUNK:
                case GREW:
                    LOGGER.debug("Chunk {}: {} MiB used, chunk size {} -> {}", session.chunksProcessed(),
                            usedBytes >> 20, chunkSize, session.chunkSize());
                    break;
                case ENTERED_SAMPLING:
                    LOGGER.warn("Memory use of {} MiB exceeds the ceiling of {} MiB; sampling {} of later rows",
                            usedBytes >> 20, specs.memoryCeilingMb(), specs.samplingRate());
                    warnings.add(Severity.WARNING, String.format(
                            "Memory ceiling exceeded after %d rows; later rows were sampled at rate %s",
                            session.rowsRead(), specs.samplingRate()));
                    break;
                default:
                    break;
            }
            progress.onProgress(STAGE, session.rowsRead(), percentage(reader.bytesRead(), sizeHint),
                    String.format("Processed %d rows in %d chunks", session.rowsRead(), session.chunksProcessed()));
        }

        if (session.rowsRead() == 0) {
            warnings.add(Severity.WARNING, "The input has no data rows; only the header was read");
        }
        final List<ColumnProfile> profiles = new ArrayList<>(numCols);
        for (final ColumnAccumulator column : columns) {
            final ColumnProfile profile = column.finish();
            profiles.add(profile);
            if (profile.nonNullCount() > 0 && profile.confidence() < LOW_TYPE_CONFIDENCE) {
                warnings.addForColumn(Severity.INFO, String.format(
                        "Column '%s' is %s with low confidence %.2f; its values are mixed",
                        profile.name(), profile.type(), profile.confidence()), profile.index());
            }
            if (profile.totalCount() > 0 && profile.nonNullCount() == 0) {
                warnings.addForColumn(Severity.INFO,
                        String.format("Column '%s' contains only null values", profile.name()), profile.index());
            }
        }

        final long elapsedMillis = (System.nanoTime() - startNanos) / 1_000_000;
        final PerformanceMetrics metrics = new PerformanceMetrics(elapsedMillis, session.peakMemoryBytes(),
                session.rowsRead(), reader.bytesRead(), session.chunksProcessed(), session.chunkSize(),
                session.samplingMode());
        progress.onProgress("complete", session.rowsRead(), 100,
                String.format("Profiled %d rows and %d columns", session.rowsRead(), numCols));
        LOGGER.info("Profiled {}: {} rows, {} columns in {} ms ({} chunks, peak {} MiB{})", source.description(),
                session.rowsRead(), numCols, elapsedMillis, session.chunksProcessed(),
                session.peakMemoryBytes() >> 20, session.samplingMode() ? ", sampled" : "");
        return new DatasetProfile(source.description(), dialect, session.rowsRead(), session.rowsAnalysed(),
                reader.blankLines(), reader.raggedRows(), reader.decodeErrorRows(), truncated, profiles,
                correlations.finish(), warnings.finish(), metrics);
    }

    /**
     * Feed one chunk to the columns, partition by partition, then feed each row's numeric values to the pairwise
     * accumulators.
     */
    private static void updateColumns(final ColumnAccumulator[] columns, final List<RawRow> chunk,
            final Executor exec, final int numPartitions, final double[] rowValues,
            final PairwiseCorrelations correlations) throws CsvProfilerException, InterruptedException {
        final int numRows = chunk.size();
        if (numRows == 0) {
            return;
        }
        final double[][] values = new double[columns.length][numRows];
        final GroupWaiter waiter = new GroupWaiter(exec);
        for (int partition = 0; partition < numPartitions; ++partition) {
            final int first = partition;
            waiter.submit(() -> {
                for (int col = first; col < columns.length; col += numPartitions) {
                    final ColumnAccumulator column = columns[col];
                    final double[] dest = values[col];
                    for (int row = 0; row < numRows; ++row) {
                        final RawRow raw = chunk.get(row);
                        dest[row] = column.update(raw.field(col), raw.lineNumber());
                    }
                }
                return null;
            });
        }
        waiter.waitAll();

        for (int row = 0; row < numRows; ++row) {
            for (int col = 0; col < columns.length; ++col) {
                rowValues[col] = values[col][row];
            }
            correlations.update(rowValues);
        }
    }

    /**
     * @return Bytes consumed as a percentage of the source size, or 0 when the size is unknown.
     */
    static int percentage(final long bytesRead, final OptionalLong sizeHint) {
        if (sizeHint.isEmpty() || sizeHint.getAsLong() <= 0) {
            return 0;
        }
        final long pct = bytesRead * 100 / sizeHint.getAsLong();
        return (int) Math.max(0, Math.min(100, pct));
    }

    private enum DirectExecutor implements Executor {
        INSTANCE;

        @Override
        public void execute(@NotNull Runnable command) {
            command.run();
        }
    }
}
