package io.deephaven.csvprofiler;

import io.deephaven.csvprofiler.annotations.ProfilerStyle;
import io.deephaven.csvprofiler.processing.MemoryMonitor;
import io.deephaven.csvprofiler.tokenization.CustomDoubleParser;
import io.deephaven.csvprofiler.tokenization.JdkDoubleParser;
import io.deephaven.csvprofiler.util.Renderer;
import org.immutables.value.Value.Check;
import org.immutables.value.Value.Default;
import org.immutables.value.Value.Immutable;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A specification object for profiling delimited input.
 */
@Immutable
@ProfilerStyle
public abstract class CsvProfilerSpecs {
    /**
     * The Builder for the CsvProfilerSpecs class.
     */
    public interface Builder {
        /**
         * Copy all the parameters from {@code specs} into {@code this} builder.
         *
         * @param specs The source object
         * @return self after copying over all the properties.
         */
        Builder from(CsvProfilerSpecs specs);

        /**
         * The number of rows in the first chunk. The chunk size adapts to memory pressure afterwards. The default is
         * 500.
         *
         * @param chunkSize The chunkSize property.
         * @return self after modifying the chunkSize property.
         */
        Builder chunkSize(int chunkSize);

        /**
         * The chunk size never shrinks below this. The default is 50.
         *
         * @param minChunkSize The minChunkSize property.
         * @return self after modifying the minChunkSize property.
         */
        Builder minChunkSize(int minChunkSize);

        /**
         * The chunk size never grows above this. The default is 2000.
         *
         * @param maxChunkSize The maxChunkSize property.
         * @return self after modifying the maxChunkSize property.
         */
        Builder maxChunkSize(int maxChunkSize);

        /**
         * Heap usage, in MiB, above which the chunk size shrinks. The default is 100.
         *
         * @param memoryThresholdMb The memoryThresholdMb property.
         * @return self after modifying the memoryThresholdMb property.
         */
        Builder memoryThresholdMb(long memoryThresholdMb);

        /**
         * Heap usage, in MiB, above which a run whose chunk size is already minimal switches to sampling rows. Must be
         * at least {@link #memoryThresholdMb}. The default is 200.
         *
         * @param memoryCeilingMb The memoryCeilingMb property.
         * @return self after modifying the memoryCeilingMb property.
         */
        Builder memoryCeilingMb(long memoryCeilingMb);

        /**
         * The probability with which each row is analysed once in sampling mode. The default is
         * 0.1.
         *
         * @param samplingRate The samplingRate property.
         * @return self after modifying the samplingRate property.
         */
        Builder samplingRate(double samplingRate);

        /**
         * Stop reading after this many data rows. The default is 500,000.
         *
         * @param maxRows The maxRows property.
         * @return self after modifying the maxRows property.
         */
        Builder maxRows(long maxRows);

        /**
         * The size of each numeric column's reservoir sample, used for outliers and shape diagnostics.
         *
         * @param reservoirCapacity The reservoirCapacity property.
         * @return self after modifying the reservoirCapacity property.
         */
        Builder reservoirCapacity(int reservoirCapacity);

        /**
         * The number of distinct values each column's frequency table tracks.
         *
         * @param topKCapacity The topKCapacity property.
         * @return self after modifying the topKCapacity property.
         */
        Builder topKCapacity(int topKCapacity);

        /**
         * The number of smallest and of largest values reported per numeric column.
         *
         * @param extremeValueCapacity The extremeValueCapacity property.
         * @return self after modifying the extremeValueCapacity property.
         */
        Builder extremeValueCapacity(int extremeValueCapacity);

        /**
         * The quantiles to estimate, each in [0, 1].
         *
         * @param elements The quantile targets.
         * @return self after modifying the quantileTargets property.
         */
        Builder quantileTargets(Iterable<Double> elements);

        /**
         * The number of rows after which the numeric columns are chosen for correlation.
         *
         * @param typeSettlingRows The typeSettlingRows property.
         * @return self after modifying the typeSettlingRows property.
         */
        Builder typeSettlingRows(int typeSettlingRows);

        /**
         * The number of non-null cells per column after which the type vote freezes.
         *
         * @param inferenceSampleRows The inferenceSampleRows property.
         * @return self after modifying the inferenceSampleRows property.
         */
        Builder inferenceSampleRows(long inferenceSampleRows);

        /**
         * A text column with at most this many distinct values (and at most half as many as its text cells) is
         * CATEGORICAL.
         *
         * @param categoricalMaxDistinct The categoricalMaxDistinct property.
         * @return self after modifying the categoricalMaxDistinct property.
         */
        Builder categoricalMaxDistinct(int categoricalMaxDistinct);

        /**
         * The most numeric columns to correlate pairwise.
         *
         * @param maxCorrelationColumns The maxCorrelationColumns property.
         * @return self after modifying the maxCorrelationColumns property.
         */
        Builder maxCorrelationColumns(int maxCorrelationColumns);

        /**
         * The strings that mean "null value", matched case-insensitively after trimming. The default includes the
         * empty string, so empty cells are null.
         *
         * @param nullValueLiterals The collection of null value literal strings
         * @return self after modifying the nullValueLiterals property.
         */
        Builder nullValueLiterals(Iterable<String> nullValueLiterals);

        /**
         * The seed of every random choice (reservoir replacement, row sampling), so runs are reproducible.
         *
         * @param randomSeed The randomSeed property.
         * @return self after modifying the randomSeed property.
         */
        Builder randomSeed(long randomSeed);

        /**
         * Dialect detection looks at no more than this many lines. The default is 1000.
         *
         * @param detectionMaxLines The detectionMaxLines property.
         * @return self after modifying the detectionMaxLines property.
         */
        Builder detectionMaxLines(int detectionMaxLines);

        /**
         * Dialect detection looks at no more than this many bytes. The default is 1 MiB.
         *
         * @param detectionMaxBytes The detectionMaxBytes property.
         * @return self after modifying the detectionMaxBytes property.
         */
        Builder detectionMaxBytes(int detectionMaxBytes);

        /**
         * Whether to trim leading and trailing blanks from non-quoted values. The default is {@code true}.
         *
         * @param ignoreSurroundingSpaces The ignoreSurroundingSpaces property.
         * @return self after modifying the ignoreSurroundingSpaces property.
         */
        Builder ignoreSurroundingSpaces(boolean ignoreSurroundingSpaces);

        /**
         * Whether to update the columns of each chunk in parallel, on a fixed thread pool. The default is
         * {@code false}.
         *
         * @param concurrent The concurrent property.
         * @return self after modifying the concurrent property.
         */
        Builder concurrent(boolean concurrent);

        /**
         * Override encoding detection with this character set name.
         *
         * @param encoding The encoding property.
         * @return self after modifying the encoding property.
         */
        Builder encoding(@Nullable String encoding);

        /**
         * Override delimiter detection.
         *
         * @param delimiter The delimiter property.
         * @return self after modifying the delimiter property.
         */
        Builder delimiter(@Nullable Character delimiter);

        /**
         * Override quote detection.
         *
         * @param quote The quote property.
         * @return self after modifying the quote property.
         */
        Builder quote(@Nullable Character quote);

        /**
         * Override header detection.
         *
         * @param hasHeaderRow The hasHeaderRow property.
         * @return self after modifying the hasHeaderRow property.
         */
        Builder hasHeaderRow(@Nullable Boolean hasHeaderRow);

        /**
         * The source of heap usage readings. The default reads {@link Runtime}.
         *
         * @param memoryMonitor The memoryMonitor property.
         * @return self after modifying the memoryMonitor property.
         */
        Builder memoryMonitor(MemoryMonitor memoryMonitor);

        /**
         * The custom double parser. If not explicitly set, it will default to {@link CustomDoubleParser#load()} if
         * present, otherwise {@link JdkDoubleParser#INSTANCE}.
         *
         * @param customDoubleParser The custom double parser
         * @return self after modifying the customDoubleParser property.
         */
        Builder customDoubleParser(CustomDoubleParser customDoubleParser);

        /**
         * Build the CsvProfilerSpecs object.
         *
         * @return The built object.
         */
        CsvProfilerSpecs build();
    }

    /**
     * Creates a builder for {@link CsvProfilerSpecs}.
     *
     * @return The builder.
     */
    public static Builder builder() {
        return ImmutableCsvProfilerSpecs.builder();
    }

    /**
     * The default specs: everything detected, sequential, default budgets.
     */
    public static CsvProfilerSpecs defaults() {
        return builder().build();
    }

    /**
     * Validates the {@link CsvProfilerSpecs}.
     */
    @Check
    void check() {
        // To be friendly, we report all the problems we find at once.
        final List<String> problems = new ArrayList<>();
        checkPositive("chunkSize", chunkSize(), problems);
        checkPositive("minChunkSize", minChunkSize(), problems);
        checkPositive("maxChunkSize", maxChunkSize(), problems);
        if (minChunkSize() > chunkSize() || chunkSize() > maxChunkSize()) {
            problems.add(String.format("chunk sizes must satisfy minChunkSize (%d) <= chunkSize (%d) <= "
                    + "maxChunkSize (%d)", minChunkSize(), chunkSize(), maxChunkSize()));
        }
        checkPositive("memoryThresholdMb", memoryThresholdMb(), problems);
        if (memoryCeilingMb() < memoryThresholdMb()) {
            problems.add(String.format("memoryCeilingMb (%d) must be at least memoryThresholdMb (%d)",
                    memoryCeilingMb(), memoryThresholdMb()));
        }
        if (!(samplingRate() > 0 && samplingRate() <= 1)) {
            problems.add(String.format("samplingRate is %s, but must be in (0, 1]", samplingRate()));
        }
        checkPositive("maxRows", maxRows(), problems);
        checkPositive("reservoirCapacity", reservoirCapacity(), problems);
        checkPositive("topKCapacity", topKCapacity(), problems);
        checkPositive("extremeValueCapacity", extremeValueCapacity(), problems);
        checkPositive("typeSettlingRows", typeSettlingRows(), problems);
        checkPositive("inferenceSampleRows", inferenceSampleRows(), problems);
        checkNonnegative("categoricalMaxDistinct", categoricalMaxDistinct(), problems);
        checkNonnegative("maxCorrelationColumns", maxCorrelationColumns(), problems);
        checkPositive("detectionMaxLines", detectionMaxLines(), problems);
        checkPositive("detectionMaxBytes", detectionMaxBytes(), problems);
        for (final Double target : quantileTargets()) {
            if (!(target >= 0 && target <= 1)) {
                problems.add(String.format("quantile target %s is not in [0, 1]", target));
            }
        }
        if (quantileTargets().size() != quantileTargets().stream().distinct().count()) {
            problems.add("quantileTargets contains duplicates");
        }
        final String encoding = encoding();
        if (encoding != null && !isSupportedCharset(encoding)) {
            problems.add(String.format("encoding '%s' is not supported", encoding));
        }
        final Character delimiter = delimiter();
        if (delimiter != null && (delimiter == '\n' || delimiter == '\r')) {
            problems.add("delimiter cannot be a line break");
        }
        final Character quote = quote();
        if (quote != null && (quote == '\n' || quote == '\r' || quote.equals(delimiter))) {
            problems.add(String.format("quote '%c' conflicts with the delimiter or a line break", quote));
        }
        if (problems.isEmpty()) {
            return;
        }
        final String message =
                "CsvProfilerSpecs failed validation for the following reasons: " + Renderer.renderList(problems);
        throw new IllegalArgumentException(message);
    }

    private static final int defaultChunkSize = 500;

    /**
     * See {@link Builder#chunkSize}.
     *
     * @return The initial chunk size.
     */
    @Default
    public int chunkSize() {
        return defaultChunkSize;
    }

    private static final int defaultMinChunkSize = 50;

    /**
     * See {@link Builder#minChunkSize}.
     *
     * @return The minimum chunk size.
     */
    @Default
    public int minChunkSize() {
        return defaultMinChunkSize;
    }

    private static final int defaultMaxChunkSize = 2000;

    /**
     * See {@link Builder#maxChunkSize}.
     *
     * @return The maximum chunk size.
     */
    @Default
    public int maxChunkSize() {
        return defaultMaxChunkSize;
    }

    private static final long defaultMemoryThresholdMb = 100;

    /**
     * See {@link Builder#memoryThresholdMb}.
     *
     * @return The memory threshold in MiB.
     */
    @Default
    public long memoryThresholdMb() {
        return defaultMemoryThresholdMb;
    }

    private static final long defaultMemoryCeilingMb = 200;

    /**
     * See {@link Builder#memoryCeilingMb}.
     *
     * @return The memory ceiling in MiB.
     */
    @Default
    public long memoryCeilingMb() {
        return defaultMemoryCeilingMb;
    }

    private static final double defaultSamplingRate = 0.1;

    /**
     * See {@link Builder#samplingRate}.
     *
     * @return The row sampling probability in sampling mode.
     */
    @Default
    public double samplingRate() {
        return defaultSamplingRate;
    }

    private static final long defaultMaxRows = 500_000;

    /**
     * See {@link Builder#maxRows}.
     *
     * @return The row limit.
     */
    @Default
    public long maxRows() {
        return defaultMaxRows;
    }

    /**
     * See {@link Builder#reservoirCapacity}.
     *
     * @return The reservoir capacity.
     */
    @Default
    public int reservoirCapacity() {
        return 10_000;
    }

    /**
     * See {@link Builder#topKCapacity}.
     *
     * @return The frequency table capacity.
     */
    @Default
    public int topKCapacity() {
        return 100;
    }

    /**
     * See {@link Builder#extremeValueCapacity}.
     *
     * @return The number of extreme values kept per tail.
     */
    @Default
    public int extremeValueCapacity() {
        return 5;
    }

    /**
     * See {@link Builder#quantileTargets}.
     *
     * @return The quantile targets.
     */
    @Default
    public List<Double> quantileTargets() {
        return Arrays.asList(0.01, 0.05, 0.25, 0.5, 0.75, 0.95, 0.99);
    }

    /**
     * See {@link Builder#typeSettlingRows}.
     *
     * @return The type-settling window, in rows.
     */
    @Default
    public int typeSettlingRows() {
        return 1000;
    }

    /**
     * See {@link Builder#inferenceSampleRows}.
     *
     * @return The number of votes after which type inference freezes.
     */
    @Default
    public long inferenceSampleRows() {
        return 10_000;
    }

    /**
     * See {@link Builder#categoricalMaxDistinct}.
     *
     * @return The distinct-value limit of a categorical column.
     */
    @Default
    public int categoricalMaxDistinct() {
        return 50;
    }

    /**
     * See {@link Builder#maxCorrelationColumns}.
     *
     * @return The maximum number of correlated columns.
     */
    @Default
    public int maxCorrelationColumns() {
        return 20;
    }

    /**
     * See {@link Builder#nullValueLiterals}.
     *
     * @return The null value literals.
     */
    @Default
    public List<String> nullValueLiterals() {
        return Arrays.asList("", "null", "na", "n/a", "nan", "none", "nil", "-");
    }

    /**
     * See {@link Builder#randomSeed}.
     *
     * @return The random seed.
     */
    @Default
    public long randomSeed() {
        return 42L;
    }

    private static final int defaultDetectionMaxLines = 1000;

    /**
     * See {@link Builder#detectionMaxLines}.
     *
     * @return The line limit of dialect detection.
     */
    @Default
    public int detectionMaxLines() {
        return defaultDetectionMaxLines;
    }

    /**
     * See {@link Builder#detectionMaxBytes}.
     *
     * @return The byte limit of dialect detection.
     */
    @Default
    public int detectionMaxBytes() {
        return 1 << 20;
    }

    /**
     * See {@link Builder#ignoreSurroundingSpaces}.
     *
     * @return Whether the caller specified to ignore surrounding spaces.
     */
    @Default
    public boolean ignoreSurroundingSpaces() {
        return true;
    }

    /**
     * See {@link Builder#concurrent}.
     *
     * @return Whether the caller specified to run concurrently.
     */
    @Default
    public boolean concurrent() {
        return false;
    }

    /**
     * See {@link Builder#encoding}.
     *
     * @return The encoding override, or null to detect.
     */
    @Nullable
    public abstract String encoding();

    /**
     * See {@link Builder#delimiter}.
     *
     * @return The delimiter override, or null to detect.
     */
    @Nullable
    public abstract Character delimiter();

    /**
     * See {@link Builder#quote}.
     *
     * @return The quote override, or null to detect.
     */
    @Nullable
    public abstract Character quote();

    /**
     * See {@link Builder#hasHeaderRow}.
     *
     * @return The header override, or null to detect.
     */
    @Nullable
    public abstract Boolean hasHeaderRow();

    /**
     * See {@link Builder#memoryMonitor}.
     *
     * @return The memory monitor.
     */
    @Default
    public MemoryMonitor memoryMonitor() {
        return MemoryMonitor.runtime();
    }

    /**
     * See {@link Builder#customDoubleParser}.
     *
     * @return The parser to use to parse doubles.
     */
    @Default
    public CustomDoubleParser customDoubleParser() {
        return CustomDoubleParser.load().orElse(JdkDoubleParser.INSTANCE);
    }

    private static boolean isSupportedCharset(final String name) {
        try {
            return Charset.isSupported(name);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static void checkPositive(String what, long value, List<String> problems) {
        if (value <= 0) {
            problems.add(String.format("%s is set to %d, but is required to be positive", what, value));
        }
    }

    private static void checkNonnegative(String what, long value, List<String> problems) {
        if (value < 0) {
            problems.add(String.format("%s is set to %d, but is required to be nonnegative", what, value));
        }
    }
}
