package io.deephaven.csvprofiler.stats;

import io.deephaven.csvprofiler.containers.CharSlice;
import io.deephaven.csvprofiler.inference.PrimitiveType;
import io.deephaven.csvprofiler.inference.SemanticHint;
import io.deephaven.csvprofiler.inference.SemanticMatcher;
import io.deephaven.csvprofiler.inference.TypeInference;
import io.deephaven.csvprofiler.inference.TypeVoter;
import io.deephaven.csvprofiler.profile.ColumnProfile;
import io.deephaven.csvprofiler.profile.ColumnProfile.BooleanBalance;
import io.deephaven.csvprofiler.profile.ColumnProfile.TemporalRange;
import io.deephaven.csvprofiler.profile.ColumnProfile.TextSummary;
import io.deephaven.csvprofiler.profile.ColumnProfile.ValueCount;
import io.deephaven.csvprofiler.profile.DistributionShape;
import io.deephaven.csvprofiler.profile.DiversityMetrics;
import io.deephaven.csvprofiler.profile.NumericSummary;
import io.deephaven.csvprofiler.profile.OutlierSummary;
import io.deephaven.csvprofiler.tokenization.CustomDoubleParser;
import io.deephaven.csvprofiler.tokenization.ParsedCell;
import io.deephaven.csvprofiler.tokenization.Tokenizer;
import org.jetbrains.annotations.Nullable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * All the streaming state of one column. Each cell is classified once; the classification feeds the type vote and
 * the typed accumulators (numeric, boolean, date), and the raw text feeds the frequency table and the length summary.
 * Instances are confined to one thread at a time.
 */
public final class ColumnAccumulator {
    /** How many frequent values a profile reports. */
    public static final int TOP_VALUES_REPORTED = 10;

    private final int index;
    private final String name;
    private final Set<String> nullLiterals;
    private final int maxNullLiteralLength;
    private final Tokenizer tokenizer;
    private final ParsedCell parsed = new ParsedCell();
    private final TypeVoter voter;
    private final FrequencyTable frequencies;
    private final NumericAccumulator numeric;

    private long totalCount;
    private long nullCount;
    private long trueCount;
    private long falseCount;
    private long dateCount;
    private long minEpochDay = Long.MAX_VALUE;
    private long maxEpochDay = Long.MIN_VALUE;
    private int minLength = Integer.MAX_VALUE;
    private int maxLength;
    private long totalLength;

    /**
     * @param index The 0-based column index.
     * @param name The column name.
     * @param settings The accumulator sizing.
     * @param doubleParser The parser for floating point cells.
     */
    public ColumnAccumulator(final int index, final String name, final Settings settings,
            final CustomDoubleParser doubleParser) {
        this.index = index;
        this.name = name;
        this.nullLiterals = settings.nullLiterals;
        int longest = 0;
        for (final String literal : nullLiterals) {
            longest = Math.max(longest, literal.length());
        }
        this.maxNullLiteralLength = longest;
        this.tokenizer = new Tokenizer(doubleParser);
        this.voter = new TypeVoter(new SemanticMatcher(name), settings.inferenceSampleRows,
                settings.categoricalMaxDistinct);
        this.frequencies = new FrequencyTable(settings.topKCapacity);
        this.numeric = new NumericAccumulator(settings.quantileTargets, settings.reservoirCapacity,
                settings.extremeValueCapacity, settings.seed + index);
    }

    /**
     * Add one cell.
     *
     * @param cell The cell text, or null when the row was too short to have this column.
     * @param lineNumber The physical line the row started on.
     * @return The cell's numeric value, or NaN if it is null or not numeric.
     */
    public double update(@Nullable final String cell, final long lineNumber) {
        ++totalCount;
        if (cell == null || isNullLiteral(cell)) {
            ++nullCount;
            return Double.NaN;
        }
        double numericValue = Double.NaN;
        final PrimitiveType kind = tokenizer.classify(cell, parsed);
        voter.vote(kind, cell);
        frequencies.add(cell);

        final int length = cell.length();
        minLength = Math.min(minLength, length);
        maxLength = Math.max(maxLength, length);
        totalLength += length;

        switch (kind) {
            case BOOLEAN:
                if (parsed.booleanValue()) {
                    ++trueCount;
                } else {
                    ++falseCount;
                }
                break;
            case INTEGER:
            case FLOAT:
                numericValue = parsed.doubleValue();
                break;
            case DATE:
                ++dateCount;
                minEpochDay = Math.min(minEpochDay, parsed.epochDay());
                maxEpochDay = Math.max(maxEpochDay, parsed.epochDay());
                break;
            default:
                if (tokenizer.tryParseDecoratedNumber(cell, parsed)) {
                    numericValue = parsed.doubleValue();
                }
                break;
        }
        numeric.update(numericValue, lineNumber);
        return numericValue;
    }

    public int index() {
        return index;
    }

    public String name() {
        return name;
    }

    public long totalCount() {
        return totalCount;
    }

    public long nullCount() {
        return nullCount;
    }

    /** The type the column would converge to now. */
    public TypeInference provisionalInference() {
        return voter.result();
    }

    /** Whether the column would currently be reported with numeric statistics. */
    public boolean isProvisionallyNumeric() {
        return reportsNumeric(voter.result());
    }

    public FrequencyTable frequencies() {
        return frequencies;
    }

    public NumericAccumulator numeric() {
        return numeric;
    }

    /**
     * Converge all state into the column's profile.
     */
    public ColumnProfile finish() {
        final TypeInference inference = voter.applyIdentifierRule(voter.result(),
                frequencies.provablyDistinct() && totalCount > nullCount);
        final PrimitiveType type = inference.type();

        final List<ValueCount> topValues = new ArrayList<>();
        for (final FrequencyTable.Entry entry : frequencies.top(TOP_VALUES_REPORTED)) {
            topValues.add(new ValueCount(entry.value(), entry.count(), entry.error()));
        }

        NumericSummary numericSummary = null;
        OutlierSummary outliers = null;
        DistributionShape shape = null;
        if (reportsNumeric(inference) && numeric.count() > 0) {
            numericSummary = numeric.summary();
            outliers = OutlierDetector.detect(numeric);
            shape = DistributionTests.analyze(numeric);
        }
        final TextSummary text = type.isTextual() && totalCount > nullCount
                ? new TextSummary(minLength, maxLength, (double) totalLength / (totalCount - nullCount))
                : null;
        final TemporalRange temporal = type == PrimitiveType.DATE && dateCount > 0
                ? new TemporalRange(LocalDate.ofEpochDay(minEpochDay), LocalDate.ofEpochDay(maxEpochDay), dateCount)
                : null;
        final BooleanBalance booleans = type == PrimitiveType.BOOLEAN ? new BooleanBalance(trueCount, falseCount) : null;

        final DiversityMetrics diversity =
                type.isTextual() || type == PrimitiveType.BOOLEAN ? frequencies.diversity() : null;

        return new ColumnProfile(index, name, inference, totalCount, nullCount, topValues, frequencies.isExact(),
                numericSummary, outliers, shape, text, temporal, booleans, diversity);
    }

    private static boolean reportsNumeric(final TypeInference inference) {
        return inference.type().isNumeric() || inference.semanticHint() == SemanticHint.CURRENCY
                || inference.semanticHint() == SemanticHint.PERCENTAGE;
    }

    /** Matches case-insensitively, ignoring surrounding spaces and tabs even when the reader kept them. */
    private boolean isNullLiteral(final String cell) {
        int begin = 0;
        int end = cell.length();
        while (begin < end && CharSlice.isSpaceOrTab(cell.charAt(begin))) {
            ++begin;
        }
        while (end > begin && CharSlice.isSpaceOrTab(cell.charAt(end - 1))) {
            --end;
        }
        if (end - begin > maxNullLiteralLength) {
            return false;
        }
        return nullLiterals.contains(cell.substring(begin, end).toLowerCase(Locale.ROOT));
    }

    /**
     * Sizing shared by every column of a run.
     */
    public static final class Settings {
        private final Set<String> nullLiterals;
        private final List<Double> quantileTargets;
        private final int reservoirCapacity;
        private final int topKCapacity;
        private final int extremeValueCapacity;
        private final long inferenceSampleRows;
        private final int categoricalMaxDistinct;
        private final long seed;

        /**
         * @param nullLiterals Cell values treated as null, matched case-insensitively and ignoring surrounding spaces
         *        and tabs. The empty string should be one of them.
         */
        public Settings(Set<String> nullLiterals, List<Double> quantileTargets, int reservoirCapacity,
                int topKCapacity, int extremeValueCapacity, long inferenceSampleRows, int categoricalMaxDistinct,
                long seed) {
            this.nullLiterals = nullLiterals.stream()
                    .map(literal -> literal.toLowerCase(Locale.ROOT))
                    .collect(Collectors.toSet());
            this.quantileTargets = quantileTargets;
            this.reservoirCapacity = reservoirCapacity;
            this.topKCapacity = topKCapacity;
            this.extremeValueCapacity = extremeValueCapacity;
            this.inferenceSampleRows = inferenceSampleRows;
            this.categoricalMaxDistinct = categoricalMaxDistinct;
            this.seed = seed;
        }
    }
}
