package io.deephaven.csvprofiler.profile;

import io.deephaven.csvprofiler.inference.PrimitiveType;
import io.deephaven.csvprofiler.inference.SemanticHint;
import io.deephaven.csvprofiler.inference.TypeInference;
import org.jetbrains.annotations.Nullable;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;

/**
 * The finished profile of one column. The optional sections are present only when they apply to the column's type:
 * the numeric sections for numeric columns (and currency or percentage text), the text summary for textual columns,
 * the temporal range for dates, the boolean balance for booleans, and the diversity metrics for text and booleans.
 */
public final class ColumnProfile {
    private final int index;
    private final String name;
    private final TypeInference inference;
    private final long totalCount;
    private final long nullCount;
    private final List<ValueCount> topValues;
    private final boolean topValuesExact;
    @Nullable
    private final NumericSummary numeric;
    @Nullable
    private final OutlierSummary outliers;
    @Nullable
    private final DistributionShape shape;
    @Nullable
    private final TextSummary text;
    @Nullable
    private final TemporalRange temporal;
    @Nullable
    private final BooleanBalance booleans;
    @Nullable
    private final DiversityMetrics diversity;

    public ColumnProfile(int index, String name, TypeInference inference, long totalCount, long nullCount,
            List<ValueCount> topValues, boolean topValuesExact, @Nullable NumericSummary numeric,
            @Nullable OutlierSummary outliers, @Nullable DistributionShape shape, @Nullable TextSummary text,
            @Nullable TemporalRange temporal, @Nullable BooleanBalance booleans,
            @Nullable DiversityMetrics diversity) {
        this.index = index;
        this.name = name;
        this.inference = inference;
        this.totalCount = totalCount;
        this.nullCount = nullCount;
        this.topValues = Collections.unmodifiableList(topValues);
        this.topValuesExact = topValuesExact;
        this.numeric = numeric;
        this.outliers = outliers;
        this.shape = shape;
        this.text = text;
        this.temporal = temporal;
        this.booleans = booleans;
        this.diversity = diversity;
    }

    /** The 0-based column position. */
    public int index() {
        return index;
    }

    public String name() {
        return name;
    }

    public TypeInference inference() {
        return inference;
    }

    public PrimitiveType type() {
        return inference.type();
    }

    public double confidence() {
        return inference.confidence();
    }

    @Nullable
    public SemanticHint semanticHint() {
        return inference.semanticHint();
    }

    /** The number of analysed rows, including rows where this column was null or missing. */
    public long totalCount() {
        return totalCount;
    }

    public long nullCount() {
        return nullCount;
    }

    public long nonNullCount() {
        return totalCount - nullCount;
    }

    public double nullRatio() {
        return totalCount == 0 ? 0.0 : (double) nullCount / totalCount;
    }

    public List<ValueCount> topValues() {
        return topValues;
    }

    /** Whether {@link #topValues()} counts are exact (the column had no more distinct values than tracked). */
    public boolean topValuesExact() {
        return topValuesExact;
    }

    @Nullable
    public NumericSummary numeric() {
        return numeric;
    }

    @Nullable
    public OutlierSummary outliers() {
        return outliers;
    }

    @Nullable
    public DistributionShape shape() {
        return shape;
    }

    @Nullable
    public TextSummary text() {
        return text;
    }

    @Nullable
    public TemporalRange temporal() {
        return temporal;
    }

    @Nullable
    public BooleanBalance booleans() {
        return booleans;
    }

    /** Entropy and Gini impurity of the value counts, for categorical, text and boolean columns. */
    @Nullable
    public DiversityMetrics diversity() {
        return diversity;
    }

    @Override
    public String toString() {
        return "ColumnProfile{" + index + ":" + name + ", " + inference + ", nulls=" + nullCount + '/' + totalCount
                + '}';
    }

    /** A frequent value. {@code error} bounds how much {@code count} may overstate the true count. */
    public static final class ValueCount {
        private final String value;
        private final long count;
        private final long error;

        public ValueCount(String value, long count, long error) {
            this.value = value;
            this.count = count;
            this.error = error;
        }

        public String value() {
            return value;
        }

        public long count() {
            return count;
        }

        public long error() {
            return error;
        }

        @Override
        public String toString() {
            return value + "=" + count;
        }
    }

    /** String length statistics over non-null cells. */
    public static final class TextSummary {
        private final int minLength;
        private final int maxLength;
        private final double meanLength;

        public TextSummary(int minLength, int maxLength, double meanLength) {
            this.minLength = minLength;
            this.maxLength = maxLength;
            this.meanLength = meanLength;
        }

        public int minLength() {
            return minLength;
        }

        public int maxLength() {
            return maxLength;
        }

        public double meanLength() {
            return meanLength;
        }
    }

    /** Earliest and latest date of a DATE column. */
    public static final class TemporalRange {
        private final LocalDate earliest;
        private final LocalDate latest;
        private final long dateCount;

        public TemporalRange(LocalDate earliest, LocalDate latest, long dateCount) {
            this.earliest = earliest;
            this.latest = latest;
            this.dateCount = dateCount;
        }

        public LocalDate earliest() {
            return earliest;
        }

        public LocalDate latest() {
            return latest;
        }

        /** The number of cells that parsed as dates. */
        public long dateCount() {
            return dateCount;
        }
    }

    /** True/false counts of a BOOLEAN column. */
    public static final class BooleanBalance {
        private final long trueCount;
        private final long falseCount;

        public BooleanBalance(long trueCount, long falseCount) {
            this.trueCount = trueCount;
            this.falseCount = falseCount;
        }

        public long trueCount() {
            return trueCount;
        }

        public long falseCount() {
            return falseCount;
        }

        public StatValue trueRatio() {
            final long total = trueCount + falseCount;
            return total == 0 ? StatValue.notComputed("no boolean values") : StatValue.of((double) trueCount / total);
        }
    }
}
