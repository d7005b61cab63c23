package io.deephaven.csvprofiler.stats;

import io.deephaven.csvprofiler.profile.CorrelationEntry;
import io.deephaven.csvprofiler.profile.StatValue;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Pearson correlations between the numeric columns of a dataset. Which columns are numeric is only known once the
 * type votes settle, so the numeric values of the first {@code settlingRows} rows are buffered. At the end of that
 * window the pairs are created and the buffer replayed into them, after which rows flow straight through. The buffer
 * is therefore bounded by the window size, and the correlations cover every analysed row.
 */
public final class PairwiseCorrelations {
    private static final Logger LOGGER = LogManager.getLogger(PairwiseCorrelations.class);

    private final ColumnAccumulator[] columns;
    private final int settlingRows;
    private final int maxColumns;
    private List<double[]> pending = new ArrayList<>();
    private int[] selected;
    private PairwiseMoments[] pairs;

    /**
     * @param columns The column accumulators, consulted for their provisional types when the window closes.
     * @param settlingRows The number of rows after which the numeric columns are chosen.
     * @param maxColumns The most numeric columns to correlate; pairs grow quadratically with it.
     */
    public PairwiseCorrelations(final ColumnAccumulator[] columns, final int settlingRows, final int maxColumns) {
        this.columns = columns;
        this.settlingRows = settlingRows;
        this.maxColumns = maxColumns;
    }

    /**
     * Record one row. Call after the column accumulators have seen the row.
     *
     * @param values The numeric value of each column in the row (NaN where not numeric). Not retained after the
     *        window closes; may be reused by the caller.
     */
    public void update(final double[] values) {
        if (selected == null) {
            pending.add(values.clone());
            if (pending.size() >= settlingRows) {
                settle();
            }
            return;
        }
        updatePairs(values);
    }

    private void updatePairs(final double[] values) {
        int pair = 0;
        for (int ii = 0; ii < selected.length; ++ii) {
            final double x = values[selected[ii]];
            for (int jj = ii + 1; jj < selected.length; ++jj) {
                pairs[pair++].update(x, values[selected[jj]]);
            }
        }
    }

    public boolean isSettled() {
        return selected != null;
    }

    /** The number of rows currently buffered; never more than the settling window. */
    public int pendingRows() {
        return pending == null ? 0 : pending.size();
    }

    /**
     * Produce one entry per pair of correlated columns, settling first if the stream ended inside the window.
     */
    public List<CorrelationEntry> finish() {
        if (selected == null) {
            settle();
        }
        final List<CorrelationEntry> result = new ArrayList<>(pairs.length);
        int pair = 0;
        for (int ii = 0; ii < selected.length; ++ii) {
            for (int jj = ii + 1; jj < selected.length; ++jj) {
                final PairwiseMoments moments = pairs[pair++];
                final ColumnAccumulator first = columns[selected[ii]];
                final ColumnAccumulator second = columns[selected[jj]];
                final String reason = moments.undefinedReason();
                final StatValue coefficient;
                final StatValue pValue;
                if (reason == null) {
                    coefficient = StatValue.of(moments.pearson());
                    pValue = StatValue.of(moments.significance());
                } else {
                    coefficient = pValue = StatValue.notComputed(reason);
                }
                result.add(new CorrelationEntry(first.index(), first.name(), second.index(), second.name(),
                        coefficient, pValue, moments.count()));
            }
        }
        return result;
    }

    private void settle() {
        final List<Integer> numeric = new ArrayList<>();
        for (final ColumnAccumulator column : columns) {
            if (numeric.size() < maxColumns && column.isProvisionallyNumeric()) {
                numeric.add(column.index());
            }
        }
        selected = numeric.stream().mapToInt(Integer::intValue).toArray();
        pairs = new PairwiseMoments[selected.length * (selected.length - 1) / 2];
        for (int ii = 0; ii < pairs.length; ++ii) {
            pairs[ii] = new PairwiseMoments();
        }
        for (final double[] values : pending) {
            updatePairs(values);
        }
        LOGGER.debug("Correlating {} numeric columns ({} pairs) after replaying {} buffered rows", selected.length,
                pairs.length, pending.size());
        pending = null;
    }
}
