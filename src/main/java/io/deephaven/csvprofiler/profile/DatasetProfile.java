package io.deephaven.csvprofiler.profile;

import io.deephaven.csvprofiler.detection.DialectProfile;

import java.util.Collections;
import java.util.List;

/**
 * The result of profiling one delimited file.
 */
public final class DatasetProfile {
    private final String source;
    private final DialectProfile dialect;
    private final long rowCount;
    private final long rowsAnalysed;
    private final long blankLines;
    private final long raggedRows;
    private final long decodeErrorRows;
    private final boolean truncated;
    private final List<ColumnProfile> columns;
    private final List<CorrelationEntry> correlations;
    private final List<ProfileWarning> warnings;
    private final PerformanceMetrics metrics;

    public DatasetProfile(String source, DialectProfile dialect, long rowCount, long rowsAnalysed, long blankLines,
            long raggedRows, long decodeErrorRows, boolean truncated, List<ColumnProfile> columns,
            List<CorrelationEntry> correlations, List<ProfileWarning> warnings, PerformanceMetrics metrics) {
        this.source = source;
        this.dialect = dialect;
        this.rowCount = rowCount;
        this.rowsAnalysed = rowsAnalysed;
        this.blankLines = blankLines;
        this.raggedRows = raggedRows;
        this.decodeErrorRows = decodeErrorRows;
        this.truncated = truncated;
        this.columns = Collections.unmodifiableList(columns);
        this.correlations = Collections.unmodifiableList(correlations);
        this.warnings = Collections.unmodifiableList(warnings);
        this.metrics = metrics;
    }

    /** A description of the input, such as its path. */
    public String source() {
        return source;
    }

    public DialectProfile dialect() {
        return dialect;
    }

    /** Data rows read (excluding the header, blank lines and undecodable rows). */
    public long rowCount() {
        return rowCount;
    }

    /** Data rows fed to the accumulators. Less than {@link #rowCount()} only in sampling mode. */
    public long rowsAnalysed() {
        return rowsAnalysed;
    }

    public int columnCount() {
        return columns.size();
    }

    public long blankLines() {
        return blankLines;
    }

    public long raggedRows() {
        return raggedRows;
    }

    public long decodeErrorRows() {
        return decodeErrorRows;
    }

    /** Whether reading stopped at the configured row limit before the end of the input. */
    public boolean truncated() {
        return truncated;
    }

    public List<ColumnProfile> columns() {
        return columns;
    }

    /**
     * @throws IllegalArgumentException if there is no column with that name.
     */
    public ColumnProfile column(final String name) {
        for (final ColumnProfile column : columns) {
            if (column.name().equals(name)) {
                return column;
            }
        }
        throw new IllegalArgumentException("No column named " + name);
    }

    public List<CorrelationEntry> correlations() {
        return correlations;
    }

    public List<ProfileWarning> warnings() {
        return warnings;
    }

    public PerformanceMetrics metrics() {
        return metrics;
    }
}
