package io.deephaven.csvprofiler.detection;

/**
 * How well one candidate delimiter explains the sample.
 */
public final class DelimiterScore {
    private final char delimiter;
    private final double meanFieldCount;
    private final double fieldCountVariance;
    private final double consistency;
    private final double score;

    public DelimiterScore(char delimiter, double meanFieldCount, double fieldCountVariance, double consistency,
            double score) {
        this.delimiter = delimiter;
        this.meanFieldCount = meanFieldCount;
        this.fieldCountVariance = fieldCountVariance;
        this.consistency = consistency;
        this.score = score;
    }

    public char delimiter() {
        return delimiter;
    }

    public double meanFieldCount() {
        return meanFieldCount;
    }

    public double fieldCountVariance() {
        return fieldCountVariance;
    }

    /** Field-count consistency in [0, 1]; also the confidence reported when this candidate wins. */
    public double consistency() {
        return consistency;
    }

    /** {@code consistency * ln(meanFieldCount + 1)}. */
    public double score() {
        return score;
    }

    @Override
    public String toString() {
        return "'" + delimiter + "'=" + score;
    }
}
