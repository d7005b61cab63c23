package io.deephaven.csvprofiler.profile;

import java.util.Collections;
import java.util.List;

/**
 * Histogram and normality diagnostics of a numeric column.
 */
public final class DistributionShape {
    private final List<HistogramBin> histogram;
    private final StatValue jarqueBera;
    private final StatValue jarqueBeraPValue;
    private final StatValue kolmogorovSmirnov;
    private final StatValue kolmogorovSmirnovPValue;

    public DistributionShape(List<HistogramBin> histogram, StatValue jarqueBera, StatValue jarqueBeraPValue,
            StatValue kolmogorovSmirnov, StatValue kolmogorovSmirnovPValue) {
        this.histogram = Collections.unmodifiableList(histogram);
        this.jarqueBera = jarqueBera;
        this.jarqueBeraPValue = jarqueBeraPValue;
        this.kolmogorovSmirnov = kolmogorovSmirnov;
        this.kolmogorovSmirnovPValue = kolmogorovSmirnovPValue;
    }

    /** Bins over [min, max] of the column, with counts from the reservoir sample. Empty when not computed. */
    public List<HistogramBin> histogram() {
        return histogram;
    }

    public StatValue jarqueBera() {
        return jarqueBera;
    }

    public StatValue jarqueBeraPValue() {
        return jarqueBeraPValue;
    }

    /** The KS distance between the sample and a normal fitted to the column's mean and standard deviation. */
    public StatValue kolmogorovSmirnov() {
        return kolmogorovSmirnov;
    }

    public StatValue kolmogorovSmirnovPValue() {
        return kolmogorovSmirnovPValue;
    }

    /** A half-open bin [lower, upper); the last bin is closed. */
    public static final class HistogramBin {
        private final double lower;
        private final double upper;
        private final long count;

        public HistogramBin(double lower, double upper, long count) {
            this.lower = lower;
            this.upper = upper;
            this.count = count;
        }

        public double lower() {
            return lower;
        }

        public double upper() {
            return upper;
        }

        public long count() {
            return count;
        }
    }
}
