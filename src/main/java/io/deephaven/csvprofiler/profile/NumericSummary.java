package io.deephaven.csvprofiler.profile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Moments and quantile estimates of a numeric column. Quantiles are P² estimates (exact for at most five values).
 */
public final class NumericSummary {
    private final long count;
    private final double sum;
    private final StatValue mean;
    private final StatValue min;
    private final StatValue max;
    private final StatValue variance;
    private final StatValue standardDeviation;
    private final StatValue skewness;
    private final StatValue excessKurtosis;
    private final Map<Double, StatValue> quantiles;
    private final boolean quantilesExact;

    public NumericSummary(long count, double sum, StatValue mean, StatValue min, StatValue max, StatValue variance,
            StatValue standardDeviation, StatValue skewness, StatValue excessKurtosis, Map<Double, StatValue> quantiles,
            boolean quantilesExact) {
        this.count = count;
        this.sum = sum;
        this.mean = mean;
        this.min = min;
        this.max = max;
        this.variance = variance;
        this.standardDeviation = standardDeviation;
        this.skewness = skewness;
        this.excessKurtosis = excessKurtosis;
        this.quantiles = Collections.unmodifiableMap(new LinkedHashMap<>(quantiles));
        this.quantilesExact = quantilesExact;
    }

    /** The number of finite numeric values. */
    public long count() {
        return count;
    }

    public double sum() {
        return sum;
    }

    public StatValue mean() {
        return mean;
    }

    public StatValue min() {
        return min;
    }

    public StatValue max() {
        return max;
    }

    /** Sample variance (divisor n - 1). */
    public StatValue variance() {
        return variance;
    }

    public StatValue standardDeviation() {
        return standardDeviation;
    }

    public StatValue skewness() {
        return skewness;
    }

    public StatValue excessKurtosis() {
        return excessKurtosis;
    }

    /** Quantile estimates keyed by target probability, in configuration order. */
    public Map<Double, StatValue> quantiles() {
        return quantiles;
    }

    /**
     * The estimate for {@code p}.
     *
     * @throws IllegalArgumentException if {@code p} was not a configured target.
     */
    public StatValue quantile(final double p) {
        final StatValue result = quantiles.get(p);
        if (result == null) {
            throw new IllegalArgumentException("Quantile " + p + " was not a configured target");
        }
        return result;
    }

    public boolean quantilesExact() {
        return quantilesExact;
    }
}
