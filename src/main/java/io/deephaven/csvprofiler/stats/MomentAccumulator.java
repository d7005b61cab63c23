package io.deephaven.csvprofiler.stats;

/**
 * Running count, mean, and second to fourth central moment sums, updated with Welford's recurrences so that a single
 * pass yields mean, variance, skewness and kurtosis without catastrophic cancellation. Also tracks min, max and sum.
 * Non-finite values are ignored.
 */
public final class MomentAccumulator {
    private long count;
    private double mean;
    private double m2;
    private double m3;
    private double m4;
    private double min = Double.POSITIVE_INFINITY;
    private double max = Double.NEGATIVE_INFINITY;
    private double sum;

    public void update(final double value) {
        if (!Double.isFinite(value)) {
            return;
        }
        final long n1 = count;
        ++count;
        final double n = count;
        final double delta = value - mean;
        final double deltaN = delta / n;
        final double deltaN2 = deltaN * deltaN;
        final double term1 = delta * deltaN * n1;
        mean += deltaN;
        // M4 and M3 must be updated before M2, since they use the old M2 (and M4 the old M3).
        m4 += term1 * deltaN2 * (n * n - 3 * n + 3) + 6 * deltaN2 * m2 - 4 * deltaN * m3;
        m3 += term1 * deltaN * (n - 2) - 3 * deltaN * m2;
        m2 += term1;
        sum += value;
        if (value < min) {
            min = value;
        }
        if (value > max) {
            max = value;
        }
    }

    /**
     * Fold {@code other} into this accumulator using the pairwise combination formulas. The result is the same
     * (within rounding) as if every value of {@code other} had been passed to {@link #update}.
     */
    public void merge(final MomentAccumulator other) {
        if (other.count == 0) {
            return;
        }
        if (count == 0) {
            count = other.count;
            mean = other.mean;
            m2 = other.m2;
            m3 = other.m3;
            m4 = other.m4;
            min = other.min;
            max = other.max;
            sum = other.sum;
            return;
        }
        final double na = count;
        final double nb = other.count;
        final double n = na + nb;
        final double delta = other.mean - mean;
        final double delta2 = delta * delta;
        final double delta3 = delta * delta2;
        final double delta4 = delta2 * delta2;

        final double newM2 = m2 + other.m2 + delta2 * na * nb / n;
        final double newM3 = m3 + other.m3 + delta3 * na * nb * (na - nb) / (n * n)
                + 3 * delta * (na * other.m2 - nb * m2) / n;
        final double newM4 = m4 + other.m4 + delta4 * na * nb * (na * na - na * nb + nb * nb) / (n * n * n)
                + 6 * delta2 * (na * na * other.m2 + nb * nb * m2) / (n * n)
                + 4 * delta * (na * other.m3 - nb * m3) / n;

        mean = (na * mean + nb * other.mean) / n;
        m2 = newM2;
        m3 = newM3;
        m4 = newM4;
        count += other.count;
        sum += other.sum;
        min = Math.min(min, other.min);
        max = Math.max(max, other.max);
    }

    public long count() {
        return count;
    }

    /** The mean. NaN when no value has been seen. */
    public double mean() {
        return count == 0 ? Double.NaN : mean;
    }

    /** The smallest value seen. NaN when no value has been seen. */
    public double min() {
        return count == 0 ? Double.NaN : min;
    }

    /** The largest value seen. NaN when no value has been seen. */
    public double max() {
        return count == 0 ? Double.NaN : max;
    }

    public double sum() {
        return sum;
    }

    /** Sum of squared deviations from the mean. */
    public double m2() {
        return m2;
    }

    public double m3() {
        return m3;
    }

    public double m4() {
        return m4;
    }

    /** Sample variance (n - 1 denominator). NaN for fewer than two values. */
    public double sampleVariance() {
        return count < 2 ? Double.NaN : m2 / (count - 1);
    }

    /** Population variance (n denominator). NaN when no value has been seen. */
    public double populationVariance() {
        return count == 0 ? Double.NaN : m2 / count;
    }

    /**
     * Population skewness {@code sqrt(n) * M3 / M2^1.5}. NaN for fewer than three values or zero variance.
     */
    public double skewness() {
        if (count < 3 || m2 <= 0) {
            return Double.NaN;
        }
        return Math.sqrt(count) * m3 / Math.pow(m2, 1.5);
    }

    /**
     * Excess kurtosis {@code n * M4 / M2^2 - 3}. NaN for fewer than four values or zero variance.
     */
    public double excessKurtosis() {
        if (count < 4 || m2 <= 0) {
            return Double.NaN;
        }
        return count * m4 / (m2 * m2) - 3.0;
    }
}
