package io.deephaven.csvprofiler.stats;

import org.apache.commons.math3.distribution.TDistribution;

/**
 * Running co-moment of two numeric columns (the bivariate form of Welford's update). Only rows where both values are
 * present and finite contribute.
 */
public final class PairwiseMoments {
    private long count;
    private double meanX;
    private double meanY;
    private double m2X;
    private double m2Y;
    private double coMoment;

    public void update(final double x, final double y) {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            return;
        }
        ++count;
        final double dx = x - meanX;
        meanX += dx / count;
        final double dy = y - meanY;
        meanY += dy / count;
        // Uses the updated meanY with the pre-update dx, which keeps the recurrence exact.
        coMoment += dx * (y - meanY);
        m2X += dx * (x - meanX);
        m2Y += dy * (y - meanY);
    }

    public long count() {
        return count;
    }

    /** Sample covariance, NaN when fewer than two pairs were seen. */
    public double covariance() {
        return count < 2 ? Double.NaN : coMoment / (count - 1);
    }

    /**
     * Pearson's r, clamped to [-1, 1]. NaN when fewer than three pairs were seen or either variance is zero.
     */
    public double pearson() {
        if (count < 3 || m2X <= 0 || m2Y <= 0) {
            return Double.NaN;
        }
        final double r = coMoment / Math.sqrt(m2X * m2Y);
        return Math.max(-1.0, Math.min(1.0, r));
    }

    /**
     * Two-sided p-value of the hypothesis that the true correlation is zero, from the t statistic
     * {@code r * sqrt((n - 2) / (1 - r^2))} with {@code n - 2} degrees of freedom. NaN when {@link #pearson()} is.
     */
    public double significance() {
        return significance(pearson(), count);
    }

    static double significance(final double r, final long n) {
        if (Double.isNaN(r) || n < 3) {
            return Double.NaN;
        }
        if (Math.abs(r) >= 1.0) {
            return 0.0;
        }
        final double t = Math.abs(r) * Math.sqrt((n - 2) / (1 - r * r));
        final TDistribution distribution = new TDistribution(null, n - 2);
        return Math.min(1.0, 2 * (1 - distribution.cumulativeProbability(t)));
    }

    /** Why {@link #pearson()} is NaN, or null when it is defined. */
    public String undefinedReason() {
        if (count < 3) {
            return "fewer than 3 paired values";
        }
        if (m2X <= 0 || m2Y <= 0) {
            return "zero variance";
        }
        return null;
    }
}
