package io.deephaven.csvprofiler.stats;

import java.util.Arrays;

/**
 * Streaming estimate of a single quantile using the P² algorithm of Jain and Chlamtac (1985). Five markers track the
 * minimum, the p/2, p and (1+p)/2 quantiles, and the maximum. Each marker has a height (the estimate), an actual
 * position, and a desired position. The desired positions are recomputed from the observation count on every update as
 * {@code 1 + (n - 1) * increment[i]}; accumulating them incrementally drifts and is not used.
 *
 * <p>
 * The markers need five observations to initialize, and the approximation is poor for tiny samples anyway, so while
 * {@code n <= 5} the estimator keeps the raw values and answers with the exact quantile (linear interpolation at index
 * {@code p * (n - 1)} of the sorted values). Memory use is constant.
 */
public final class P2QuantileEstimator {
    private static final int MARKERS = 5;

    private final double p;
    private final double[] increments;
    private final double[] heights = new double[MARKERS];
    private final double[] positions = new double[MARKERS];
    private final double[] desired = new double[MARKERS];
    /** The first five observations, in arrival order. */
    private final double[] initial = new double[MARKERS];
    private long count;

    /**
     * @param p The target quantile, in [0, 1].
     */
    public P2QuantileEstimator(final double p) {
        if (!(p >= 0 && p <= 1)) {
            throw new IllegalArgumentException("Quantile must be in [0, 1], got " + p);
        }
        this.p = p;
        this.increments = new double[] {0, p / 2, p, (1 + p) / 2, 1};
    }

    public double p() {
        return p;
    }

    public long count() {
        return count;
    }

    /**
     * Add an observation. Non-finite values are ignored.
     */
    public void update(final double value) {
        if (!Double.isFinite(value)) {
            return;
        }
        if (count < MARKERS) {
            initial[(int) count] = value;
            ++count;
            return;
        }
        if (count == MARKERS) {
            initializeMarkers();
        }

        // Find the cell k such that heights[k] <= value < heights[k + 1], extending the extremes if needed.
        final int k;
        if (value < heights[0]) {
            heights[0] = value;
            k = 0;
        } else if (value >= heights[4]) {
            heights[4] = value;
            k = 3;
        } else {
            int cell = 0;
            for (int ii = 1; ii < MARKERS; ++ii) {
                if (value < heights[ii]) {
                    cell = ii - 1;
                    break;
                }
            }
            k = cell;
        }

        for (int ii = k + 1; ii < MARKERS; ++ii) {
            positions[ii] += 1;
        }
        ++count;
        for (int ii = 0; ii < MARKERS; ++ii) {
            desired[ii] = 1 + (count - 1) * increments[ii];
        }

        for (int ii = 1; ii <= 3; ++ii) {
            final double d = desired[ii] - positions[ii];
            if ((d >= 1 && positions[ii + 1] - positions[ii] > 1)
                    || (d <= -1 && positions[ii - 1] - positions[ii] < -1)) {
                final int sign = d > 0 ? 1 : -1;
                final double candidate = parabolic(ii, sign);
                if (heights[ii - 1] < candidate && candidate < heights[ii + 1]) {
                    heights[ii] = candidate;
                } else {
                    heights[ii] = linear(ii, sign);
                }
                positions[ii] += sign;
            }
        }
    }

    /**
     * The current estimate. NaN when no observation has been seen. Exact while {@code count() <= 5}, and always exact
     * for the minimum ({@code p == 0}) and maximum ({@code p == 1}).
     */
    public double estimate() {
        if (count == 0) {
            return Double.NaN;
        }
        if (count <= MARKERS) {
            final double[] sorted = Arrays.copyOf(initial, (int) count);
            Arrays.sort(sorted);
            return exactQuantile(sorted, p);
        }
        // The outer markers hold the exact extremes.
        if (p == 0) {
            return heights[0];
        }
        if (p == 1) {
            return heights[4];
        }
        return heights[2];
    }

    /** Whether {@link #estimate()} is exact rather than a P² approximation. */
    public boolean isExact() {
        return count <= MARKERS;
    }

    /**
     * The quantile of a sorted array by linear interpolation between closest ranks (the "R-7" definition).
     *
     * @param sorted Values in ascending order, non-empty.
     * @param p The quantile.
     * @return The interpolated quantile.
     */
    public static double exactQuantile(final double[] sorted, final double p) {
        final double index = p * (sorted.length - 1);
        final int lower = (int) Math.floor(index);
        final int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (index - lower) * (sorted[upper] - sorted[lower]);
    }

    /** Marker positions, for invariant checks. */
    double[] positions() {
        return positions.clone();
    }

    /** Marker heights, for invariant checks. */
    double[] heights() {
        return heights.clone();
    }

    private void initializeMarkers() {
        System.arraycopy(initial, 0, heights, 0, MARKERS);
        Arrays.sort(heights);
        for (int ii = 0; ii < MARKERS; ++ii) {
            positions[ii] = ii + 1;
            desired[ii] = 1 + (MARKERS - 1) * increments[ii];
        }
    }

    private double parabolic(final int i, final int d) {
        final double qi = heights[i];
        final double ni = positions[i];
        final double nPrev = positions[i - 1];
        final double nNext = positions[i + 1];
        return qi + d / (nNext - nPrev)
                * ((ni - nPrev + d) * (heights[i + 1] - qi) / (nNext - ni)
                        + (nNext - ni - d) * (qi - heights[i - 1]) / (ni - nPrev));
    }

    private double linear(final int i, final int d) {
        return heights[i] + d * (heights[i + d] - heights[i]) / (positions[i + d] - positions[i]);
    }
}
