package io.deephaven.csvprofiler.stats;

import io.deephaven.csvprofiler.profile.OutlierSummary;
import io.deephaven.csvprofiler.profile.StatValue;

import java.util.Arrays;

/**
 * Outlier counting over a reservoir sample. The counts are found in the sample and scaled by
 * {@code population / sampleSize}, so on a complete sample they are exact.
 */
public class OutlierDetector {
    /** Multiplier of the interquartile range for the Tukey fences. */
    public static final double IQR_MULTIPLIER = 1.5;
    public static final double Z_SCORE_THRESHOLD = 3.0;
    public static final double MODIFIED_Z_SCORE_THRESHOLD = 3.5;
    /** The 0.75 quantile of the standard normal; makes the MAD consistent with the standard deviation. */
    private static final double MAD_SCALE = 0.6745;
    private static final int MIN_SAMPLE = 4;

    private OutlierDetector() {}

    /**
     * @param numeric The column's numeric accumulator.
     * @return The outlier summary.
     */
    public static OutlierSummary detect(final NumericAccumulator numeric) {
        final ReservoirSampler reservoir = numeric.reservoir();
        final MomentAccumulator moments = numeric.moments();
        final double[] sample = reservoir.sortedValues();
        final long population = moments.count();
        final ExtremeValueTracker extremes = numeric.extremes();

        if (sample.length < MIN_SAMPLE) {
            final StatValue missing = StatValue.notComputed("fewer than " + MIN_SAMPLE + " values");
            return new OutlierSummary(missing, missing, 0, 0, 0, sample.length, false, extremes.lowest(),
                    extremes.highest());
        }
        final double scale = (double) population / sample.length;

        final double q1 = P2QuantileEstimator.exactQuantile(sample, 0.25);
        final double q3 = P2QuantileEstimator.exactQuantile(sample, 0.75);
        final double iqr = q3 - q1;
        final double lower = q1 - IQR_MULTIPLIER * iqr;
        final double upper = q3 + IQR_MULTIPLIER * iqr;
        long iqrCount = 0;
        for (final double value : sample) {
            if (value < lower || value > upper) {
                ++iqrCount;
            }
        }

        long zCount = 0;
        final double stdDev = Math.sqrt(moments.sampleVariance());
        if (stdDev > 0) {
            final double mean = moments.mean();
            for (final double value : sample) {
                if (Math.abs(value - mean) / stdDev > Z_SCORE_THRESHOLD) {
                    ++zCount;
                }
            }
        }

        long modifiedCount = 0;
        final double median = P2QuantileEstimator.exactQuantile(sample, 0.5);
        final double[] deviations = new double[sample.length];
        for (int ii = 0; ii < sample.length; ++ii) {
            deviations[ii] = Math.abs(sample[ii] - median);
        }
        Arrays.sort(deviations);
        final double mad = P2QuantileEstimator.exactQuantile(deviations, 0.5);
        if (mad > 0) {
            for (final double value : sample) {
                if (Math.abs(MAD_SCALE * (value - median) / mad) > MODIFIED_Z_SCORE_THRESHOLD) {
                    ++modifiedCount;
                }
            }
        }

        return new OutlierSummary(StatValue.of(lower), StatValue.of(upper), Math.round(iqrCount * scale),
                Math.round(zCount * scale), Math.round(modifiedCount * scale), sample.length,
                !reservoir.isComplete(), extremes.lowest(), extremes.highest());
    }
}
