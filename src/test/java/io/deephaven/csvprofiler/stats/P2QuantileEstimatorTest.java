package io.deephaven.csvprofiler.stats;

import gnu.trove.list.array.TDoubleArrayList;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.within;

public class P2QuantileEstimatorTest {
    @Test
    public void medianOfFiveIsExact() {
        final P2QuantileEstimator median = new P2QuantileEstimator(0.5);
        for (final double value : new double[] {1000, 1200, 1300, 1400, 1500}) {
            median.update(value);
        }
        Assertions.assertThat(median.isExact()).isTrue();
        Assertions.assertThat(median.estimate()).isEqualTo(1300.0);
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 0.01, 0.25, 0.5, 0.75, 0.99, 1.0})
    public void smallSamplesMatchSortedArray(final double p) {
        final double[] values = {7, -2, 3.5, 11, 0};
        for (int n = 1; n <= values.length; ++n) {
            final P2QuantileEstimator estimator = new P2QuantileEstimator(p);
            for (int ii = 0; ii < n; ++ii) {
                estimator.update(values[ii]);
            }
            final double[] sorted = Arrays.copyOf(values, n);
            Arrays.sort(sorted);
            // Percentile only accepts quantiles in (0, 100].
            final double expected = p == 0
                    ? sorted[0]
                    : new Percentile().withEstimationType(EstimationType.R_7).evaluate(sorted, p * 100);
            Assertions.assertThat(estimator.estimate()).isCloseTo(expected, within(1e-12));
        }
    }

    @Test
    public void emptyEstimatorHasNoEstimate() {
        final P2QuantileEstimator estimator = new P2QuantileEstimator(0.5);
        Assertions.assertThat(estimator.estimate()).isNaN();
        Assertions.assertThat(estimator.count()).isZero();
    }

    @Test
    public void nonFiniteValuesAreIgnored() {
        final P2QuantileEstimator estimator = new P2QuantileEstimator(0.5);
        estimator.update(Double.NaN);
        estimator.update(Double.POSITIVE_INFINITY);
        estimator.update(4);
        Assertions.assertThat(estimator.count()).isEqualTo(1);
        Assertions.assertThat(estimator.estimate()).isEqualTo(4.0);
    }

    @Test
    public void rejectsOutOfRangeQuantile() {
        Assertions.assertThatThrownBy(() -> new P2QuantileEstimator(1.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.05, 0.25, 0.5, 0.75, 0.95})
    public void largeNormalSampleTracksReference(final double p) {
        final Random random = new Random(12345);
        final TDoubleArrayList values = new TDoubleArrayList();
        final P2QuantileEstimator estimator = new P2QuantileEstimator(p);
        for (int ii = 0; ii < 50_000; ++ii) {
            final double value = 100 + 15 * random.nextGaussian();
            values.add(value);
            estimator.update(value);
        }
        final double reference = new Percentile().withEstimationType(EstimationType.R_7)
                .evaluate(values.toArray(), p * 100);
        // Within one point on a distribution with standard deviation 15.
        Assertions.assertThat(estimator.estimate()).isCloseTo(reference, within(1.0));
        Assertions.assertThat(estimator.isExact()).isFalse();
    }

    @Test
    public void uniformSampleTracksReference() {
        final Random random = new Random(99);
        final TDoubleArrayList values = new TDoubleArrayList();
        final P2QuantileEstimator estimator = new P2QuantileEstimator(0.9);
        for (int ii = 0; ii < 20_000; ++ii) {
            final double value = random.nextDouble() * 1000;
            values.add(value);
            estimator.update(value);
        }
        final double reference = new Percentile().withEstimationType(EstimationType.R_7)
                .evaluate(values.toArray(), 90);
        Assertions.assertThat(estimator.estimate()).isCloseTo(reference, within(10.0));
    }

    @Test
    public void markersStayOrdered() {
        final Random random = new Random(7);
        final P2QuantileEstimator estimator = new P2QuantileEstimator(0.3);
        for (int ii = 0; ii < 5_000; ++ii) {
            // Skewed data stresses the parabolic adjustment.
            estimator.update(Math.exp(random.nextGaussian() * 2));
            if (ii >= 5) {
                final double[] positions = estimator.positions();
                final double[] heights = estimator.heights();
                for (int m = 1; m < positions.length; ++m) {
                    Assertions.assertThat(positions[m]).isGreaterThan(positions[m - 1]);
                    Assertions.assertThat(heights[m]).isGreaterThanOrEqualTo(heights[m - 1]);
                }
                Assertions.assertThat(positions[0]).isEqualTo(1.0);
                Assertions.assertThat(positions[4]).isEqualTo((double) estimator.count());
            }
        }
    }

    @Test
    public void extremeTargetsAreExact() {
        final P2QuantileEstimator min = new P2QuantileEstimator(0.0);
        final P2QuantileEstimator max = new P2QuantileEstimator(1.0);
        for (int ii = 1; ii <= 1000; ++ii) {
            min.update(ii);
            max.update(ii);
        }
        Assertions.assertThat(min.isExact()).isFalse();
        Assertions.assertThat(min.estimate()).isEqualTo(1.0);
        Assertions.assertThat(max.estimate()).isEqualTo(1000.0);
    }
}
