package io.deephaven.csvprofiler.stats;

import gnu.trove.list.array.TDoubleArrayList;
import org.apache.commons.math3.stat.descriptive.moment.Variance;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.within;

public class MomentAccumulatorTest {
    @Test
    public void matchesBatchFormulas() {
        final Random random = new Random(42);
        final TDoubleArrayList values = new TDoubleArrayList();
        final MomentAccumulator acc = new MomentAccumulator();
        for (int ii = 0; ii < 10_000; ++ii) {
            final double value = 1e3 + random.nextGaussian() * 3 + (random.nextBoolean() ? random.nextDouble() : 0);
            values.add(value);
            acc.update(value);
        }
        final double[] data = values.toArray();
        final int n = data.length;
        double sum = 0;
        for (final double v : data) {
            sum += v;
        }
        final double mean = sum / n;
        double s2 = 0;
        double s3 = 0;
        double s4 = 0;
        for (final double v : data) {
            final double d = v - mean;
            s2 += d * d;
            s3 += d * d * d;
            s4 += d * d * d * d;
        }
        Assertions.assertThat(acc.count()).isEqualTo(n);
        assertRelative(acc.mean(), mean);
        assertRelative(acc.sampleVariance(), s2 / (n - 1));
        assertRelative(acc.sampleVariance(), new Variance(true).evaluate(data));
        assertRelative(acc.populationVariance(), s2 / n);
        Assertions.assertThat(acc.skewness()).isCloseTo(Math.sqrt(n) * s3 / Math.pow(s2, 1.5), within(1e-6));
        Assertions.assertThat(acc.excessKurtosis()).isCloseTo(n * s4 / (s2 * s2) - 3, within(1e-6));
    }

    @Test
    public void constantValuesHaveZeroVariance() {
        final MomentAccumulator acc = new MomentAccumulator();
        for (int ii = 0; ii < 10; ++ii) {
            acc.update(5);
        }
        Assertions.assertThat(acc.sampleVariance()).isEqualTo(0.0);
        Assertions.assertThat(acc.skewness()).isNaN();
        Assertions.assertThat(acc.excessKurtosis()).isNaN();
        Assertions.assertThat(acc.min()).isEqualTo(5.0);
        Assertions.assertThat(acc.max()).isEqualTo(5.0);
        Assertions.assertThat(acc.sum()).isEqualTo(50.0);
    }

    @Test
    public void degenerateCounts() {
        final MomentAccumulator acc = new MomentAccumulator();
        Assertions.assertThat(acc.populationVariance()).isNaN();
        acc.update(3);
        Assertions.assertThat(acc.mean()).isEqualTo(3.0);
        Assertions.assertThat(acc.sampleVariance()).isNaN();
        acc.update(Double.NaN);
        Assertions.assertThat(acc.count()).isEqualTo(1);
    }

    @Test
    public void mergeEqualsSequential() {
        final Random random = new Random(3);
        final MomentAccumulator all = new MomentAccumulator();
        final MomentAccumulator left = new MomentAccumulator();
        final MomentAccumulator right = new MomentAccumulator();
        for (int ii = 0; ii < 3_000; ++ii) {
            final double value = random.nextDouble() * 50 - 10;
            all.update(value);
            (ii < 1_000 ? left : right).update(value);
        }
        left.merge(right);
        Assertions.assertThat(left.count()).isEqualTo(all.count());
        assertRelative(left.mean(), all.mean());
        assertRelative(left.m2(), all.m2());
        Assertions.assertThat(left.m3()).isCloseTo(all.m3(), within(Math.abs(all.m3()) * 1e-6 + 1e-3));
        assertRelative(left.m4(), all.m4());
        Assertions.assertThat(left.min()).isEqualTo(all.min());
        Assertions.assertThat(left.max()).isEqualTo(all.max());
    }

    @Test
    public void mergeIntoEmpty() {
        final MomentAccumulator empty = new MomentAccumulator();
        final MomentAccumulator other = new MomentAccumulator();
        other.update(1);
        other.update(2);
        empty.merge(other);
        Assertions.assertThat(empty.count()).isEqualTo(2);
        Assertions.assertThat(empty.mean()).isEqualTo(1.5);
        other.merge(new MomentAccumulator());
        Assertions.assertThat(other.count()).isEqualTo(2);
    }

    private static void assertRelative(final double actual, final double expected) {
        Assertions.assertThat(actual).isCloseTo(expected, within(Math.abs(expected) * 1e-9));
    }
}
