package io.deephaven.csvprofiler.stats;

import io.deephaven.csvprofiler.profile.NumericSummary;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.within;

public class NumericAccumulatorTest {
    private static NumericAccumulator accumulator() {
        return new NumericAccumulator(Arrays.asList(0.25, 0.5, 0.75), 100, 2, 42);
    }

    @Test
    public void tenFives() {
        final NumericAccumulator numeric = accumulator();
        for (int ii = 0; ii < 10; ++ii) {
            numeric.update(5, ii + 2);
        }
        final NumericSummary summary = numeric.summary();
        Assertions.assertThat(summary.variance().value()).isEqualTo(0.0);
        Assertions.assertThat(summary.standardDeviation().value()).isEqualTo(0.0);
        Assertions.assertThat(summary.skewness().isComputed()).isFalse();
        Assertions.assertThat(summary.skewness().reason()).isEqualTo("zero variance");
        Assertions.assertThat(summary.excessKurtosis().isComputed()).isFalse();
        Assertions.assertThat(summary.quantile(0.5).value()).isEqualTo(5.0);
    }

    @Test
    public void noValues() {
        final NumericSummary summary = accumulator().summary();
        Assertions.assertThat(summary.count()).isZero();
        Assertions.assertThat(summary.mean().reason()).isEqualTo("no numeric values");
        Assertions.assertThat(summary.variance().reason()).isEqualTo("fewer than 2 values");
        Assertions.assertThat(summary.quantile(0.5).isComputed()).isFalse();
    }

    @Test
    public void singleValue() {
        final NumericAccumulator numeric = accumulator();
        numeric.update(42, 2);
        final NumericSummary summary = numeric.summary();
        Assertions.assertThat(summary.mean().value()).isEqualTo(42.0);
        Assertions.assertThat(summary.min().value()).isEqualTo(42.0);
        Assertions.assertThat(summary.variance().isComputed()).isFalse();
        Assertions.assertThat(summary.skewness().reason()).isEqualTo("fewer than 3 values");
        Assertions.assertThat(summary.excessKurtosis().reason()).isEqualTo("fewer than 4 values");
    }

    @Test
    public void smallSampleQuantilesAreExact() {
        final NumericAccumulator numeric = accumulator();
        for (final double value : new double[] {1000, 1200, 1300, 1400, 1500}) {
            numeric.update(value, 2);
        }
        final NumericSummary summary = numeric.summary();
        Assertions.assertThat(summary.quantilesExact()).isTrue();
        Assertions.assertThat(summary.quantile(0.5).value()).isEqualTo(1300.0);
        Assertions.assertThat(summary.quantile(0.25).value()).isEqualTo(1200.0);
        Assertions.assertThat(summary.quantiles()).containsOnlyKeys(0.25, 0.5, 0.75);
        Assertions.assertThat(summary.sum()).isEqualTo(6400.0);
        Assertions.assertThat(summary.mean().value()).isCloseTo(1280.0, within(1e-9));
    }

    @Test
    public void nonFiniteValuesAreSkipped() {
        final NumericAccumulator numeric = accumulator();
        numeric.update(Double.NaN, 2);
        numeric.update(1, 3);
        Assertions.assertThat(numeric.count()).isEqualTo(1);
        Assertions.assertThat(numeric.reservoir().size()).isEqualTo(1);
    }
}
