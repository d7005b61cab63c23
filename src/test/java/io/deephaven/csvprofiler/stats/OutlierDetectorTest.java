package io.deephaven.csvprofiler.stats;

import io.deephaven.csvprofiler.profile.OutlierSummary;
import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Collections;

public class OutlierDetectorTest {
    private static NumericAccumulator accumulator(final int reservoirCapacity) {
        return new NumericAccumulator(Collections.singletonList(0.5), reservoirCapacity, 3, 42);
    }

    @Test
    public void singleFarValue() {
        final NumericAccumulator numeric = accumulator(100);
        for (int ii = 1; ii <= 20; ++ii) {
            numeric.update(ii, ii + 1);
        }
        numeric.update(1000, 22);
        final OutlierSummary summary = OutlierDetector.detect(numeric);
        Assertions.assertThat(summary.lowerFence().value()).isEqualTo(-9.0);
        Assertions.assertThat(summary.upperFence().value()).isEqualTo(31.0);
        Assertions.assertThat(summary.iqrOutliers()).isEqualTo(1);
        Assertions.assertThat(summary.zScoreOutliers()).isEqualTo(1);
        Assertions.assertThat(summary.modifiedZScoreOutliers()).isEqualTo(1);
        Assertions.assertThat(summary.scaled()).isFalse();
        Assertions.assertThat(summary.sampleSize()).isEqualTo(21);
        Assertions.assertThat(summary.highest().get(0).value()).isEqualTo(1000.0);
        Assertions.assertThat(summary.highest().get(0).lineNumber()).isEqualTo(22);
    }

    @Test
    public void tooFewValues() {
        final NumericAccumulator numeric = accumulator(100);
        numeric.update(1, 2);
        numeric.update(2, 3);
        final OutlierSummary summary = OutlierDetector.detect(numeric);
        Assertions.assertThat(summary.lowerFence().isComputed()).isFalse();
        Assertions.assertThat(summary.lowerFence().reason()).isEqualTo("fewer than 4 values");
        Assertions.assertThat(summary.iqrOutliers()).isZero();
    }

    @Test
    public void constantColumnHasNoOutliers() {
        final NumericAccumulator numeric = accumulator(100);
        for (int ii = 0; ii < 10; ++ii) {
            numeric.update(5, ii + 2);
        }
        final OutlierSummary summary = OutlierDetector.detect(numeric);
        Assertions.assertThat(summary.iqrOutliers()).isZero();
        Assertions.assertThat(summary.zScoreOutliers()).isZero();
        Assertions.assertThat(summary.modifiedZScoreOutliers()).isZero();
    }

    @Test
    public void sampledCountsAreScaled() {
        final NumericAccumulator numeric = accumulator(10);
        for (int ii = 0; ii < 1_000; ++ii) {
            numeric.update(ii, ii + 2);
        }
        final OutlierSummary summary = OutlierDetector.detect(numeric);
        Assertions.assertThat(summary.scaled()).isTrue();
        Assertions.assertThat(summary.sampleSize()).isEqualTo(10);
        // Evenly spread values have no outliers whichever ten are sampled.
        Assertions.assertThat(summary.zScoreOutliers()).isZero();
        Assertions.assertThat(summary.lowest()).hasSize(3);
    }
}
