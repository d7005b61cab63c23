package io.deephaven.csvprofiler.stats;

import io.deephaven.csvprofiler.profile.NumericSummary;
import io.deephaven.csvprofiler.profile.StatValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The numeric state of one column: moments, one P² estimator per quantile target, a reservoir sample and the extreme
 * value tracker. Every finite value goes to all of them.
 */
public final class NumericAccumulator {
    private final MomentAccumulator moments = new MomentAccumulator();
    private final P2QuantileEstimator[] quantiles;
    private final ReservoirSampler reservoir;
    private final ExtremeValueTracker extremes;

    public NumericAccumulator(final List<Double> quantileTargets, final int reservoirCapacity,
            final int extremeValueCapacity, final long seed) {
        this.quantiles = new P2QuantileEstimator[quantileTargets.size()];
        for (int ii = 0; ii < quantiles.length; ++ii) {
            quantiles[ii] = new P2QuantileEstimator(quantileTargets.get(ii));
        }
        this.reservoir = new ReservoirSampler(reservoirCapacity, seed);
        this.extremes = new ExtremeValueTracker(extremeValueCapacity);
    }

    public void update(final double value, final long lineNumber) {
        if (!Double.isFinite(value)) {
            return;
        }
        moments.update(value);
        for (final P2QuantileEstimator estimator : quantiles) {
            estimator.update(value);
        }
        reservoir.offer(value);
        extremes.offer(value, lineNumber);
    }

    public long count() {
        return moments.count();
    }

    public MomentAccumulator moments() {
        return moments;
    }

    public ReservoirSampler reservoir() {
        return reservoir;
    }

    public ExtremeValueTracker extremes() {
        return extremes;
    }

    public NumericSummary summary() {
        final long n = moments.count();
        final StatValue mean;
        final StatValue min;
        final StatValue max;
        if (n == 0) {
            mean = min = max = StatValue.notComputed("no numeric values");
        } else {
            mean = StatValue.of(moments.mean());
            min = StatValue.of(moments.min());
            max = StatValue.of(moments.max());
        }
        final StatValue variance;
        final StatValue stdDev;
        if (n < 2) {
            variance = stdDev = StatValue.notComputed("fewer than 2 values");
        } else {
            variance = StatValue.of(moments.sampleVariance());
            stdDev = StatValue.of(Math.sqrt(moments.sampleVariance()));
        }
        final StatValue skewness = shapeMoment(n, 3, moments.skewness());
        final StatValue kurtosis = shapeMoment(n, 4, moments.excessKurtosis());

        final Map<Double, StatValue> estimates = new LinkedHashMap<>();
        boolean exact = true;
        for (final P2QuantileEstimator estimator : quantiles) {
            estimates.put(estimator.p(), StatValue.ofOrElse(estimator.estimate(), "no numeric values"));
            exact &= estimator.isExact();
        }
        return new NumericSummary(n, moments.sum(), mean, min, max, variance, stdDev, skewness, kurtosis, estimates,
                exact);
    }

    private StatValue shapeMoment(final long n, final int minCount, final double value) {
        if (n < minCount) {
            return StatValue.notComputed("fewer than " + minCount + " values");
        }
        if (!(moments.m2() > 0)) {
            return StatValue.notComputed("zero variance");
        }
        return StatValue.of(value);
    }
}
