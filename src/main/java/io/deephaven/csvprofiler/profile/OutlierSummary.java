package io.deephaven.csvprofiler.profile;

import io.deephaven.csvprofiler.stats.ExtremeValueTracker.Extreme;

import java.util.Collections;
import java.util.List;

/**
 * Outlier counts of a numeric column. The IQR, z-score and modified z-score counts are taken from the reservoir sample
 * and scaled to the column's value count; {@link #scaled()} says whether scaling happened (it does not when the
 * reservoir holds every value). The extreme lists are exact.
 */
public final class OutlierSummary {
    private final StatValue lowerFence;
    private final StatValue upperFence;
    private final long iqrOutliers;
    private final long zScoreOutliers;
    private final long modifiedZScoreOutliers;
    private final int sampleSize;
    private final boolean scaled;
    private final List<Extreme> lowest;
    private final List<Extreme> highest;

    public OutlierSummary(StatValue lowerFence, StatValue upperFence, long iqrOutliers, long zScoreOutliers,
            long modifiedZScoreOutliers, int sampleSize, boolean scaled, List<Extreme> lowest, List<Extreme> highest) {
        this.lowerFence = lowerFence;
        this.upperFence = upperFence;
        this.iqrOutliers = iqrOutliers;
        this.zScoreOutliers = zScoreOutliers;
        this.modifiedZScoreOutliers = modifiedZScoreOutliers;
        this.sampleSize = sampleSize;
        this.scaled = scaled;
        this.lowest = Collections.unmodifiableList(lowest);
        this.highest = Collections.unmodifiableList(highest);
    }

    /** Q1 - 1.5 * IQR. */
    public StatValue lowerFence() {
        return lowerFence;
    }

    /** Q3 + 1.5 * IQR. */
    public StatValue upperFence() {
        return upperFence;
    }

    public long iqrOutliers() {
        return iqrOutliers;
    }

    /** Values with |z| > 3. */
    public long zScoreOutliers() {
        return zScoreOutliers;
    }

    /** Values whose MAD-based modified z-score exceeds 3.5 in absolute value. */
    public long modifiedZScoreOutliers() {
        return modifiedZScoreOutliers;
    }

    public int sampleSize() {
        return sampleSize;
    }

    public boolean scaled() {
        return scaled;
    }

    /** The smallest values, ascending, with their line numbers. */
    public List<Extreme> lowest() {
        return lowest;
    }

    /** The largest values, descending, with their line numbers. */
    public List<Extreme> highest() {
        return highest;
    }
}
