package io.deephaven.csvprofiler.profile;

/**
 * How evenly a column's non-null values spread over its distinct values. Computed from the frequency table, so when
 * the column had more distinct values than the table tracks the figures cover the tracked values only and are marked
 * inexact.
 */
public final class DiversityMetrics {
    private final int categories;
    private final double shannonEntropy;
    private final double giniImpurity;
    private final boolean exact;

    public DiversityMetrics(int categories, double shannonEntropy, double giniImpurity, boolean exact) {
        this.categories = categories;
        this.shannonEntropy = shannonEntropy;
        this.giniImpurity = giniImpurity;
        this.exact = exact;
    }

    /** The number of distinct values the metrics were computed over. */
    public int categories() {
        return categories;
    }

    /** Shannon entropy in bits. */
    public double shannonEntropy() {
        return shannonEntropy;
    }

    /** {@code log2(categories)}, the entropy of a perfectly even spread. */
    public double maxEntropy() {
        return categories <= 1 ? 0.0 : Math.log(categories) / Math.log(2);
    }

    /**
     * Entropy over its maximum, in [0, 1]. Not computed for a single category.
     */
    public StatValue normalizedEntropy() {
        final double max = maxEntropy();
        return max > 0 ? StatValue.of(shannonEntropy / max) : StatValue.notComputed("fewer than 2 categories");
    }

    /** One minus the sum of squared category shares. */
    public double giniImpurity() {
        return giniImpurity;
    }

    public boolean exact() {
        return exact;
    }

    @Override
    public String toString() {
        return String.format("entropy=%.4f bits, gini=%.4f over %d categories%s", shannonEntropy, giniImpurity,
                categories, exact ? "" : " (approximate)");
    }
}
