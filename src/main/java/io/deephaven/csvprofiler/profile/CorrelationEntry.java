package io.deephaven.csvprofiler.profile;

/**
 * Pearson correlation between two numeric columns, over the rows where both were present.
 */
public final class CorrelationEntry {
    private final int firstIndex;
    private final String firstName;
    private final int secondIndex;
    private final String secondName;
    private final StatValue coefficient;
    private final StatValue pValue;
    private final long pairCount;

    public CorrelationEntry(int firstIndex, String firstName, int secondIndex, String secondName,
            StatValue coefficient, StatValue pValue, long pairCount) {
        this.firstIndex = firstIndex;
        this.firstName = firstName;
        this.secondIndex = secondIndex;
        this.secondName = secondName;
        this.coefficient = coefficient;
        this.pValue = pValue;
        this.pairCount = pairCount;
    }

    public int firstIndex() {
        return firstIndex;
    }

    public String firstName() {
        return firstName;
    }

    public int secondIndex() {
        return secondIndex;
    }

    public String secondName() {
        return secondName;
    }

    public StatValue coefficient() {
        return coefficient;
    }

    /** Two-sided t-test p-value against zero correlation, with {@code pairCount - 2} degrees of freedom. */
    public StatValue pValue() {
        return pValue;
    }

    /** Whether the correlation differs from zero at the 5% level. False when the p-value was not computed. */
    public boolean isSignificant() {
        return pValue.isComputed() && pValue.value() <= 0.05;
    }

    public long pairCount() {
        return pairCount;
    }

    @Override
    public String toString() {
        return firstName + "~" + secondName + ": " + coefficient + " (p=" + pValue + ")";
    }
}
