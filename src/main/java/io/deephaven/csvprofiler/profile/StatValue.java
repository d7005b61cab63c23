package io.deephaven.csvprofiler.profile;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A statistic that is either a finite number or "not computed" with a reason. Degenerate inputs (no values, a single
 * value, zero variance) produce the latter rather than a misleading 0 or NaN.
 */
public final class StatValue {
    private final double value;
    private final String reason;

    private StatValue(double value, String reason) {
        this.value = value;
        this.reason = reason;
    }

    /**
     * A computed statistic. A non-finite {@code value} is reported as not computed.
     */
    public static StatValue of(final double value) {
        if (!Double.isFinite(value)) {
            return notComputed("non-finite result");
        }
        return new StatValue(value, null);
    }

    /**
     * A computed statistic, or not computed with {@code reasonIfUndefined} when {@code value} is NaN or infinite.
     */
    public static StatValue ofOrElse(final double value, final String reasonIfUndefined) {
        return Double.isFinite(value) ? new StatValue(value, null) : notComputed(reasonIfUndefined);
    }

    public static StatValue notComputed(@NotNull final String reason) {
        return new StatValue(Double.NaN, Objects.requireNonNull(reason));
    }

    public boolean isComputed() {
        return reason == null;
    }

    /**
     * @return The value.
     * @throws IllegalStateException if the statistic was not computed.
     */
    public double value() {
        if (reason != null) {
            throw new IllegalStateException("Statistic not computed: " + reason);
        }
        return value;
    }

    public double orElse(final double other) {
        return reason == null ? value : other;
    }

    /** Why the statistic was not computed, or null if it was. */
    public String reason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StatValue)) {
            return false;
        }
        final StatValue other = (StatValue) o;
        return Double.compare(value, other.value) == 0 && Objects.equals(reason, other.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, reason);
    }

    @Override
    public String toString() {
        return reason == null ? Double.toString(value) : "not computed (" + reason + ")";
    }
}
