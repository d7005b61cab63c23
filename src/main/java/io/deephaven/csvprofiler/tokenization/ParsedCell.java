package io.deephaven.csvprofiler.tokenization;

import io.deephaven.csvprofiler.inference.PrimitiveType;

/**
 * A reusable holder for the outcome of classifying one cell. Exactly the value field matching {@link #kind()} is
 * meaningful; for {@link PrimitiveType#INTEGER} the {@link #doubleValue()} view is also populated.
 */
public final class ParsedCell {
    private PrimitiveType kind = PrimitiveType.UNKNOWN;
    private boolean booleanValue;
    private long longValue;
    private double doubleValue;
    private long epochDay;

    void setBoolean(boolean value) {
        kind = PrimitiveType.BOOLEAN;
        booleanValue = value;
    }

    void setLong(long value) {
        kind = PrimitiveType.INTEGER;
        longValue = value;
        doubleValue = value;
    }

    void setDouble(double value) {
        kind = PrimitiveType.FLOAT;
        doubleValue = value;
    }

    void setEpochDay(long value) {
        kind = PrimitiveType.DATE;
        epochDay = value;
    }

    void setText() {
        kind = PrimitiveType.TEXT;
    }

    public PrimitiveType kind() {
        return kind;
    }

    public boolean booleanValue() {
        return booleanValue;
    }

    public long longValue() {
        return longValue;
    }

    public double doubleValue() {
        return doubleValue;
    }

    public long epochDay() {
        return epochDay;
    }

    public boolean isNumeric() {
        return kind == PrimitiveType.INTEGER || kind == PrimitiveType.FLOAT;
    }
}
