package io.deephaven.csvprofiler.inference;

/**
 * The inferred type of a column. The declaration order is the specificity order used to break ties between equally
 * voted types: an earlier constant beats a later one.
 */
public enum PrimitiveType {
    /**
     * Boolean literals such as true/false or yes/no.
     */
    BOOLEAN,
    /**
     * Whole numbers that fit in a long.
     */
    INTEGER,
    /**
     * Decimal or scientific numbers.
     */
    FLOAT,
    /**
     * Calendar dates, with or without a time of day.
     */
    DATE,
    /**
     * Text with few distinct values.
     */
    CATEGORICAL,
    /**
     * Free text.
     */
    TEXT,
    /**
     * No non-null values were seen.
     */
    UNKNOWN;

    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }

    public boolean isTextual() {
        return this == CATEGORICAL || this == TEXT;
    }
}
