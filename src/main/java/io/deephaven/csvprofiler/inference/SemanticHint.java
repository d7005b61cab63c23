package io.deephaven.csvprofiler.inference;

/**
 * A semantic reading of a column's values, tracked independently of its {@link PrimitiveType}.
 */
public enum SemanticHint {
    EMAIL,
    URL,
    PHONE,
    CURRENCY,
    PERCENTAGE,
    POSTCODE,
    IDENTIFIER
}
