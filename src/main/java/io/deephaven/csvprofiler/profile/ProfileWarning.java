package io.deephaven.csvprofiler.profile;

import org.jetbrains.annotations.Nullable;

/**
 * A non-fatal observation about the input or the run. Warnings are collected on the result, never thrown.
 */
public final class ProfileWarning {
    public enum Severity {
        INFO, WARNING
    }

    private final Severity severity;
    private final String message;
    @Nullable
    private final Integer columnIndex;

    public ProfileWarning(Severity severity, String message, @Nullable Integer columnIndex) {
        this.severity = severity;
        this.message = message;
        this.columnIndex = columnIndex;
    }

    public Severity severity() {
        return severity;
    }

    public String message() {
        return message;
    }

    /** The column the warning concerns, or null for dataset-level warnings. */
    @Nullable
    public Integer columnIndex() {
        return columnIndex;
    }

    @Override
    public String toString() {
        return severity + (columnIndex == null ? "" : "[col " + columnIndex + "]") + ": " + message;
    }
}
