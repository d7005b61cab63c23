package io.deephaven.csvprofiler.reading;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One parsed record: its raw field strings, the physical line it started on, and whether its field count differs
 * from the header's.
 */
public final class RawRow {
    private final String[] fields;
    private final long lineNumber;
    private final boolean ragged;

    public RawRow(String[] fields, long lineNumber, boolean ragged) {
        this.fields = fields;
        this.lineNumber = lineNumber;
        this.ragged = ragged;
    }

    /** The 1-based physical line number where the record starts. */
    public long lineNumber() {
        return lineNumber;
    }

    public boolean isRagged() {
        return ragged;
    }

    public int fieldCount() {
        return fields.length;
    }

    /**
     * The field at {@code index}, or null when the record is too short to have it.
     */
    @Nullable
    public String field(final int index) {
        return index < fields.length ? fields[index] : null;
    }

    public List<String> fields() {
        return Collections.unmodifiableList(Arrays.asList(fields));
    }

    @Override
    public String toString() {
        return "RawRow{line=" + lineNumber + (ragged ? ", ragged" : "") + ", " + Arrays.toString(fields) + '}';
    }
}
