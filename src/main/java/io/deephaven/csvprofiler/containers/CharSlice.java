package io.deephaven.csvprofiler.containers;

import org.jetbrains.annotations.NotNull;

/**
 * A reusable window onto a {@code char[]}. The row parser hands cells to its caller as CharSlices that share the
 * parser's read buffer whenever possible, so that a cell only turns into a {@link String} when somebody asks.
 */
public final class CharSlice implements CharSequence {
    /** The underlying data. */
    private char[] data;
    /** The index of the first data element. */
    private int begin;
    /** The index that is one past the last data element. */
    private int end;

    /** Makes an empty CharSlice with a null underlying array. */
    public CharSlice() {}

    /**
     * Constructs a CharSlice from the half-open interval [{@code begin}, {@code end}) of the array {@code data}.
     */
    public CharSlice(final char[] data, final int begin, final int end) {
        reset(data, begin, end);
    }

    /**
     * Reset the CharSlice to the half-open interval [{@code begin}, {@code end}) of the array {@code data}.
     */
    public void reset(final char[] data, final int begin, final int end) {
        this.data = data;
        this.begin = begin;
        this.end = end;
    }

    public int begin() {
        return begin;
    }

    public int end() {
        return end;
    }

    public void setBegin(int begin) {
        this.begin = begin;
    }

    public void setEnd(int end) {
        this.end = end;
    }

    /** Gets the first character of the slice. The behavior is unspecified if the slice is empty. */
    public char front() {
        return data[begin];
    }

    /** Gets the last character of the slice. The behavior is unspecified if the slice is empty. */
    public char back() {
        return data[end - 1];
    }

    public char[] data() {
        return data;
    }

    public int size() {
        return end - begin;
    }

    public boolean isEmpty() {
        return begin == end;
    }

    /** Trim spaces and tabs from both ends, in place. */
    public void trimSpacesAndTabs() {
        while (begin != end && isSpaceOrTab(data[begin])) {
            ++begin;
        }
        while (begin != end && isSpaceOrTab(data[end - 1])) {
            --end;
        }
    }

    @Override
    public int length() {
        return size();
    }

    @Override
    public char charAt(int i) {
        final int index = begin + i;
        if (index < begin || index >= end) {
            throw new IndexOutOfBoundsException("Invalid index.");
        }
        return data[index];
    }

    @NotNull
    @Override
    public CharSequence subSequence(final int start, final int end) {
        final int newBegin = begin + start;
        final int newEnd = begin + end;
        if (newBegin < begin || newEnd > this.end || newBegin > newEnd) {
            throw new IndexOutOfBoundsException("Invalid subsequence bounds");
        }
        return new CharSlice(data, newBegin, newEnd);
    }

    @Override
    @NotNull
    public String toString() {
        final int size = size();
        return size == 0 ? "" : new String(data, begin, size);
    }

    public static boolean isSpaceOrTab(char ch) {
        return ch == ' ' || ch == '\t';
    }
}
