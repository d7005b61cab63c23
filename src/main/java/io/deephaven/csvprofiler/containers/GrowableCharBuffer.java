package io.deephaven.csvprofiler.containers;

import java.util.Arrays;

/**
 * An append-only char buffer that doubles its capacity as needed. Used as the parser's spill area for cells that
 * cross a read-buffer boundary or whose content differs from the raw input (doubled quotes).
 */
public final class GrowableCharBuffer {
    private static final int INITIAL_CAPACITY = 1024;

    private char[] data = new char[INITIAL_CAPACITY];
    private int size = 0;

    public void append(char[] src, int srcOffset, int length) {
        ensure(size + length);
        System.arraycopy(src, srcOffset, data, size, length);
        size += length;
    }

    public void append(char ch) {
        ensure(size + 1);
        data[size++] = ch;
    }

    public void clear() {
        size = 0;
    }

    public char[] data() {
        return data;
    }

    public int size() {
        return size;
    }

    private void ensure(int required) {
        if (required <= data.length) {
            return;
        }
        int newCapacity = data.length;
        while (newCapacity < required) {
            newCapacity = Math.multiplyExact(newCapacity, 2);
        }
        data = Arrays.copyOf(data, newCapacity);
    }
}
