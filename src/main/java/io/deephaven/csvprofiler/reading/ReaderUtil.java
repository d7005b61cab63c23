package io.deephaven.csvprofiler.reading;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class ReaderUtil {
    private ReaderUtil() {}

    public static String[] makeSyntheticHeaders(int numHeaders) {
        final String[] result = new String[numHeaders];
        for (int ii = 0; ii < result.length; ++ii) {
            result[ii] = "Column" + (ii + 1);
        }
        return result;
    }

    /**
     * Turn a header record into usable column names: blank names become {@code ColumnN} (1-based position) and a name
     * that repeats an earlier one gets a {@code _2}, {@code _3}... suffix.
     *
     * @param raw The header fields as parsed.
     * @return The column names, one per field.
     */
    public static String[] normalizeHeaders(final List<String> raw) {
        final String[] result = new String[raw.size()];
        final Set<String> seen = new HashSet<>();
        for (int ii = 0; ii < result.length; ++ii) {
            String name = raw.get(ii).trim();
            if (name.isEmpty()) {
                name = "Column" + (ii + 1);
            }
            String candidate = name;
            for (int suffix = 2; !seen.add(candidate); ++suffix) {
                candidate = name + "_" + suffix;
            }
            result[ii] = candidate;
        }
        return result;
    }

    /**
     * Calculate the expected length of a UTF-8 sequence, given its first byte.
     *
     * @param firstByte The first byte of the sequence.
     * @return The length of the sequence, in the range 1..4 inclusive, or -1 if {@code firstByte} cannot start a
     *         sequence.
     */
    public static int utf8SequenceLength(byte firstByte) {
        if ((firstByte & 0x80) == 0) {
            // 0xxxxxxx
            return 1;
        }
        if ((firstByte & 0xE0) == 0xC0) {
            // 110xxxxx; C0 and C1 would be overlong encodings of ASCII.
            return (firstByte & 0xFF) < 0xC2 ? -1 : 2;
        }
        if ((firstByte & 0xF0) == 0xE0) {
            // 1110xxxx
            return 3;
        }
        if ((firstByte & 0xF8) == 0xF0) {
            // 11110xxx; F5 and up would encode code points above U+10FFFF.
            return (firstByte & 0xFF) > 0xF4 ? -1 : 4;
        }
        return -1;
    }

    /** Whether {@code b} is a UTF-8 continuation byte (10xxxxxx). */
    public static boolean isUtf8Continuation(byte b) {
        return (b & 0xC0) == 0x80;
    }
}
