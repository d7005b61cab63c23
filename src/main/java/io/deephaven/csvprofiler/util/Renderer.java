package io.deephaven.csvprofiler.util;

import java.util.Collection;
import java.util.stream.Collectors;

/** Small helpers for building human-readable messages. */
public class Renderer {
    private Renderer() {}

    /**
     * Render the items as a comma-separated list.
     *
     * @param items The items.
     * @return The items joined with ", ".
     */
    public static String renderList(Collection<?> items) {
        return items.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }

    /**
     * Render a value for a message, truncating it and escaping line breaks so one odd cell cannot flood a log line.
     *
     * @param value The value, possibly null.
     * @param maxLength The maximum number of characters to keep.
     * @return The rendered value.
     */
    public static String renderValue(String value, int maxLength) {
        if (value == null) {
            return "(null)";
        }
        String escaped = value.replace("\r", "\\r").replace("\n", "\\n");
        if (escaped.length() > maxLength) {
            escaped = escaped.substring(0, maxLength) + "...";
        }
        return '"' + escaped + '"';
    }
}
