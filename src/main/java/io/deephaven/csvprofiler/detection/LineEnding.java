package io.deephaven.csvprofiler.detection;

/**
 * The dominant line terminator of a file. The parser accepts all three regardless; this is informational.
 */
public enum LineEnding {
    LF("\n"), CRLF("\r\n"), CR("\r");

    private final String sequence;

    LineEnding(String sequence) {
        this.sequence = sequence;
    }

    public String sequence() {
        return sequence;
    }
}
