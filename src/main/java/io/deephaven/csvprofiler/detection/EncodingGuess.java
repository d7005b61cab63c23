package io.deephaven.csvprofiler.detection;

import java.util.Objects;

/**
 * A candidate character set for the input, with how sure the detector is about it.
 */
public final class EncodingGuess {
    private final String encoding;
    private final double confidence;
    private final int bomLength;

    public EncodingGuess(String encoding, double confidence, int bomLength) {
        this.encoding = encoding;
        this.confidence = confidence;
        this.bomLength = bomLength;
    }

    public String encoding() {
        return encoding;
    }

    public double confidence() {
        return confidence;
    }

    /** Length of the byte order mark that identified the encoding, or 0. */
    public int bomLength() {
        return bomLength;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EncodingGuess)) {
            return false;
        }
        final EncodingGuess other = (EncodingGuess) o;
        return Double.compare(confidence, other.confidence) == 0 && bomLength == other.bomLength
                && encoding.equals(other.encoding);
    }

    @Override
    public int hashCode() {
        return Objects.hash(encoding, confidence, bomLength);
    }

    @Override
    public String toString() {
        return encoding + "(" + confidence + ")";
    }
}
