package io.deephaven.csvprofiler.detection;

import io.deephaven.csvprofiler.reading.ReaderUtil;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Guesses the character set of a byte prefix. In order: a byte order mark decides outright; a high share of NUL bytes
 * on alternating offsets means UTF-16 without a BOM; a prefix that is valid UTF-8 is UTF-8; otherwise the legacy
 * single-byte encodings are scored by how much printable text they decode to.
 */
public class EncodingDetector {
    public static final String UTF_8 = StandardCharsets.UTF_8.name();
    public static final String UTF_16BE = StandardCharsets.UTF_16BE.name();
    public static final String UTF_16LE = StandardCharsets.UTF_16LE.name();
    /** Legacy encodings in preference order. */
    public static final List<String> LEGACY_ENCODINGS = Arrays.asList("windows-1252", "ISO-8859-1");

    /** Legacy guesses never get more than this; single-byte encodings cannot be told apart with certainty. */
    private static final double LEGACY_MAX_CONFIDENCE = 0.6;
    private static final double INVALID_UTF8_CONFIDENCE = 0.1;
    private static final double NUL_HEAVY_UTF8_CONFIDENCE = 0.3;
    private static final double MIN_NUL_RATIO = 0.2;

    private EncodingDetector() {}

    /**
     * Rank the candidate encodings of {@code sample}, best first. Never empty.
     */
    public static List<EncodingGuess> detect(final byte[] sample, final int length) {
        final List<EncodingGuess> guesses = new ArrayList<>();
        final EncodingGuess bom = detectBom(sample, length);
        if (bom != null) {
            guesses.add(bom);
            return guesses;
        }
        if (length == 0) {
            guesses.add(new EncodingGuess(UTF_8, 0.5, 0));
            return guesses;
        }

        final EncodingGuess utf16 = detectUtf16(sample, length);
        if (utf16 != null) {
            guesses.add(utf16);
        }
        final int nonAscii = countNonAscii(sample, length);
        if (isValidUtf8(sample, length)) {
            final double asciiRatio = 1.0 - (double) nonAscii / length;
            double confidence = asciiRatio > 0.95 ? 0.95 : asciiRatio > 0.8 ? 0.9 : 0.85;
            if (utf16 != null) {
                // NUL is valid UTF-8, but text full of it is not plausible.
                confidence = NUL_HEAVY_UTF8_CONFIDENCE;
            }
            guesses.add(new EncodingGuess(UTF_8, confidence, 0));
        } else {
            guesses.add(new EncodingGuess(UTF_8, INVALID_UTF8_CONFIDENCE, 0));
        }
        for (final String legacy : LEGACY_ENCODINGS) {
            final double printable = printableRatio(sample, length, Charset.forName(legacy));
            guesses.add(new EncodingGuess(legacy, LEGACY_MAX_CONFIDENCE * printable, 0));
        }
        // Stable sort keeps the candidate order among equal confidences.
        guesses.sort(Comparator.comparingDouble(EncodingGuess::confidence).reversed());
        return guesses;
    }

    /**
     * Recognize a UTF-8 or UTF-16 byte order mark.
     *
     * @return The guess the BOM implies, with confidence 1, or null if there is none.
     */
    public static EncodingGuess detectBom(final byte[] sample, final int length) {
        if (length >= 3 && (sample[0] & 0xFF) == 0xEF && (sample[1] & 0xFF) == 0xBB && (sample[2] & 0xFF) == 0xBF) {
            return new EncodingGuess(UTF_8, 1.0, 3);
        }
        if (length >= 2 && (sample[0] & 0xFF) == 0xFE && (sample[1] & 0xFF) == 0xFF) {
            return new EncodingGuess(UTF_16BE, 1.0, 2);
        }
        if (length >= 2 && (sample[0] & 0xFF) == 0xFF && (sample[1] & 0xFF) == 0xFE) {
            return new EncodingGuess(UTF_16LE, 1.0, 2);
        }
        return null;
    }

    private static EncodingGuess detectUtf16(final byte[] sample, final int length) {
        int evenNuls = 0;
        int oddNuls = 0;
        for (int ii = 0; ii < length; ++ii) {
            if (sample[ii] == 0) {
                if ((ii & 1) == 0) {
                    ++evenNuls;
                } else {
                    ++oddNuls;
                }
            }
        }
        final double nulRatio = (double) (evenNuls + oddNuls) / length;
        if (nulRatio < MIN_NUL_RATIO) {
            return null;
        }
        final double confidence = Math.min(0.9, 2 * nulRatio);
        // ASCII text in UTF-16BE has its zero byte first.
        if (evenNuls > 3 * oddNuls) {
            return new EncodingGuess(UTF_16BE, confidence, 0);
        }
        if (oddNuls > 3 * evenNuls) {
            return new EncodingGuess(UTF_16LE, confidence, 0);
        }
        return null;
    }

    /**
     * Strict UTF-8 validation (no overlong forms, no surrogates, nothing above U+10FFFF). A sequence cut off by the end
     * of the sample is tolerated, since the sample boundary can fall anywhere.
     */
    public static boolean isValidUtf8(final byte[] sample, final int length) {
        int ii = 0;
        while (ii < length) {
            final byte first = sample[ii];
            final int seqLength = ReaderUtil.utf8SequenceLength(first);
            if (seqLength < 0) {
                return false;
            }
            for (int jj = 1; jj < seqLength; ++jj) {
                if (ii + jj >= length) {
                    return true;
                }
                final byte next = sample[ii + jj];
                if (!ReaderUtil.isUtf8Continuation(next)) {
                    return false;
                }
                if (jj == 1 && !validSecondByte(first & 0xFF, next & 0xFF)) {
                    return false;
                }
            }
            ii += seqLength;
        }
        return true;
    }

    private static boolean validSecondByte(final int first, final int second) {
        switch (first) {
            case 0xE0:
                return second >= 0xA0;
            case 0xED:
                return second < 0xA0;
            case 0xF0:
                return second >= 0x90;
            case 0xF4:
                return second < 0x90;
            default:
                return true;
        }
    }

    private static int countNonAscii(final byte[] sample, final int length) {
        int count = 0;
        for (int ii = 0; ii < length; ++ii) {
            if (sample[ii] < 0) {
                ++count;
            }
        }
        return count;
    }

    /**
     * The share of decoded characters that are printable (or tab or a line break). 0 if the bytes do not decode.
     */
    static double printableRatio(final byte[] sample, final int length, final Charset charset) {
        final CharBuffer decoded;
        try {
            decoded = charset.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(sample, 0, length));
        } catch (CharacterCodingException e) {
            return 0.0;
        }
        if (!decoded.hasRemaining()) {
            return 0.0;
        }
        int printable = 0;
        final int total = decoded.remaining();
        while (decoded.hasRemaining()) {
            final char ch = decoded.get();
            if (!Character.isISOControl(ch) || ch == '\t' || ch == '\n' || ch == '\r') {
                ++printable;
            }
        }
        return (double) printable / total;
    }
}
