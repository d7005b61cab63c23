package io.deephaven.csvprofiler.detection;

import org.assertj.core.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class EncodingDetectorTest {
    private static List<EncodingGuess> detect(final byte[] bytes) {
        return EncodingDetector.detect(bytes, bytes.length);
    }

    @Test
    public void asciiIsUtf8() {
        final List<EncodingGuess> guesses = detect("a,b\n1,2\n".getBytes(StandardCharsets.US_ASCII));
        Assertions.assertThat(guesses.get(0).encoding()).isEqualTo("UTF-8");
        Assertions.assertThat(guesses.get(0).confidence()).isEqualTo(0.95);
        Assertions.assertThat(guesses).hasSize(3);
    }

    @Test
    public void utf8WithAccents() {
        final List<EncodingGuess> guesses = detect("name\ncafé\nnaïve\n".getBytes(StandardCharsets.UTF_8));
        Assertions.assertThat(guesses.get(0).encoding()).isEqualTo("UTF-8");
        Assertions.assertThat(guesses.get(0).confidence()).isGreaterThanOrEqualTo(0.85);
    }

    @Test
    public void byteOrderMarks() {
        final byte[] utf8 = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'a', '\n'};
        Assertions.assertThat(detect(utf8)).containsExactly(new EncodingGuess("UTF-8", 1.0, 3));
        final byte[] utf16le = {(byte) 0xFF, (byte) 0xFE, 'a', 0};
        Assertions.assertThat(detect(utf16le)).containsExactly(new EncodingGuess("UTF-16LE", 1.0, 2));
        final byte[] utf16be = {(byte) 0xFE, (byte) 0xFF, 0, 'a'};
        Assertions.assertThat(detect(utf16be)).containsExactly(new EncodingGuess("UTF-16BE", 1.0, 2));
    }

    @Test
    public void legacySingleByte() {
        final byte[] bytes = "name\ncafé\nnaïve\n".getBytes(Charset.forName("windows-1252"));
        final List<EncodingGuess> guesses = detect(bytes);
        Assertions.assertThat(guesses.get(0).encoding()).isEqualTo("windows-1252");
        Assertions.assertThat(guesses.get(0).confidence()).isLessThanOrEqualTo(0.6);
        Assertions.assertThat(guesses).extracting(EncodingGuess::encoding).contains("UTF-8", "ISO-8859-1");
        Assertions.assertThat(guesses.get(guesses.size() - 1).encoding()).isEqualTo("UTF-8");
    }

    @Test
    public void utf16WithoutBom() {
        final byte[] le = "id,name\n1,alpha\n2,beta\n".getBytes(StandardCharsets.UTF_16LE);
        Assertions.assertThat(detect(le).get(0).encoding()).isEqualTo("UTF-16LE");
        final byte[] be = "id,name\n1,alpha\n2,beta\n".getBytes(StandardCharsets.UTF_16BE);
        Assertions.assertThat(detect(be).get(0).encoding()).isEqualTo("UTF-16BE");
    }

    @Test
    public void emptyInput() {
        Assertions.assertThat(detect(new byte[0])).containsExactly(new EncodingGuess("UTF-8", 0.5, 0));
    }

    @Test
    public void strictUtf8Validation() {
        // Overlong encoding of '/'.
        Assertions.assertThat(EncodingDetector.isValidUtf8(new byte[] {(byte) 0xC0, (byte) 0xAF}, 2)).isFalse();
        // Encoded surrogate.
        Assertions.assertThat(
                EncodingDetector.isValidUtf8(new byte[] {(byte) 0xED, (byte) 0xA0, (byte) 0x80}, 3)).isFalse();
        // A sequence cut off at the end of the sample.
        Assertions.assertThat(EncodingDetector.isValidUtf8(new byte[] {'a', (byte) 0xE2, (byte) 0x82}, 3)).isTrue();
        Assertions.assertThat(EncodingDetector.isValidUtf8(new byte[] {(byte) 0xE2, 'a', 'b'}, 3)).isFalse();
    }
}
