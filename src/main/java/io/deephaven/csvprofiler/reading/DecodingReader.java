package io.deephaven.csvprofiler.reading;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.util.ArrayDeque;
import java.util.Objects;

/**
 * A Reader that decodes an InputStream with a CharsetDecoder, streaming, without loading the content into memory.
 * Unlike {@link java.io.InputStreamReader} it tolerates malformed input: each malformed or unmappable byte sequence
 * becomes one U+FFFD character, and the position of that character in the decoded text is remembered so the row parser
 * can tell which record it landed in.
 */
public final class DecodingReader extends Reader {
    public static final char REPLACEMENT = '\uFFFD';
    static final int MIN_BUFFER_SIZE = 16;

    private final InputStream source;
    private final CharsetDecoder decoder;
    private final ByteBuffer input;
    /** Decoded-text offsets of substituted characters not yet claimed by {@link #takeErrorsBefore}. */
    private final ArrayDeque<Long> errorOffsets = new ArrayDeque<>();

    private long charsProduced = 0;
    private long bytesConsumed = 0;
    private long errorCount = 0;
    private boolean eof = false;
    private boolean flushed = false;

    public DecodingReader(final InputStream source, final Charset charset, final int bufferSize) {
        if (bufferSize < MIN_BUFFER_SIZE) {
            throw new IllegalArgumentException(
                    String.format("Must have a buffer of at least %d bytes to hold a complete character",
                            MIN_BUFFER_SIZE));
        }
        this.source = Objects.requireNonNull(source);
        decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        input = ByteBuffer.allocate(bufferSize);
        input.flip();
    }

    @Override
    public int read(final char[] cbuf, final int off, final int len) throws IOException {
        Objects.checkFromIndexSize(off, len, cbuf.length);
        if (len == 0) {
            return 0;
        }
        final CharBuffer out = CharBuffer.wrap(cbuf, off, len);
        while (out.position() == off && !flushed) {
            decodeInto(out, off);
        }
        final int produced = out.position() - off;
        if (produced == 0) {
            return -1;
        }
        charsProduced += produced;
        return produced;
    }

    private void decodeInto(final CharBuffer out, final int off) throws IOException {
        while (out.hasRemaining()) {
            final CoderResult result = decoder.decode(input, out, eof);
            if (result.isError()) {
                if (!out.hasRemaining()) {
                    return;
                }
                input.position(input.position() + result.length());
                errorOffsets.addLast(charsProduced + out.position() - off);
                ++errorCount;
                out.put(REPLACEMENT);
                continue;
            }
            if (result.isOverflow()) {
                return;
            }
            // Underflow: the decoder needs more input.
            if (eof) {
                if (decoder.flush(out).isOverflow()) {
                    return;
                }
                flushed = true;
                return;
            }
            input.compact();
            final int n = source.read(input.array(), input.position(), input.remaining());
            if (n < 0) {
                eof = true;
            } else {
                input.position(input.position() + n);
                bytesConsumed += n;
            }
            input.flip();
        }
    }

    /**
     * Remove and count the substitutions that fall before {@code offset} in the decoded text.
     *
     * @param offset An offset into the decoded text.
     * @return The number of substituted characters before it.
     */
    public int takeErrorsBefore(final long offset) {
        int count = 0;
        while (!errorOffsets.isEmpty() && errorOffsets.peekFirst() < offset) {
            errorOffsets.removeFirst();
            ++count;
        }
        return count;
    }

    /** The total number of malformed or unmappable sequences seen so far. */
    public long errorCount() {
        return errorCount;
    }

    /** The number of bytes read from the underlying stream so far. */
    public long bytesConsumed() {
        return bytesConsumed;
    }

    @Override
    public void close() throws IOException {
        source.close();
    }
}
