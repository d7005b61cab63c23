package io.deephaven.csvprofiler.reading;

import io.deephaven.csvprofiler.detection.DialectProfile;
import org.jetbrains.annotations.Nullable;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Reads the data records of a delimited source as {@link RawRow}s, according to a {@link DialectProfile}. The header
 * record (if the dialect has one) is consumed on construction. Blank lines are skipped and counted, as are records that
 * contain bytes the dialect's encoding cannot decode. Records whose field count differs from the header's are flagged
 * ragged but still returned. To read again from the start, open a new RowReader on the same source.
 */
public final class RowReader implements Closeable {
    /** Receives the records the reader skips, and records with undecodable bytes. */
    public interface Listener {
        default void blankLine(long lineNumber) {}

        default void decodeError(long lineNumber, int malformedSequences) {}
    }

    private static final int DECODE_BUFFER_SIZE = 8192;

    private final DialectProfile dialect;
    private final Listener listener;
    private final DecodingReader decoder;
    private final RowGrabber grabber;
    private final List<String> fields = new ArrayList<>();
    private final String[] headers;
    @Nullable
    private RawRow pending;

    private long blankLines;
    private long raggedRows;
    private long decodeErrorRows;

    /**
     * Open {@code source} and position the reader at the first data record.
     *
     * @param source The input.
     * @param dialect How to decode and split the input.
     * @param ignoreSurroundingSpaces Whether to trim spaces and tabs around unquoted values.
     * @param listener Notified of skipped records.
     */
    public RowReader(final ByteSource source, final DialectProfile dialect, final boolean ignoreSurroundingSpaces,
            final Listener listener) throws IOException {
        this.dialect = dialect;
        this.listener = listener;
        final InputStream in = source.open();
        try {
            in.skipNBytes(dialect.bomLength());
        } catch (IOException e) {
            in.close();
            throw e;
        }
        this.decoder = new DecodingReader(in, dialect.charset(), DECODE_BUFFER_SIZE);
        this.grabber = new RowGrabber(decoder, dialect.delimiter(), dialect.quote(), ignoreSurroundingSpaces);
        this.headers = readHeaders();
    }

    private String[] readHeaders() throws IOException {
        while (grabber.grabRow(fields)) {
            if (isBlank()) {
                ++blankLines;
                listener.blankLine(grabber.recordStartLine());
                continue;
            }
            final int malformed = decoder.takeErrorsBefore(grabber.recordEndOffset());
            if (malformed > 0) {
                ++decodeErrorRows;
                listener.decodeError(grabber.recordStartLine(), malformed);
            }
            if (dialect.hasHeaderRow()) {
                // An undecodable header still names the columns; its bad bytes show as replacement characters.
                return ReaderUtil.normalizeHeaders(fields);
            }
            final String[] names = ReaderUtil.makeSyntheticHeaders(fields.size());
            if (malformed == 0) {
                pending = new RawRow(fields.toArray(new String[0]), grabber.recordStartLine(), false);
            }
            return names;
        }
        return new String[0];
    }

    /** The column names, from the header record or synthesized as {@code Column1..N}. Empty for empty input. */
    public List<String> headers() {
        return Collections.unmodifiableList(Arrays.asList(headers));
    }

    public int columnCount() {
        return headers.length;
    }

    /**
     * @return The next data record, or null at end of input.
     */
    @Nullable
    public RawRow next() throws IOException {
        if (pending != null) {
            final RawRow result = pending;
            pending = null;
            return result;
        }
        while (grabber.grabRow(fields)) {
            final long line = grabber.recordStartLine();
            if (isBlank()) {
                ++blankLines;
                listener.blankLine(line);
                continue;
            }
            final int malformed = decoder.takeErrorsBefore(grabber.recordEndOffset());
            if (malformed > 0) {
                ++decodeErrorRows;
                listener.decodeError(line, malformed);
                continue;
            }
            final boolean ragged = fields.size() != headers.length;
            if (ragged) {
                ++raggedRows;
            }
            return new RawRow(fields.toArray(new String[0]), line, ragged);
        }
        return null;
    }

    public long blankLines() {
        return blankLines;
    }

    public long raggedRows() {
        return raggedRows;
    }

    /** Records with undecodable bytes. Data records among them were skipped; a header record is kept. */
    public long decodeErrorRows() {
        return decodeErrorRows;
    }

    /** Bytes read from the source so far, including any byte order mark. */
    public long bytesRead() {
        return dialect.bomLength() + decoder.bytesConsumed();
    }

    private boolean isBlank() {
        return fields.size() == 1 && fields.get(0).isEmpty() && !grabber.recordQuoted();
    }

    @Override
    public void close() throws IOException {
        decoder.close();
    }
}
