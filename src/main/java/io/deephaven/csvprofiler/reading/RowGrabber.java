package io.deephaven.csvprofiler.reading;

import io.deephaven.csvprofiler.containers.CharSlice;
import io.deephaven.csvprofiler.containers.GrowableCharBuffer;

import java.io.IOException;
import java.io.Reader;
import java.util.List;

/**
 * Traverses decoded text, understanding field and line delimiters as well as the CSV quoting convention, and breaks the
 * text into records of fields. The parser is a character-at-a-time state machine:
 *
 * <ul>
 * <li>{@link State#FIELD_START}: at the start of a field. A quote opens a quoted field, a delimiter or line break ends
 * an empty field, anything else starts an unquoted field.</li>
 * <li>{@link State#IN_UNQUOTED_FIELD}: characters are literal until a delimiter or line break.</li>
 * <li>{@link State#IN_QUOTED_FIELD}: everything, including delimiters and line breaks, is literal until a quote.</li>
 * <li>{@link State#QUOTE_IN_QUOTED_FIELD}: a quote was seen inside a quoted field. A second quote is a literal quote;
 * a delimiter or line break ends the field; anything else is kept as text.</li>
 * </ul>
 *
 * The parser is lenient: text after a closing quote is kept, and an unterminated quoted field is closed by the end of
 * input. CR, LF and CRLF all end a record.
 */
public final class RowGrabber {
    /** Size of chunks to read from the {@link Reader}. */
    public static final int BUFFER_SIZE = 65536;

    /** Parser states. */
    public enum State {
        FIELD_START, IN_UNQUOTED_FIELD, IN_QUOTED_FIELD, QUOTE_IN_QUOTED_FIELD
    }

    private final Reader reader;
    private final char delimiter;
    /** Whether quoting is in effect at all. */
    private final boolean hasQuote;
    private final char quoteChar;
    /** Whether to trim leading and trailing blanks from non-quoted values. */
    private final boolean ignoreSurroundingSpaces;
    private final char[] buffer;
    /** Size of the last buffer chunk read. */
    private int size;
    /** Current offset in the buffer chunk. */
    private int offset;
    /** The number of characters in all chunks before the current one. */
    private long charsBeforeBuffer;
    /** The field being assembled. */
    private final GrowableCharBuffer field = new GrowableCharBuffer();
    private final CharSlice slice = new CharSlice();
    /** 1-based physical line of the next character. */
    private long physicalLine = 1;
    private boolean atStart = true;

    private long recordStartLine;
    private long recordEndOffset;
    private boolean recordQuoted;

    /**
     * Constructor.
     *
     * @param reader The decoded input.
     * @param delimiter The field delimiter.
     * @param quoteChar The quote character, or null if fields are never quoted.
     * @param ignoreSurroundingSpaces Whether to trim spaces and tabs around unquoted values.
     */
    public RowGrabber(final Reader reader, final char delimiter, final Character quoteChar,
            final boolean ignoreSurroundingSpaces) {
        this.reader = reader;
        this.delimiter = delimiter;
        this.hasQuote = quoteChar != null;
        this.quoteChar = quoteChar == null ? 0 : quoteChar;
        this.ignoreSurroundingSpaces = ignoreSurroundingSpaces;
        this.buffer = new char[BUFFER_SIZE];
    }

    /**
     * Read the next record.
     *
     * @param dest Cleared, then filled with the record's fields.
     * @return false if the input was exhausted before any character of a new record.
     */
    public boolean grabRow(final List<String> dest) throws IOException {
        dest.clear();
        field.clear();
        if (atStart) {
            atStart = false;
            // A byte order mark the detector did not strip decodes to U+FEFF.
            if (tryEnsureMore() && buffer[offset] == '\uFEFF') {
                ++offset;
            }
        }
        if (!tryEnsureMore()) {
            return false;
        }
        recordStartLine = physicalLine;
        recordQuoted = false;
        State state = State.FIELD_START;
        // Size of the field when its closing quote was seen; trimming stops there.
        int quotedLength = -1;
        boolean prevCharWasCarriageReturn = false;

        while (true) {
            if (!tryEnsureMore()) {
                final boolean inQuotes = state == State.IN_QUOTED_FIELD || state == State.QUOTE_IN_QUOTED_FIELD;
                endField(dest, inQuotes ? field.size() : quotedLength);
                recordEndOffset = position();
                return true;
            }
            final char ch = buffer[offset++];
            switch (state) {
                case FIELD_START:
                    if (ignoreSurroundingSpaces && ch != delimiter && CharSlice.isSpaceOrTab(ch)) {
                        break;
                    }
                    if (hasQuote && ch == quoteChar) {
                        state = State.IN_QUOTED_FIELD;
                        recordQuoted = true;
                    } else if (ch == delimiter) {
                        endField(dest, quotedLength);
                    } else if (ch == '\n' || ch == '\r') {
                        consumeLineBreak(ch);
                        endField(dest, quotedLength);
                        recordEndOffset = position();
                        return true;
                    } else {
                        field.append(ch);
                        state = State.IN_UNQUOTED_FIELD;
                    }
                    break;
                case IN_UNQUOTED_FIELD:
                    if (ch == delimiter) {
                        endField(dest, quotedLength);
                        quotedLength = -1;
                        state = State.FIELD_START;
                    } else if (ch == '\n' || ch == '\r') {
                        consumeLineBreak(ch);
                        endField(dest, quotedLength);
                        recordEndOffset = position();
                        return true;
                    } else {
                        field.append(ch);
                    }
                    break;
                case IN_QUOTED_FIELD:
                    if (ch == quoteChar) {
                        state = State.QUOTE_IN_QUOTED_FIELD;
                        break;
                    }
                    // Keep the physical line count correct across embedded line breaks.
                    if (ch == '\r' || (ch == '\n' && !prevCharWasCarriageReturn)) {
                        ++physicalLine;
                    }
                    prevCharWasCarriageReturn = ch == '\r';
                    field.append(ch);
                    break;
                case QUOTE_IN_QUOTED_FIELD:
                    prevCharWasCarriageReturn = false;
                    if (ch == quoteChar) {
                        field.append(ch);
                        state = State.IN_QUOTED_FIELD;
                    } else if (ch == delimiter) {
                        endField(dest, field.size());
                        quotedLength = -1;
                        state = State.FIELD_START;
                    } else if (ch == '\n' || ch == '\r') {
                        consumeLineBreak(ch);
                        endField(dest, field.size());
                        recordEndOffset = position();
                        return true;
                    } else {
                        quotedLength = field.size();
                        field.append(ch);
                        state = State.IN_UNQUOTED_FIELD;
                    }
                    break;
                default:
                    throw new IllegalStateException("Unexpected state " + state);
            }
        }
    }

    /** The 1-based physical line on which the last record started. */
    public long recordStartLine() {
        return recordStartLine;
    }

    /** The offset in the decoded text just past the last record, including its line break. */
    public long recordEndOffset() {
        return recordEndOffset;
    }

    /** Whether the last record contained a quoted field. */
    public boolean recordQuoted() {
        return recordQuoted;
    }

    /** The 1-based physical line of the next unread character. */
    public long physicalLine() {
        return physicalLine;
    }

    /**
     * @param protectedLength Characters of the field that came from inside quotes and must not be trimmed, or -1.
     */
    private void endField(final List<String> dest, final int protectedLength) {
        slice.reset(field.data(), 0, field.size());
        if (ignoreSurroundingSpaces) {
            if (protectedLength < 0) {
                slice.trimSpacesAndTabs();
            } else {
                while (slice.end() > protectedLength && CharSlice.isSpaceOrTab(slice.back())) {
                    slice.setEnd(slice.end() - 1);
                }
            }
        }
        dest.add(slice.toString());
        field.clear();
    }

    private void consumeLineBreak(final char ch) throws IOException {
        if (ch == '\r' && tryEnsureMore() && buffer[offset] == '\n') {
            ++offset;
        }
        ++physicalLine;
    }

    private long position() {
        return charsBeforeBuffer + offset;
    }

    /** @return true if there are more characters. */
    private boolean tryEnsureMore() throws IOException {
        if (offset != size) {
            return true;
        }
        charsBeforeBuffer += size;
        offset = 0;
        final int charsRead = reader.read(buffer, 0, buffer.length);
        size = Math.max(charsRead, 0);
        return size != 0;
    }
}
