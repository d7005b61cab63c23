package io.deephaven.csvprofiler.tokenization;

import java.util.Iterator;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * A pluggable parser for floating point text. Callers only hand it text that has already passed the
 * {@link Tokenizer}'s grammar check, so a {@link NumberFormatException} here means a genuine disagreement between the
 * grammar and the parser.
 */
public interface CustomDoubleParser {
    /**
     * Loads the first {@link CustomDoubleParser} registered through {@link ServiceLoader}, if any.
     *
     * @return The registered parser, or empty if none is available on the class path.
     */
    static Optional<CustomDoubleParser> load() {
        final Iterator<CustomDoubleParser> it = ServiceLoader.load(CustomDoubleParser.class).iterator();
        if (!it.hasNext()) {
            return Optional.empty();
        }
        return Optional.of(it.next());
    }

    /**
     * Parse the characters in the half-open range [{@code begin}, {@code end}) of {@code chars}.
     *
     * @param chars The character data.
     * @param begin The first character (inclusive).
     * @param end The last character (exclusive).
     * @return The parsed value.
     * @throws NumberFormatException if the text is not a valid double.
     */
    double parse(char[] chars, int begin, int end) throws NumberFormatException;

    /**
     * Parse the character sequence.
     *
     * @param cs The character sequence.
     * @return The parsed value.
     * @throws NumberFormatException if the text is not a valid double.
     */
    double parse(CharSequence cs) throws NumberFormatException;
}
