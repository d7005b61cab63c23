package io.deephaven.csvprofiler.tokenization;

import ch.randelshofer.fastdoubleparser.JavaDoubleParser;

/**
 * A {@link CustomDoubleParser} backed by FastDoubleParser. Registered as a service in
 * {@code META-INF/services}, so {@link CustomDoubleParser#load()} picks it up whenever the library is present.
 *
 * @see <a href="https://github.com/wrandelshofer/FastDoubleParser">FastDoubleParser</a>
 */
public final class FastCustomDoubleParser implements CustomDoubleParser {
    @Override
    public double parse(char[] chars, int begin, int end) throws NumberFormatException {
        return JavaDoubleParser.parseDouble(chars, begin, end - begin);
    }

    @Override
    public double parse(CharSequence cs) throws NumberFormatException {
        return JavaDoubleParser.parseDouble(cs);
    }
}
