package io.deephaven.csvprofiler.tokenization;

/**
 * A {@link CustomDoubleParser} that uses {@link Double#parseDouble(String)}. Used when no faster parser is
 * registered. Not actually an 'enum'; this is the usual Java trick for a singleton.
 */
public enum JdkDoubleParser implements CustomDoubleParser {
    /**
     * Singleton instance.
     */
    INSTANCE;

    @Override
    public double parse(char[] chars, int begin, int end) throws NumberFormatException {
        return Double.parseDouble(new String(chars, begin, end - begin));
    }

    @Override
    public double parse(CharSequence cs) throws NumberFormatException {
        return Double.parseDouble(cs.toString());
    }
}
