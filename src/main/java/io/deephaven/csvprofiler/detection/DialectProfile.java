package io.deephaven.csvprofiler.detection;

import io.deephaven.csvprofiler.annotations.ProfilerStyle;
import io.deephaven.csvprofiler.util.Renderer;
import org.immutables.value.Value.Check;
import org.immutables.value.Value.Default;
import org.immutables.value.Value.Immutable;
import org.jetbrains.annotations.Nullable;

import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.List;

/**
 * The physical format of a delimited file: how its bytes decode and how its text splits into records and fields.
 * Detected once from a bounded prefix and used unchanged for the whole parse.
 */
@Immutable
@ProfilerStyle
public abstract class DialectProfile {
    /**
     * The Builder for the DialectProfile class.
     */
    public interface Builder {
        /**
         * Copy every attribute of {@code profile}, so that single fields can be replaced.
         */
        Builder from(DialectProfile profile);

        Builder encoding(String encoding);

        Builder encodingConfidence(double confidence);

        /**
         * The number of bytes of byte order mark at the start of the input. The default is 0.
         */
        Builder bomLength(int bomLength);

        Builder delimiter(char delimiter);

        Builder delimiterConfidence(double confidence);

        /**
         * The quote character, or null if the input does not quote fields.
         */
        Builder quote(@Nullable Character quote);

        Builder quoteConfidence(double confidence);

        Builder lineEnding(LineEnding lineEnding);

        Builder hasHeaderRow(boolean hasHeaderRow);

        Builder headerConfidence(double confidence);

        DialectProfile build();
    }

    public static Builder builder() {
        return ImmutableDialectProfile.builder();
    }

    /** The canonical name of the input's character set. */
    public abstract String encoding();

    public abstract double encodingConfidence();

    @Default
    public int bomLength() {
        return 0;
    }

    public abstract char delimiter();

    public abstract double delimiterConfidence();

    @Nullable
    public abstract Character quote();

    public abstract double quoteConfidence();

    @Default
    public LineEnding lineEnding() {
        return LineEnding.LF;
    }

    public abstract boolean hasHeaderRow();

    public abstract double headerConfidence();

    /**
     * @return The {@link Charset} named by {@link #encoding()}.
     */
    public Charset charset() {
        return Charset.forName(encoding());
    }

    /**
     * The lowest of the four detection confidences.
     */
    public double overallConfidence() {
        double result = Math.min(encodingConfidence(), delimiterConfidence());
        result = Math.min(result, headerConfidence());
        return quote() == null ? result : Math.min(result, quoteConfidence());
    }

    @Check
    void check() {
        final List<String> problems = new ArrayList<>();
        if (!isSupportedCharset(encoding())) {
            problems.add(String.format("encoding '%s' is not supported", encoding()));
        }
        checkConfidence("encodingConfidence", encodingConfidence(), problems);
        checkConfidence("delimiterConfidence", delimiterConfidence(), problems);
        checkConfidence("quoteConfidence", quoteConfidence(), problems);
        checkConfidence("headerConfidence", headerConfidence(), problems);
        if (bomLength() < 0 || bomLength() > 4) {
            problems.add(String.format("bomLength is %d, but must be between 0 and 4", bomLength()));
        }
        if (isLineBreak(delimiter())) {
            problems.add("delimiter cannot be a line break");
        }
        final Character quote = quote();
        if (quote != null && (quote == delimiter() || isLineBreak(quote))) {
            problems.add(String.format("quote '%c' conflicts with the delimiter or a line break", quote));
        }
        if (problems.isEmpty()) {
            return;
        }
        throw new IllegalArgumentException(
                "DialectProfile failed validation for the following reasons: " + Renderer.renderList(problems));
    }

    private static boolean isSupportedCharset(final String name) {
        try {
            return Charset.isSupported(name);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static boolean isLineBreak(final char ch) {
        return ch == '\n' || ch == '\r';
    }

    private static void checkConfidence(String what, double value, List<String> problems) {
        if (!(value >= 0 && value <= 1)) {
            problems.add(String.format("%s is %s, but must be in [0, 1]", what, value));
        }
    }
}
