package io.deephaven.csvprofiler.detection;

import io.deephaven.csvprofiler.CsvProfilerSpecs;
import io.deephaven.csvprofiler.inference.PrimitiveType;
import io.deephaven.csvprofiler.reading.ByteSource;
import io.deephaven.csvprofiler.reading.RowGrabber;
import io.deephaven.csvprofiler.tokenization.ParsedCell;
import io.deephaven.csvprofiler.tokenization.Tokenizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Detects the {@link DialectProfile} of a delimited file from a bounded prefix: at most
 * {@link CsvProfilerSpecs#detectionMaxBytes()} bytes and {@link CsvProfilerSpecs#detectionMaxLines()} lines. Detection
 * never fails; weak evidence shows up as low confidence. Each operator override in the specs replaces the
 * corresponding step and is reported with confidence 1. The same prefix always yields the same profile.
 */
public final class DialectDetector {
    private static final Logger LOGGER = LogManager.getLogger(DialectDetector.class);

    public static final List<Character> DELIMITER_CANDIDATES = Arrays.asList(',', ';', '\t', '|');
    public static final List<Character> QUOTE_CANDIDATES = Arrays.asList('"', '\'');
    /** Non-blank records examined when scoring delimiters. */
    public static final int DELIMITER_SAMPLE_RECORDS = 20;
    private static final double LOW_CONFIDENCE = 0.5;
    private static final Pattern IDENTIFIER_LIKE = Pattern.compile("[\\p{L}_][\\p{L}\\p{N}_ .#()/-]*");

    private final CsvProfilerSpecs specs;
    private final Tokenizer tokenizer;
    private final ParsedCell parsed = new ParsedCell();

    public DialectDetector(final CsvProfilerSpecs specs) {
        this.specs = specs;
        this.tokenizer = new Tokenizer(specs.customDoubleParser());
    }

    /**
     * Read the prefix of {@code source} and detect its dialect.
     */
    public DetectionResult detect(final ByteSource source) throws IOException {
        final int maxBytes = specs.detectionMaxBytes();
        try (final InputStream in = source.open()) {
            final byte[] prefix = in.readNBytes(maxBytes);
            final boolean complete = prefix.length < maxBytes || in.read() < 0;
            return detect(prefix, complete);
        }
    }

    /**
     * Detect the dialect of a prefix.
     *
     * @param prefix The first bytes of the input.
     * @param complete Whether {@code prefix} is the entire input. If not, its last line may be cut short and is
     *        ignored.
     */
    public DetectionResult detect(final byte[] prefix, final boolean complete) {
        final List<EncodingGuess> encodings = detectEncoding(prefix);
        final EncodingGuess encoding = encodings.get(0);
        final String text = sampleText(prefix, encoding, complete);

        final LineEnding lineEnding = detectLineEnding(text);

        final List<DelimiterScore> delimiters = scoreDelimiters(text);
        final char delimiter;
        final double delimiterConfidence;
        if (specs.delimiter() != null) {
            delimiter = specs.delimiter();
            delimiterConfidence = 1.0;
        } else {
            delimiter = delimiters.get(0).delimiter();
            delimiterConfidence = delimiters.get(0).consistency();
        }

        final Character quote;
        final double quoteConfidence;
        if (specs.quote() != null) {
            quote = specs.quote();
            quoteConfidence = 1.0;
        } else {
            final QuoteChoice choice = detectQuote(text, delimiter);
            quote = choice.quote;
            quoteConfidence = choice.confidence;
        }

        final boolean hasHeaderRow;
        final double headerConfidence;
        if (specs.hasHeaderRow() != null) {
            hasHeaderRow = specs.hasHeaderRow();
            headerConfidence = 1.0;
        } else {
            final List<List<String>> records = splitRecords(text, delimiter, quote, specs.detectionMaxLines());
            final double headerScore = detectHeader(records);
            hasHeaderRow = headerScore > 0;
            headerConfidence = Math.abs(headerScore);
        }

        final DialectProfile profile = DialectProfile.builder()
                .encoding(encoding.encoding())
                .encodingConfidence(encoding.confidence())
                .bomLength(encoding.bomLength())
                .delimiter(delimiter)
                .delimiterConfidence(delimiterConfidence)
                .quote(quote)
                .quoteConfidence(quoteConfidence)
                .lineEnding(lineEnding)
                .hasHeaderRow(hasHeaderRow)
                .headerConfidence(headerConfidence)
                .build();
        LOGGER.debug("Detected {} from {} bytes; encoding candidates {}, delimiter candidates {}", profile,
                prefix.length, encodings, delimiters);
        if (profile.overallConfidence() < LOW_CONFIDENCE) {
            LOGGER.warn("Low confidence dialect detection ({}): {}", profile.overallConfidence(), profile);
        }
        return new DetectionResult(profile, encodings, delimiters);
    }

    private List<EncodingGuess> detectEncoding(final byte[] prefix) {
        final String override = specs.encoding();
        if (override == null) {
            return EncodingDetector.detect(prefix, prefix.length);
        }
        final String canonical = Charset.forName(override).name();
        final EncodingGuess bom = EncodingDetector.detectBom(prefix, prefix.length);
        final int bomLength = bom != null && bom.encoding().equals(canonical) ? bom.bomLength() : 0;
        return Collections.singletonList(new EncodingGuess(canonical, 1.0, bomLength));
    }

    /**
     * Decode the prefix leniently, drop a trailing partial line when the prefix is not the whole input, and keep at
     * most the configured number of lines.
     */
    private String sampleText(final byte[] prefix, final EncodingGuess encoding, final boolean complete) {
        final int bom = Math.min(encoding.bomLength(), prefix.length);
        String text;
        try {
            text = Charset.forName(encoding.encoding()).newDecoder()
                    .onMalformedInput(CodingErrorAction.REPLACE)
                    .onUnmappableCharacter(CodingErrorAction.REPLACE)
                    .decode(ByteBuffer.wrap(prefix, bom, prefix.length - bom))
                    .toString();
        } catch (CharacterCodingException e) {
            // Unreachable with REPLACE actions.
            throw new IllegalStateException(e);
        }
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        if (!complete) {
            final int lastBreak = Math.max(text.lastIndexOf('\n'), text.lastIndexOf('\r'));
            if (lastBreak >= 0) {
                text = text.substring(0, lastBreak + 1);
            }
        }
        int lines = 0;
        for (int ii = 0; ii < text.length(); ++ii) {
            final char ch = text.charAt(ii);
            if (ch == '\n' || (ch == '\r' && (ii + 1 == text.length() || text.charAt(ii + 1) != '\n'))) {
                if (++lines == specs.detectionMaxLines()) {
                    return text.substring(0, ii + 1);
                }
            }
        }
        return text;
    }

    static LineEnding detectLineEnding(final String text) {
        int crlf = 0;
        int lf = 0;
        int cr = 0;
        for (int ii = 0; ii < text.length(); ++ii) {
            final char ch = text.charAt(ii);
            if (ch == '\r') {
                if (ii + 1 < text.length() && text.charAt(ii + 1) == '\n') {
                    ++crlf;
                    ++ii;
                } else {
                    ++cr;
                }
            } else if (ch == '\n') {
                ++lf;
            }
        }
        if (crlf > lf && crlf >= cr) {
            return LineEnding.CRLF;
        }
        if (cr > lf && cr > crlf) {
            return LineEnding.CR;
        }
        return LineEnding.LF;
    }

    /**
     * Score every candidate delimiter, best first. Ties keep the candidate order, so comma wins them.
     */
    private List<DelimiterScore> scoreDelimiters(final String text) {
        final Character splitQuote = specs.quote() != null ? specs.quote() : QUOTE_CANDIDATES.get(0);
        final List<DelimiterScore> scores = new ArrayList<>();
        for (final char candidate : DELIMITER_CANDIDATES) {
            final List<List<String>> records = splitRecords(text, candidate, splitQuote, DELIMITER_SAMPLE_RECORDS);
            scores.add(scoreDelimiter(candidate, records));
        }
        final List<DelimiterScore> ranked = new ArrayList<>(scores);
        ranked.sort((a, b) -> Double.compare(b.score(), a.score()));
        return ranked;
    }

    static DelimiterScore scoreDelimiter(final char candidate, final List<List<String>> records) {
        if (records.isEmpty()) {
            return new DelimiterScore(candidate, 0, 0, 0.3, 0);
        }
        double sum = 0;
        for (final List<String> record : records) {
            sum += record.size();
        }
        final double mean = sum / records.size();
        double squares = 0;
        for (final List<String> record : records) {
            squares += (record.size() - mean) * (record.size() - mean);
        }
        final double variance = squares / records.size();
        double consistency = variance == 0 ? 1.0 : variance < 0.25 ? 0.9 : variance < 1 ? 0.7 : 0.3;
        if (mean < 2) {
            consistency /= 2;
        }
        return new DelimiterScore(candidate, mean, variance, consistency, consistency * Math.log(mean + 1));
    }

    private static final class QuoteChoice {
        @Nullable
        final Character quote;
        final double confidence;

        QuoteChoice(@Nullable Character quote, double confidence) {
            this.quote = quote;
            this.confidence = confidence;
        }
    }

    private static QuoteChoice detectQuote(final String text, final char delimiter) {
        Character best = null;
        int bestScore = 0;
        int bestPaired = 0;
        int totalScore = 0;
        boolean anySeen = false;
        for (final char candidate : QUOTE_CANDIDATES) {
            final int[] evidence = quoteEvidence(text, delimiter, candidate);
            final int score = evidence[0] + 2 * evidence[1];
            totalScore += score;
            anySeen |= evidence[2] > 0;
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
                bestPaired = evidence[0];
            }
        }
        if (best != null) {
            final double share = (double) bestScore / totalScore;
            return new QuoteChoice(best, share * Math.min(1.0, 0.5 + bestPaired / 10.0));
        }
        if (anySeen) {
            return new QuoteChoice(QUOTE_CANDIDATES.get(0), 0.3);
        }
        return new QuoteChoice(null, 0.9);
    }

    /**
     * Look for fields wrapped in {@code quote}.
     *
     * @return {paired fields, paired fields enclosing a delimiter or line break, occurrences of the character}
     */
    static int[] quoteEvidence(final String text, final char delimiter, final char quote) {
        int paired = 0;
        int special = 0;
        int seen = 0;
        boolean fieldStart = true;
        final int n = text.length();
        int ii = 0;
        while (ii < n) {
            final char ch = text.charAt(ii);
            if (ch == quote) {
                ++seen;
            }
            if (fieldStart) {
                if (ch == ' ' || ch == '\t') {
                    ++ii;
                    continue;
                }
                if (ch == quote) {
                    int jj = ii + 1;
                    boolean enclosesSpecial = false;
                    boolean closed = false;
                    while (jj < n) {
                        final char inner = text.charAt(jj);
                        if (inner == quote) {
                            ++seen;
                            if (jj + 1 < n && text.charAt(jj + 1) == quote) {
                                ++seen;
                                jj += 2;
                                continue;
                            }
                            closed = true;
                            break;
                        }
                        if (inner == delimiter || inner == '\n' || inner == '\r') {
                            enclosesSpecial = true;
                        }
                        ++jj;
                    }
                    if (!closed) {
                        break;
                    }
                    int kk = jj + 1;
                    while (kk < n && (text.charAt(kk) == ' ' || text.charAt(kk) == '\t')) {
                        ++kk;
                    }
                    if (kk == n || text.charAt(kk) == delimiter || text.charAt(kk) == '\n'
                            || text.charAt(kk) == '\r') {
                        ++paired;
                        if (enclosesSpecial) {
                            ++special;
                        }
                    }
                    fieldStart = false;
                    ii = jj + 1;
                    continue;
                }
                fieldStart = false;
            }
            if (ch == delimiter || ch == '\n' || ch == '\r') {
                fieldStart = true;
            }
            ++ii;
        }
        return new int[] {paired, special, seen};
    }

    /**
     * Vote on whether the first record is a header. A column votes "header" when its first-row value is non-numeric
     * while most later values are numeric, or when the first-row value looks like an identifier and either differs in
     * type from most later values or never occurs among them. The first record is a header when more than half the
     * columns vote for it.
     *
     * @return A positive confidence for "header", a negative one for "no header".
     */
    private double detectHeader(final List<List<String>> records) {
        if (records.isEmpty()) {
            return -LOW_CONFIDENCE;
        }
        final List<String> first = records.get(0);
        final List<List<String>> rest = records.subList(1, records.size());
        final int columns = first.size();
        int votes = 0;
        for (int col = 0; col < columns; ++col) {
            final String candidate = first.get(col);
            final PrimitiveType candidateClass = typeClass(candidate);
            final Map<PrimitiveType, Integer> classCounts = new EnumMap<>(PrimitiveType.class);
            int nonEmpty = 0;
            boolean repeats = false;
            for (final List<String> record : rest) {
                if (col >= record.size() || record.get(col).isEmpty()) {
                    continue;
                }
                final String value = record.get(col);
                ++nonEmpty;
                classCounts.merge(typeClass(value), 1, Integer::sum);
                repeats |= value.equals(candidate);
            }
            PrimitiveType majority = null;
            int majorityCount = 0;
            for (final Map.Entry<PrimitiveType, Integer> entry : classCounts.entrySet()) {
                if (entry.getValue() > majorityCount) {
                    majority = entry.getKey();
                    majorityCount = entry.getValue();
                }
            }
            final boolean laterNumeric = classCounts.getOrDefault(PrimitiveType.FLOAT, 0) * 2 > nonEmpty;
            if (candidateClass != PrimitiveType.FLOAT && nonEmpty > 0 && laterNumeric) {
                ++votes;
                continue;
            }
            if (IDENTIFIER_LIKE.matcher(candidate).matches()
                    && ((majority != null && majority != candidateClass) || !repeats)) {
                ++votes;
            }
        }
        if (columns == 0) {
            return -LOW_CONFIDENCE;
        }
        final double ratio = (double) votes / columns;
        if (votes * 2 > columns) {
            return ratio;
        }
        return -Math.max(LOW_CONFIDENCE, 1.0 - ratio);
    }

    /** The cell's type with INTEGER folded into FLOAT; UNKNOWN for an empty cell. */
    private PrimitiveType typeClass(final String value) {
        if (value.isEmpty()) {
            return PrimitiveType.UNKNOWN;
        }
        final PrimitiveType kind = tokenizer.classify(value, parsed);
        return kind == PrimitiveType.INTEGER ? PrimitiveType.FLOAT : kind;
    }

    /**
     * Split sample text into non-blank records with the real row parser.
     */
    static List<List<String>> splitRecords(final String text, final char delimiter, @Nullable final Character quote,
            final int maxRecords) {
        final RowGrabber grabber = new RowGrabber(new StringReader(text), delimiter, quote, true);
        final List<List<String>> result = new ArrayList<>();
        final List<String> fields = new ArrayList<>();
        try {
            while (result.size() < maxRecords && grabber.grabRow(fields)) {
                if (fields.size() == 1 && fields.get(0).isEmpty() && !grabber.recordQuoted()) {
                    continue;
                }
                result.add(new ArrayList<>(fields));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return result;
    }
}
