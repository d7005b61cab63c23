package io.deephaven.csvprofiler.tokenization;

import io.deephaven.csvprofiler.inference.PrimitiveType;

import java.text.ParsePosition;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Classifies cell text into the candidate types of type inference. Each {@code tryParseXXX} method checks the text
 * against its grammar first and reports failure through its return value, so a failed attempt costs a scan and
 * never an exception. Not thread safe: each column owns its own Tokenizer.
 */
public final class Tokenizer {
    private static final List<String> TRUE_LITERALS = Arrays.asList("true", "yes", "y", "t", "on");
    private static final List<String> FALSE_LITERALS = Arrays.asList("false", "no", "n", "f", "off");
    private static final List<String> CURRENCY_CODES = Arrays.asList("USD", "EUR", "GBP", "CAD", "AUD", "JPY", "CHF");

    /**
     * Date formats, tried in order. The first format that consumes the whole cell wins, so the ordering decides
     * ambiguous inputs such as 03/04/2021 (month first).
     */
    private static final List<DateTimeFormatter> DATE_FORMATS = Arrays.asList(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            strict("uuuu/MM/dd"),
            strict("MM/dd/uuuu"),
            strict("dd/MM/uuuu"),
            strict("dd-MM-uuuu"),
            strict("MM-dd-uuuu"),
            strict("uuuu-MM-dd HH:mm:ss"),
            strict("dd.MM.uuuu"),
            strict("MM/dd/uuuu HH:mm"),
            strict("M/d/uuuu"));

    private static final int MIN_DATE_LENGTH = 8;
    private static final int MAX_DATE_LENGTH = 35;

    private final CustomDoubleParser doubleParser;
    /** Scratch space for number text with grouping separators or decorations removed. */
    private char[] scratch = new char[64];

    public Tokenizer(final CustomDoubleParser doubleParser) {
        this.doubleParser = doubleParser;
    }

    /**
     * Run the candidate parsers in priority order (boolean, integer, float, date) and record the first success in
     * {@code dest}. If none succeeds, {@code dest} is marked {@link PrimitiveType#TEXT}.
     *
     * @param cs The cell text, already trimmed and known to be non-null.
     * @param dest The holder to populate.
     * @return The kind recorded in {@code dest}.
     */
    public PrimitiveType classify(final CharSequence cs, final ParsedCell dest) {
        if (tryParseBoolean(cs, dest) || tryParseLong(cs, dest) || tryParseDouble(cs, dest)
                || tryParseDate(cs, dest)) {
            return dest.kind();
        }
        dest.setText();
        return PrimitiveType.TEXT;
    }

    public boolean tryParseBoolean(final CharSequence cs, final ParsedCell dest) {
        final int len = cs.length();
        if (len == 0 || len > 5) {
            return false;
        }
        final String lower = cs.toString().toLowerCase(Locale.ROOT);
        if (TRUE_LITERALS.contains(lower)) {
            dest.setBoolean(true);
            return true;
        }
        if (FALSE_LITERALS.contains(lower)) {
            dest.setBoolean(false);
            return true;
        }
        return false;
    }

    /**
     * Parse an optionally signed integer. Thousands grouping with ',' is accepted when every group after the first has
     * exactly three digits. Values outside the range of a long are rejected (they will parse as floats instead).
     */
    public boolean tryParseLong(final CharSequence cs, final ParsedCell dest) {
        final int len = cs.length();
        int offset = 0;
        boolean negative = false;
        if (len > 0 && (cs.charAt(0) == '+' || cs.charAt(0) == '-')) {
            negative = cs.charAt(0) == '-';
            offset = 1;
        }
        if (offset == len) {
            return false;
        }
        // Accumulate negatively so that Long.MIN_VALUE is representable, as Long.parseLong does.
        final long limit = negative ? Long.MIN_VALUE : -Long.MAX_VALUE;
        final long multmin = limit / 10;
        long result = 0;
        int digitsInGroup = 0;
        boolean sawSeparator = false;
        for (int ii = offset; ii < len; ++ii) {
            final char ch = cs.charAt(ii);
            if (ch == ',') {
                if (digitsInGroup == 0 || (sawSeparator ? digitsInGroup != 3 : digitsInGroup > 3)) {
                    return false;
                }
                sawSeparator = true;
                digitsInGroup = 0;
                continue;
            }
            if (ch < '0' || ch > '9') {
                return false;
            }
            final int digit = ch - '0';
            if (result < multmin) {
                return false;
            }
            result *= 10;
            if (result < limit + digit) {
                return false;
            }
            result -= digit;
            ++digitsInGroup;
        }
        if (digitsInGroup == 0 || (sawSeparator && digitsInGroup != 3)) {
            return false;
        }
        dest.setLong(negative ? result : -result);
        return true;
    }

    /**
     * Parse a decimal or scientific number: {@code [+-]digits[.digits][(e|E)[+-]digits]}, where either the integer or
     * the fraction part may be empty but not both. Grouping separators follow the {@link #tryParseLong} rules.
     * Non-finite results are rejected.
     */
    public boolean tryParseDouble(final CharSequence cs, final ParsedCell dest) {
        final int length = copyNumberGrammar(cs, 0, cs.length());
        if (length < 0) {
            return false;
        }
        final double value = doubleParser.parse(scratch, 0, length);
        if (!Double.isFinite(value)) {
            return false;
        }
        dest.setDouble(value);
        return true;
    }

    /**
     * Parse a number wrapped in currency or percentage decoration, e.g. {@code $1,234.50}, {@code -€12},
     * {@code 12.5%}, {@code 1200 USD}. The decoration is dropped and the number kept as written (12.5% is 12.5).
     */
    public boolean tryParseDecoratedNumber(final CharSequence cs, final ParsedCell dest) {
        int begin = 0;
        int end = cs.length();
        boolean negative = false;
        if (begin < end && (cs.charAt(begin) == '-' || cs.charAt(begin) == '+')) {
            negative = cs.charAt(begin) == '-';
            ++begin;
        }
        boolean decorated = false;
        if (begin < end && isCurrencySymbol(cs.charAt(begin))) {
            ++begin;
            decorated = true;
        } else if (end - begin > 3 && CURRENCY_CODES.contains(cs.subSequence(begin, begin + 3).toString())) {
            begin += 3;
            decorated = true;
        }
        if (!decorated && end > begin && cs.charAt(end - 1) == '%') {
            --end;
            decorated = true;
        } else if (!decorated && end - begin > 3
                && CURRENCY_CODES.contains(cs.subSequence(end - 3, end).toString())) {
            end -= 3;
            decorated = true;
        }
        if (!decorated) {
            return false;
        }
        while (begin < end && cs.charAt(begin) == ' ') {
            ++begin;
        }
        while (end > begin && cs.charAt(end - 1) == ' ') {
            --end;
        }
        if (begin < end && (cs.charAt(begin) == '-' || cs.charAt(begin) == '+')) {
            if (negative) {
                return false;
            }
            negative = cs.charAt(begin) == '-';
            ++begin;
        }
        final int length = copyNumberGrammar(cs, begin, end);
        if (length < 0) {
            return false;
        }
        final double value = doubleParser.parse(scratch, 0, length);
        if (!Double.isFinite(value)) {
            return false;
        }
        dest.setDouble(negative ? -value : value);
        return true;
    }

    /**
     * Parse a calendar date (optionally followed by a time of day) using the first matching format. Only the date part
     * is kept. Uses unresolved parsing plus explicit range checks so that a non-matching format costs no exception.
     */
    public boolean tryParseDate(final CharSequence cs, final ParsedCell dest) {
        final int len = cs.length();
        if (len < MIN_DATE_LENGTH || len > MAX_DATE_LENGTH || !isDigit(cs.charAt(0))) {
            return false;
        }
        for (final DateTimeFormatter formatter : DATE_FORMATS) {
            final ParsePosition position = new ParsePosition(0);
            final TemporalAccessor parsed = formatter.parseUnresolved(cs, position);
            if (parsed == null || position.getErrorIndex() >= 0 || position.getIndex() != len) {
                continue;
            }
            if (!parsed.isSupported(ChronoField.YEAR) || !parsed.isSupported(ChronoField.MONTH_OF_YEAR)
                    || !parsed.isSupported(ChronoField.DAY_OF_MONTH)) {
                continue;
            }
            final long year = parsed.getLong(ChronoField.YEAR);
            final long month = parsed.getLong(ChronoField.MONTH_OF_YEAR);
            final long day = parsed.getLong(ChronoField.DAY_OF_MONTH);
            if (year < 1 || year > 9999 || month < 1 || month > 12 || day < 1
                    || day > YearMonth.of((int) year, (int) month).lengthOfMonth()) {
                continue;
            }
            if (!inRange(parsed, ChronoField.HOUR_OF_DAY, 23) || !inRange(parsed, ChronoField.MINUTE_OF_HOUR, 59)
                    || !inRange(parsed, ChronoField.SECOND_OF_MINUTE, 59)) {
                continue;
            }
            dest.setEpochDay(LocalDate.of((int) year, (int) month, (int) day).toEpochDay());
            return true;
        }
        return false;
    }

    /**
     * Validate the number grammar over [{@code begin}, {@code end}) of {@code cs} and copy it, minus grouping
     * separators, into {@link #scratch}.
     *
     * @return The number of characters copied, or -1 if the text is not a number.
     */
    private int copyNumberGrammar(final CharSequence cs, final int begin, final int end) {
        if (begin == end) {
            return -1;
        }
        ensureScratch(end - begin);
        int ii = begin;
        int out = 0;
        if (cs.charAt(ii) == '+' || cs.charAt(ii) == '-') {
            scratch[out++] = cs.charAt(ii++);
        }
        int intDigits = 0;
        int digitsInGroup = 0;
        boolean sawSeparator = false;
        while (ii < end) {
            final char ch = cs.charAt(ii);
            if (ch == ',') {
                if (digitsInGroup == 0 || (sawSeparator ? digitsInGroup != 3 : digitsInGroup > 3)) {
                    return -1;
                }
                sawSeparator = true;
                digitsInGroup = 0;
                ++ii;
                continue;
            }
            if (!isDigit(ch)) {
                break;
            }
            scratch[out++] = ch;
            ++intDigits;
            ++digitsInGroup;
            ++ii;
        }
        if (sawSeparator && digitsInGroup != 3) {
            return -1;
        }
        int fracDigits = 0;
        if (ii < end && cs.charAt(ii) == '.') {
            scratch[out++] = '.';
            ++ii;
            while (ii < end && isDigit(cs.charAt(ii))) {
                scratch[out++] = cs.charAt(ii++);
                ++fracDigits;
            }
        }
        if (intDigits + fracDigits == 0) {
            return -1;
        }
        if (ii < end && (cs.charAt(ii) == 'e' || cs.charAt(ii) == 'E')) {
            scratch[out++] = cs.charAt(ii++);
            if (ii < end && (cs.charAt(ii) == '+' || cs.charAt(ii) == '-')) {
                scratch[out++] = cs.charAt(ii++);
            }
            int expDigits = 0;
            while (ii < end && isDigit(cs.charAt(ii))) {
                scratch[out++] = cs.charAt(ii++);
                ++expDigits;
            }
            if (expDigits == 0) {
                return -1;
            }
        }
        return ii == end ? out : -1;
    }

    private void ensureScratch(int size) {
        if (scratch.length < size) {
            scratch = new char[Math.max(size, scratch.length * 2)];
        }
    }

    private static boolean inRange(TemporalAccessor parsed, ChronoField field, long max) {
        if (!parsed.isSupported(field)) {
            return true;
        }
        final long value = parsed.getLong(field);
        return value >= 0 && value <= max;
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isCurrencySymbol(char ch) {
        return ch == '$' || ch == '€' || ch == '£' || ch == '¥';
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }
}
