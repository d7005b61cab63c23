package io.deephaven.csvprofiler.inference;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Regular-expression checks behind the {@link SemanticHint}s. Some hints also depend on the column name: a
 * five-digit number only counts as a postcode when the column is named like one.
 */
public final class SemanticMatcher {
    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern URL = Pattern.compile("^(https?|ftp)://[^\\s]+$", Pattern.CASE_INSENSITIVE);
    private static final Pattern PHONE = Pattern.compile(
            "^(\\+\\d{1,3}[\\s.-]?)?(\\(\\d{2,4}\\)[\\s.-]?)?\\d{2,4}([\\s.-]\\d{2,4}){1,4}$");
    private static final Pattern CURRENCY = Pattern.compile(
            "^[-+]?([$€£¥]\\s?\\d{1,3}(,?\\d{3})*(\\.\\d+)?"
                    + "|(USD|EUR|GBP|CAD|AUD|JPY|CHF)\\s?\\d[\\d,]*(\\.\\d+)?"
                    + "|\\d[\\d,]*(\\.\\d+)?\\s?(USD|EUR|GBP|CAD|AUD|JPY|CHF))$");
    private static final Pattern PERCENTAGE = Pattern.compile("^[-+]?\\d+(\\.\\d+)?\\s?%$");
    private static final Pattern NUMERIC_POSTCODE = Pattern.compile("^\\d{5}(-\\d{4})?$");
    private static final Pattern ALPHA_POSTCODE = Pattern.compile(
            "^([A-Z]{1,2}\\d[A-Z\\d]?\\s?\\d[A-Z]{2}|[A-Z]\\d[A-Z]\\s?\\d[A-Z]\\d)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern UUID = Pattern.compile(
            "^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$", Pattern.CASE_INSENSITIVE);

    private final boolean postcodeName;
    private final boolean identifierName;

    /**
     * @param columnName The column name, used for name-dependent hints.
     */
    public SemanticMatcher(final String columnName) {
        final String lower = columnName.toLowerCase(Locale.ROOT);
        postcodeName = lower.contains("zip") || lower.contains("postcode") || lower.contains("postal");
        identifierName = hasIdentifierName(columnName);
    }

    /**
     * Whether the column name reads like a key column: {@code id}, {@code customer_id}, {@code orderId},
     * {@code sku_code}, {@code uuid}, and so on.
     */
    public static boolean hasIdentifierName(final String columnName) {
        final String lower = columnName.toLowerCase(Locale.ROOT);
        return lower.equals("id") || lower.endsWith("_id") || lower.endsWith("-id") || lower.endsWith(" id")
                || columnName.endsWith("Id") || columnName.endsWith("ID") || lower.endsWith("_key")
                || lower.endsWith("_code") || lower.contains("uuid");
    }

    public boolean identifierName() {
        return identifierName;
    }

    /**
     * Whether {@code value} is consistent with {@code hint}. {@link SemanticHint#IDENTIFIER} only matches UUIDs
     * here; name-based identifier detection also needs the column's uniqueness, which the caller owns.
     */
    public boolean matches(final SemanticHint hint, final String value) {
        switch (hint) {
            case EMAIL:
                return value.indexOf('@') > 0 && EMAIL.matcher(value).matches();
            case URL:
                return value.indexOf(':') > 0 && URL.matcher(value).matches();
            case PHONE:
                return countDigits(value) >= 7 && PHONE.matcher(value).matches();
            case CURRENCY:
                return CURRENCY.matcher(value).matches();
            case PERCENTAGE:
                return value.endsWith("%") && PERCENTAGE.matcher(value).matches();
            case POSTCODE:
                if (NUMERIC_POSTCODE.matcher(value).matches()) {
                    return postcodeName;
                }
                return ALPHA_POSTCODE.matcher(value).matches();
            case IDENTIFIER:
                return value.length() == 36 && UUID.matcher(value).matches();
            default:
                throw new IllegalStateException("Unexpected hint " + hint);
        }
    }

    private static int countDigits(String value) {
        int count = 0;
        for (int ii = 0; ii < value.length(); ++ii) {
            if (Character.isDigit(value.charAt(ii))) {
                ++count;
            }
        }
        return count;
    }
}
