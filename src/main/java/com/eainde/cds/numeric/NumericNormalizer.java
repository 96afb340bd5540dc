package com.eainde.cds.numeric;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw text tokens into counts, decimals and fractions.
 *
 * <p>All methods are null-tolerant and return {@code null} when the token does not
 * resolve. Callers treat {@code null} exactly like a pattern or row that did not match.</p>
 *
 * <pre>
 * parseCount("12,345")     → 12345
 * parseCount("$ 1 200")    → 1200
 * parsePercentage("45")    → 0.45
 * parsePercentage("0.45")  → 0.45
 * parsePercentage("105")   → 1.05   (not clamped)
 * </pre>
 */
public final class NumericNormalizer {

    private static final Pattern SEPARATORS = Pattern.compile("[,\\s]");
    private static final Pattern DIGIT_RUN = Pattern.compile("\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)");

    /** A digit run optionally continued by thousands groups: "12,345", "600". */
    private static final Pattern NUMERIC_TOKEN = Pattern.compile("\\d[\\d,]*");

    /** A whole cell holding one number grouped by spaces: "12 000", "$ 1 200", "120 000". */
    private static final Pattern SPACE_GROUPED = Pattern.compile("\\$?\\s*(\\d{1,3})((?:\\s\\d{3})+)");

    /** "60 ,123" → "60,123". Text extraction splits numbers this way. */
    private static final Pattern SPACE_BEFORE_COMMA = Pattern.compile("(\\d)\\s+,");

    private NumericNormalizer() {}

    /**
     * Strips whitespace and thousands separators, then returns the first run of digits.
     *
     * @return the integer value, or {@code null} when no digits are present or the run
     *         overflows an int
     */
    public static Integer parseCount(String text) {
        if (text == null || text.isBlank()) return null;
        String cleaned = SEPARATORS.matcher(text).replaceAll("");
        Matcher m = DIGIT_RUN.matcher(cleaned);
        if (!m.find()) return null;
        try {
            return Integer.parseInt(m.group());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Strips percent signs and thousands separators and parses what is left as a decimal.
     *
     * @return the value, or {@code null} when the remainder is not a plain decimal number
     */
    public static Double parseDecimal(String text) {
        if (text == null) return null;
        String cleaned = text.strip().replace("%", "").replace(",", "").strip();
        if (cleaned.isEmpty() || !DECIMAL.matcher(cleaned).matches()) return null;
        try {
            return Double.parseDouble(cleaned);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Parses a percentage that may be written as a whole number ("45") or a fraction ("0.45").
     * Values above 1 are divided by 100; values at or below 1 pass through.
     *
     * <p>A genuine sub-1% value written as a raw percentage ("0.5" meaning half a percent)
     * is read as a fraction. Values above 100 come back above 1; range checks belong to the
     * caller.</p>
     */
    public static Double parsePercentage(String text) {
        Double value = parseDecimal(text);
        if (value == null) return null;
        return value > 1 ? value / 100 : value;
    }

    /**
     * Repairs numbers that text extraction split around a thousands separator.
     */
    public static String repairSplitNumbers(String text) {
        if (text == null || text.isEmpty()) return text;
        return SPACE_BEFORE_COMMA.matcher(text).replaceAll("$1,");
    }

    /**
     * Returns every numeric token in the text, in order of appearance, as counts.
     * Tokens that do not resolve (a bare comma run) are skipped.
     */
    public static List<Integer> numericTokens(String text) {
        List<Integer> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) return tokens;
        Matcher m = NUMERIC_TOKEN.matcher(repairSplitNumbers(text));
        while (m.find()) {
            Integer value = parseCount(m.group());
            if (value != null) {
                tokens.add(value);
            }
        }
        return tokens;
    }

    /**
     * Numeric values of one table cell.
     *
     * <p>A cell that is a single space-grouped number ("12 000") yields that one number when
     * the grouping is unambiguous: a leading group shorter than three digits, a currency
     * sign, or a later group starting with 0. Anything else, "600 700" included, yields
     * {@link #numericTokens}.</p>
     */
    public static List<Integer> cellValues(String cell) {
        if (cell == null || cell.isBlank()) return new ArrayList<>();
        String stripped = cell.strip();
        Matcher m = SPACE_GROUPED.matcher(stripped);
        if (m.matches()) {
            boolean grouped = stripped.startsWith("$")
                    || m.group(1).length() < 3
                    || m.group(2).matches(".*\\s0\\d{2}.*");
            Integer value = grouped ? parseCount(stripped) : null;
            if (value != null) {
                List<Integer> values = new ArrayList<>();
                values.add(value);
                return values;
            }
        }
        return numericTokens(cell);
    }
}
