package com.eainde.cds.strategy;

import com.eainde.cds.ingest.DocumentContent;
import com.eainde.cds.model.Percentiles;
import com.eainde.cds.model.Rates;
import com.eainde.cds.numeric.NumericNormalizer;
import com.eainde.cds.scan.PlausibleRange;
import com.eainde.cds.scan.RowMatcher;
import com.eainde.cds.scan.TableRow;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves a field from single text lines: every line the {@link RowMatcher} claims is read
 * on its own, with a value reader tuned to the field.
 *
 * <pre>{@code
 * LineScanStrategy.pair("sat.math", containsAll("sat math"), Pattern.compile("\\b(\\d{3})\\b"),
 *         PlausibleRange.between(500, 800));
 * LineScanStrategy.amount("costs.tuition", containsAll("tuition"), PlausibleRange.open(35_000, 50_000),
 *         Pick.FIRST_LINE);
 * }</pre>
 */
public final class LineScanStrategy<T> implements ExtractionStrategy<T> {

    /** Which claimed line's value is kept when several resolve. */
    public enum Pick { FIRST_LINE, LAST_LINE }

    private static final Pattern DOLLAR_AMOUNT = Pattern.compile("\\$\\s*([\\d,]+)");
    private static final Pattern PERCENT = Pattern.compile("(\\d+\\.?\\d*)\\s*%");

    private final String name;
    private final RowMatcher matcher;
    private final Function<String, Optional<T>> reader;
    private final Pick pick;

    private LineScanStrategy(String name, RowMatcher matcher, Function<String, Optional<T>> reader, Pick pick) {
        this.name = name;
        this.matcher = matcher;
        this.reader = reader;
        this.pick = pick;
    }

    /**
     * Lower and upper bound of the in-range tokens of a line; a line needs at least two.
     * The last qualifying line wins.
     *
     * @param token pattern of one score token, group 1 is the number
     */
    public static LineScanStrategy<Percentiles> pair(String name, RowMatcher matcher, Pattern token,
                                                     PlausibleRange range) {
        return new LineScanStrategy<>(name, matcher, line -> {
            List<Integer> scores = new ArrayList<>();
            Matcher m = token.matcher(line);
            while (m.find()) {
                Integer value = NumericNormalizer.parseCount(m.group(1));
                if (value != null && range.contains(value)) {
                    scores.add(value);
                }
            }
            if (scores.size() < 2) return Optional.empty();
            return Optional.of(Percentiles.of(
                    scores.stream().min(Integer::compare).orElseThrow(),
                    scores.stream().max(Integer::compare).orElseThrow()));
        }, Pick.LAST_LINE);
    }

    /**
     * First {@code $} amount of a line that lies in the range.
     */
    public static LineScanStrategy<Integer> amount(String name, RowMatcher matcher, PlausibleRange range,
                                                   Pick pick) {
        return new LineScanStrategy<>(name, matcher, line -> {
            Matcher m = DOLLAR_AMOUNT.matcher(line);
            while (m.find()) {
                Integer value = NumericNormalizer.parseCount(m.group(1));
                if (value != null && range.contains(value)) {
                    return Optional.of(value);
                }
            }
            return Optional.empty();
        }, pick);
    }

    /**
     * First {@code N%} of a line, read as a rate. The last line with a usable rate wins.
     */
    public static LineScanStrategy<Double> percentage(String name, RowMatcher matcher) {
        return new LineScanStrategy<>(name, matcher, line -> {
            Matcher m = PERCENT.matcher(line);
            if (!m.find()) return Optional.empty();
            Double value = NumericNormalizer.parsePercentage(m.group(1));
            return Rates.isRate(value) ? Optional.of(value) : Optional.empty();
        }, Pick.LAST_LINE);
    }

    @Override
    public Optional<T> attempt(DocumentContent document) {
        Optional<T> found = Optional.empty();
        for (String line : document.lines()) {
            if (!matcher.matches(TableRow.ofLine(line))) continue;
            Optional<T> value = reader.apply(line);
            if (value.isEmpty()) continue;
            if (pick == Pick.FIRST_LINE) return value;
            found = value;
        }
        return found;
    }

    @Override
    public String describe() {
        return "line scan " + name;
    }
}
