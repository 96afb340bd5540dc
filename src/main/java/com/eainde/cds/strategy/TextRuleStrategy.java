package com.eainde.cds.strategy;

import com.eainde.cds.ingest.DocumentContent;
import com.eainde.cds.model.Percentiles;
import com.eainde.cds.model.Rates;
import com.eainde.cds.numeric.NumericNormalizer;
import com.eainde.cds.rules.CaptureRole;
import com.eainde.cds.rules.TextRule;
import com.eainde.cds.rules.TextRuleMatcher;
import com.eainde.cds.scan.PlausibleRange;

import java.util.Optional;
import java.util.function.Function;
import java.util.regex.MatchResult;

/**
 * Resolves a field from the document text with a {@link TextRule}.
 *
 * <p>Counts must be positive, percentages must be usable rates and both bounds of a
 * percentile pair must lie in the pair's range. A capture failing its check counts as no
 * match and the rule's next pattern is tried.</p>
 */
public final class TextRuleStrategy<T> implements ExtractionStrategy<T> {

    private final TextRule rule;
    private final Function<MatchResult, T> converter;

    private TextRuleStrategy(TextRule rule, CaptureRole expected, Function<MatchResult, T> converter) {
        if (rule.role() != expected) {
            throw new IllegalArgumentException("Rule for " + rule.field() + " captures "
                    + rule.role() + ", expected " + expected);
        }
        this.rule = rule;
        this.converter = converter;
    }

    public static TextRuleStrategy<Integer> count(TextRule rule) {
        return count(rule, PlausibleRange.above(0));
    }

    public static TextRuleStrategy<Integer> count(TextRule rule, PlausibleRange range) {
        return new TextRuleStrategy<>(rule, CaptureRole.COUNT, m -> {
            Integer value = NumericNormalizer.parseCount(m.group(1));
            return value != null && value > 0 && range.contains(value) ? value : null;
        });
    }

    public static TextRuleStrategy<Double> percentage(TextRule rule) {
        return new TextRuleStrategy<>(rule, CaptureRole.PERCENTAGE, m -> {
            Double value = NumericNormalizer.parsePercentage(m.group(1));
            return Rates.isRate(value) ? value : null;
        });
    }

    public static TextRuleStrategy<Percentiles> pair(TextRule rule, PlausibleRange range) {
        return new TextRuleStrategy<>(rule, CaptureRole.PERCENTILE_PAIR, m -> {
            Integer first = NumericNormalizer.parseCount(m.group(1));
            Integer second = NumericNormalizer.parseCount(m.group(2));
            if (first == null || second == null) return null;
            if (!range.contains(first) || !range.contains(second)) return null;
            return Percentiles.of(first, second);
        });
    }

    @Override
    public Optional<T> attempt(DocumentContent document) {
        return TextRuleMatcher.firstMatch(rule, document.text(), converter);
    }

    @Override
    public String describe() {
        return "text rule " + rule.field();
    }
}
