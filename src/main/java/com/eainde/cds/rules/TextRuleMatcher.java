package com.eainde.cds.rules;

import java.util.Optional;
import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The single generic matcher behind every text rule.
 *
 * <p>Each pattern of a rule is searched once (first occurrence only). The converter turns
 * the match into a value; a {@code null} result means the capture was malformed or
 * implausible, and the next pattern is tried.</p>
 */
public final class TextRuleMatcher {

    private TextRuleMatcher() {}

    /**
     * Runs the rule's patterns in order against the text.
     *
     * @param rule      the rule to evaluate
     * @param text      the text to search, may be null
     * @param converter capture → value, or null to reject the capture
     * @return the first accepted value, or empty
     */
    public static <T> Optional<T> firstMatch(TextRule rule, String text,
                                             Function<MatchResult, T> converter) {
        if (text == null || text.isEmpty()) return Optional.empty();
        for (Pattern pattern : rule.patterns()) {
            Matcher m = pattern.matcher(text);
            if (!m.find()) continue;
            T value = converter.apply(m.toMatchResult());
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
