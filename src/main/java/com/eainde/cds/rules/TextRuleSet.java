package com.eainde.cds.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Declarative table of text rules: field → ordered patterns → capture role.
 *
 * <p>Patterns are broad ("keywords, then digits"). Implausible captures are rejected by
 * range checks in the strategies that consume these rules. All patterns are case-insensitive. Rules built
 * with {@link Builder#spanning} may match across line breaks, the others stay on one line.</p>
 */
public final class TextRuleSet {

    private static final String COUNT = "(\\d[\\d,]*)";
    private static final String AMOUNT = "\\$?([\\d,]+)";
    private static final String PERCENT = "(\\d+\\.?\\d*)%?";

    /** The rule set for Common Data Set style reports. */
    public static final TextRuleSet STANDARD = builder()
            // C1: first-time, first-year admissions
            .spanning(TextField.APPLIED,
                    "Total first-time.*?applicants.*?" + COUNT,
                    "Total.*?applicants.*?men.*?women.*?Total.*?" + COUNT,
                    "Number of applicants.*?" + COUNT)
            .spanning(TextField.ADMITTED,
                    "Total first-time.*?admitted.*?" + COUNT,
                    "Number.*?admitted.*?" + COUNT,
                    "Admitted.*?Total.*?" + COUNT)
            .spanning(TextField.ENROLLED,
                    "Total first-time.*?enrolled.*?" + COUNT,
                    "Number.*?enrolled.*?" + COUNT,
                    "Enrolled.*?Total.*?" + COUNT)

            // C21 / C22: early rounds
            .line(TextField.EARLY_DECISION_APPLIED,
                    "Early Decision.*?applied.*?" + COUNT,
                    "\\bED\\b.*?applicants.*?" + COUNT)
            .line(TextField.EARLY_DECISION_ADMITTED,
                    "Early Decision.*?admitted.*?" + COUNT,
                    "\\bED\\b.*?admitted.*?" + COUNT)
            .line(TextField.EARLY_ACTION_APPLIED,
                    "Early Action.*?applied.*?" + COUNT,
                    "\\bEA\\b.*?applicants.*?" + COUNT)
            .line(TextField.EARLY_ACTION_ADMITTED,
                    "Early Action.*?admitted.*?" + COUNT,
                    "\\bEA\\b.*?admitted.*?" + COUNT)

            // C9: test score percentiles
            .line(TextField.SAT_READING_WRITING,
                    "SAT Evidence-Based Reading.*?\\b(\\d{3})\\s*[-–]\\s*(\\d{3})\\b")
            .line(TextField.SAT_MATH,
                    "SAT Math.*?\\b(\\d{3})\\s*[-–]\\s*(\\d{3})\\b")
            .line(TextField.SAT_COMPOSITE,
                    "SAT Composite.*?\\b(\\d{3,4})\\s*[-–]\\s*(\\d{3,4})\\b")
            .line(TextField.ACT_COMPOSITE,
                    "ACT Composite.*?\\b(\\d{2})\\s*[-–]\\s*(\\d{2})\\b")
            .line(TextField.SAT_SUBMISSION_RATE,
                    "SAT.*?submitted.*?" + PERCENT)
            .line(TextField.ACT_SUBMISSION_RATE,
                    "ACT.*?submitted.*?" + PERCENT)

            // B1: enrollment
            .line(TextField.UNDERGRADUATE_ENROLLMENT,
                    "Total.*?undergraduate.*?enrollment.*?" + COUNT,
                    "Undergraduate.*?degree-seeking.*?" + COUNT)
            .line(TextField.GRADUATE_ENROLLMENT,
                    "Total.*?\\bgraduate.*?enrollment.*?" + COUNT)

            // G1: cost of attendance
            .line(TextField.TUITION,
                    "Tuition.*?" + AMOUNT)
            .line(TextField.FEES,
                    "Required fees.*?" + AMOUNT)
            .line(TextField.ROOM_AND_BOARD,
                    "Room and board.*?" + AMOUNT,
                    "Room & board.*?" + AMOUNT)

            // H: financial aid
            .line(TextField.PERCENT_RECEIVING_AID,
                    "Percent.*?receiving.*?aid.*?" + PERCENT,
                    "(\\d+\\.?\\d*)%.*?receiving.*?need-based")
            .line(TextField.AVERAGE_AID_PACKAGE,
                    "Average.*?financial aid.*?" + AMOUNT)
            .line(TextField.AVERAGE_NEED_BASED_GRANT,
                    "Average.*?need-based.*?grant.*?" + AMOUNT)
            .line(TextField.PERCENT_NEED_FULLY_MET,
                    "Percent.*?need fully met.*?" + PERCENT,
                    "(\\d+\\.?\\d*)%.*?need fully met")
            .build();

    private final Map<TextField, TextRule> rules;

    private TextRuleSet(Map<TextField, TextRule> rules) {
        this.rules = Collections.unmodifiableMap(new EnumMap<>(rules));
    }

    /**
     * @throws IllegalArgumentException when the set has no rule for the field
     */
    public TextRule rule(TextField field) {
        TextRule rule = rules.get(field);
        if (rule == null) {
            throw new IllegalArgumentException("No text rule for " + field);
        }
        return rule;
    }

    public boolean hasRule(TextField field) {
        return rules.containsKey(field);
    }

    public Map<TextField, TextRule> rules() {
        return rules;
    }

    // =========================================================================
    //  Builder
    // =========================================================================

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private final Map<TextField, TextRule> rules = new EnumMap<>(TextField.class);

        /** Patterns that may match across line breaks. */
        public Builder spanning(TextField field, String... regexes) {
            return add(field, Pattern.CASE_INSENSITIVE | Pattern.DOTALL, regexes);
        }

        /** Patterns confined to a single line. */
        public Builder line(TextField field, String... regexes) {
            return add(field, Pattern.CASE_INSENSITIVE, regexes);
        }

        private Builder add(TextField field, int flags, String... regexes) {
            List<Pattern> patterns = new ArrayList<>();
            if (rules.containsKey(field)) {
                patterns.addAll(rules.get(field).patterns());
            }
            for (String regex : regexes) {
                patterns.add(Pattern.compile(regex, flags));
            }
            rules.put(field, new TextRule(field, field.role(), patterns));
            return this;
        }

        public TextRuleSet build() {
            return new TextRuleSet(rules);
        }
    }
}
