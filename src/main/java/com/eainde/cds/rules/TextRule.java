package com.eainde.cds.rules;

import java.util.List;
import java.util.regex.Pattern;

/**
 * The ordered patterns that can populate one field. Patterns are tried in order; the first
 * one whose capture resolves wins and the rest are skipped.
 *
 * @param field    the field this rule populates
 * @param role     how captures are read
 * @param patterns compiled patterns, in priority order
 */
public record TextRule(TextField field, CaptureRole role, List<Pattern> patterns) {

    public TextRule {
        if (patterns.isEmpty()) {
            throw new IllegalArgumentException("Rule for " + field + " has no patterns");
        }
        for (Pattern pattern : patterns) {
            int groups = pattern.matcher("").groupCount();
            if (groups < role.groupCount()) {
                throw new IllegalArgumentException("Pattern for " + field + " declares " + groups
                        + " groups, " + role + " needs " + role.groupCount() + ": " + pattern);
            }
        }
        patterns = List.copyOf(patterns);
    }
}
