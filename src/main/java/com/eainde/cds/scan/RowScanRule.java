package com.eainde.cds.scan;

import java.util.Objects;

/**
 * Everything the scanner needs for one field: which rows to claim, which candidates to
 * keep and how to choose among them.
 *
 * @param name    field name, used in log output
 * @param matcher row classification
 * @param range   plausible interval for candidates
 * @param policy  tie-break among surviving candidates
 */
public record RowScanRule(String name, RowMatcher matcher, PlausibleRange range, TieBreakPolicy policy) {

    public RowScanRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(matcher, "matcher");
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(policy, "policy");
    }

    /** Same rule with another range, for institution-specific scales. */
    public RowScanRule withRange(PlausibleRange other) {
        return new RowScanRule(name, matcher, other, policy);
    }
}
