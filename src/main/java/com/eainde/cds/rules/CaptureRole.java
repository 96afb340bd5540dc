package com.eainde.cds.rules;

/**
 * How the capture groups of a matched text rule turn into a field value.
 */
public enum CaptureRole {

    /** Group 1 is a count or currency amount. */
    COUNT(1),

    /** Group 1 is a percentage, whole ("45") or fractional ("0.45"). */
    PERCENTAGE(1),

    /** Groups 1 and 2 are the two bounds of a percentile range. */
    PERCENTILE_PAIR(2);

    private final int groupCount;

    CaptureRole(int groupCount) {
        this.groupCount = groupCount;
    }

    /** Minimum number of capture groups a pattern with this role must declare. */
    public int groupCount() {
        return groupCount;
    }
}
