package com.eainde.cds.scan;

import static com.eainde.cds.scan.RowMatcher.containsAll;
import static com.eainde.cds.scan.RowMatcher.containsAny;
import static com.eainde.cds.scan.RowMatcher.startsWith;

/**
 * The table scan rule of every field that has one.
 */
public final class RowScanRules {

    // =========================================================================
    //  Admissions
    // =========================================================================

    /** Totals dominate the per-gender breakdowns on the same row. */
    public static final RowScanRule APPLIED = new RowScanRule("applied",
            containsAll("applicants"), FieldRanges.APPLICANTS, TieBreakPolicy.MAX_WINS);

    public static final RowScanRule ADMITTED = new RowScanRule("admitted",
            containsAll("admitted"), FieldRanges.ADMITTED, TieBreakPolicy.FIRST_NON_ZERO_WINS);

    public static final RowScanRule ENROLLED = new RowScanRule("enrolled",
            containsAll("enrolled").excluding("full"), FieldRanges.ENROLLED, TieBreakPolicy.FIRST_NON_ZERO_WINS);

    // =========================================================================
    //  Test scores
    // =========================================================================

    public static final RowScanRule SAT_READING_WRITING = new RowScanRule("sat.readingWriting",
            containsAll("reading", "writing"), FieldRanges.SAT_SECTION, TieBreakPolicy.MIN_MAX_PAIR);

    public static final RowScanRule SAT_MATH = new RowScanRule("sat.math",
            containsAll("math", "sat"), FieldRanges.SAT_SECTION, TieBreakPolicy.MIN_MAX_PAIR);

    public static final RowScanRule SAT_COMPOSITE = new RowScanRule("sat.composite",
            containsAll("sat", "composite"), FieldRanges.SAT_COMPOSITE, TieBreakPolicy.MIN_MAX_PAIR);

    public static final RowScanRule ACT_COMPOSITE = new RowScanRule("act.composite",
            containsAll("act composite").or(containsAll("composite", "act")),
            FieldRanges.ACT_COMPOSITE, TieBreakPolicy.MIN_MAX_PAIR);

    // =========================================================================
    //  Demographics
    // =========================================================================

    public static final RowScanRule UNDERGRADUATE = new RowScanRule("enrollment.undergraduate",
            containsAll("undergraduate").and(containsAny("degree", "total")),
            FieldRanges.UNDERGRADUATE, TieBreakPolicy.FIRST_ROW_MAX);

    public static final RowScanRule GRADUATE = new RowScanRule("enrollment.graduate",
            containsAll("graduate", "total").excluding("undergraduate"),
            FieldRanges.GRADUATE, TieBreakPolicy.FIRST_ROW_MAX);

    public static final RowScanRule IN_STATE = new RowScanRule("residency.inState",
            containsAny("in-state", "in state").excluding("tuition", "fee", "cost", "$"),
            FieldRanges.RESIDENCY, TieBreakPolicy.FIRST_ROW_MAX);

    public static final RowScanRule OUT_OF_STATE = new RowScanRule("residency.outOfState",
            containsAny("out-of-state", "out of state").excluding("tuition", "fee", "cost", "$"),
            FieldRanges.RESIDENCY, TieBreakPolicy.FIRST_ROW_MAX);

    // =========================================================================
    //  Costs and aid
    // =========================================================================

    /** Combined tuition-and-fees rows are left to the fee rule. */
    public static final RowScanRule TUITION = new RowScanRule("costs.tuition",
            containsAll("tuition").excluding("fee"), FieldRanges.TUITION, TieBreakPolicy.FIRST_ROW_MAX);

    public static final RowScanRule FEES = new RowScanRule("costs.fees",
            containsAll("required", "fee").or(startsWith("fees")), FieldRanges.FEES, TieBreakPolicy.FIRST_ROW_MAX);

    public static final RowScanRule ROOM_AND_BOARD = new RowScanRule("costs.roomAndBoard",
            containsAll("room", "board"), FieldRanges.ROOM_AND_BOARD, TieBreakPolicy.FIRST_ROW_MAX);

    public static final RowScanRule NEED_BASED_GRANT = new RowScanRule("financialAid.averageNeedBasedGrant",
            containsAll("average", "grant", "need"), FieldRanges.NEED_BASED_GRANT, TieBreakPolicy.FIRST_ROW_MAX);

    private RowScanRules() {}
}
