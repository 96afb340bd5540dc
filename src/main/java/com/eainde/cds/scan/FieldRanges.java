package com.eainde.cds.scan;

/**
 * Plausible ranges per field. A candidate outside its field's range is never selected.
 */
public final class FieldRanges {

    // Admissions
    public static final PlausibleRange APPLICANTS = PlausibleRange.above(1000);
    public static final PlausibleRange ADMITTED = PlausibleRange.above(100);
    public static final PlausibleRange ENROLLED = PlausibleRange.above(100);

    // Test scores
    public static final PlausibleRange SAT_SECTION = PlausibleRange.between(200, 800);
    public static final PlausibleRange SAT_COMPOSITE = PlausibleRange.between(400, 1600);
    public static final PlausibleRange ACT_COMPOSITE = PlausibleRange.between(1, 36);

    // Costs
    public static final PlausibleRange TUITION = PlausibleRange.above(1000);
    public static final PlausibleRange FEES = PlausibleRange.above(100);
    public static final PlausibleRange ROOM_AND_BOARD = PlausibleRange.above(1000);

    // Financial aid
    public static final PlausibleRange NEED_BASED_GRANT = PlausibleRange.above(1000);

    // Demographics; institution profiles may narrow the two enrollment ranges
    public static final PlausibleRange UNDERGRADUATE = PlausibleRange.above(100);
    public static final PlausibleRange GRADUATE = PlausibleRange.above(100);
    public static final PlausibleRange RACE = PlausibleRange.above(0);
    public static final PlausibleRange RESIDENCY = PlausibleRange.above(0);

    private FieldRanges() {}
}
