package com.eainde.cds.scan;

/**
 * A numeric interval outside of which a candidate is rejected.
 *
 * <pre>
 * PlausibleRange.above(1000)        → value &gt; 1000
 * PlausibleRange.between(200, 800)  → 200 ≤ value ≤ 800
 * PlausibleRange.open(2000, 20000)  → 2000 &lt; value &lt; 20000
 * </pre>
 */
public record PlausibleRange(long min, long max, boolean inclusive) {

    public PlausibleRange {
        if (inclusive ? min > max : min >= max) {
            throw new IllegalArgumentException("Empty range: min=" + min + ", max=" + max
                    + (inclusive ? " (inclusive)" : " (exclusive)"));
        }
    }

    public static PlausibleRange above(long min) {
        return new PlausibleRange(min, Long.MAX_VALUE, false);
    }

    public static PlausibleRange between(long min, long max) {
        return new PlausibleRange(min, max, true);
    }

    public static PlausibleRange open(long min, long max) {
        return new PlausibleRange(min, max, false);
    }

    public boolean contains(long value) {
        return inclusive
                ? value >= min && value <= max
                : value > min && value < max;
    }

    @Override
    public String toString() {
        if (max == Long.MAX_VALUE && !inclusive) return "(" + min + ", ∞)";
        return inclusive ? "[" + min + ", " + max + "]" : "(" + min + ", " + max + ")";
    }
}
