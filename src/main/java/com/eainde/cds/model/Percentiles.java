package com.eainde.cds.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A 25th / 50th / 75th percentile triple for a test score.
 *
 * <p>Only the two bounds are ever read from a source; {@code p50} is always the integer
 * midpoint {@code floor((p25 + p75) / 2)}. Build instances through {@link #of(int, int)}
 * so the ordering and midpoint hold for every triple.</p>
 *
 * @param p25 lower quartile, 0 when unresolved
 * @param p50 midpoint of the bounds, 0 when unresolved
 * @param p75 upper quartile, 0 when unresolved
 */
public record Percentiles(
        @JsonProperty("p25") int p25,
        @JsonProperty("p50") int p50,
        @JsonProperty("p75") int p75
) {

    public static final Percentiles EMPTY = new Percentiles(0, 0, 0);

    /**
     * Builds a triple from two bounds given in either order.
     */
    public static Percentiles of(int first, int second) {
        int low = Math.min(first, second);
        int high = Math.max(first, second);
        return new Percentiles(low, Math.floorDiv(low + high, 2), high);
    }

    /**
     * @return true when both bounds were read from the source
     */
    @JsonIgnore
    public boolean isResolved() {
        return p25 > 0 && p75 > 0;
    }

    /**
     * Component-wise sum of the bounds; the midpoint is recomputed from the summed bounds.
     */
    public Percentiles plus(Percentiles other) {
        return of(p25 + other.p25, p75 + other.p75);
    }
}
