package com.eainde.cds.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Student counts by residency. Not guaranteed to sum to total enrollment.
 */
public record Residency(
        @JsonProperty("inState")       int inState,
        @JsonProperty("outOfState")    int outOfState,
        @JsonProperty("international") int international
) {

    public static final Residency EMPTY = new Residency(0, 0, 0);
}
