package com.eainde.cds.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Headcount enrollment. {@code total} is always the sum of the two levels.
 */
public record Enrollment(
        @JsonProperty("total")         int total,
        @JsonProperty("undergraduate") int undergraduate,
        @JsonProperty("graduate")      int graduate
) {

    public static Enrollment of(int undergraduate, int graduate) {
        return new Enrollment(undergraduate + graduate, undergraduate, graduate);
    }
}
