package com.eainde.cds.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Standardized test blocks. A block is null when the source reports nothing for that test.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TestScores(
        @JsonProperty("sat") SatScores sat,
        @JsonProperty("act") ActScores act
) {

    public static final TestScores NONE = new TestScores(null, null);
}
