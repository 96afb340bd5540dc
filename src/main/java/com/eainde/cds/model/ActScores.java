package com.eainde.cds.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * ACT composite percentiles.
 */
public record ActScores(
        @JsonProperty("composite")      Percentiles composite,
        @JsonProperty("submissionRate") double submissionRate
) {}
