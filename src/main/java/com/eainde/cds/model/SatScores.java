package com.eainde.cds.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * SAT percentiles for the total score and the two sections.
 *
 * @param composite      total score percentiles
 * @param readingWriting Evidence-Based Reading and Writing percentiles
 * @param math           Math percentiles
 * @param submissionRate fraction of enrollees submitting SAT scores, 0 when unresolved
 */
public record SatScores(
        @JsonProperty("composite")      Percentiles composite,
        @JsonProperty("readingWriting") Percentiles readingWriting,
        @JsonProperty("math")           Percentiles math,
        @JsonProperty("submissionRate") double submissionRate
) {}
