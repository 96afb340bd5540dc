package com.eainde.cds.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Early Decision or Early Action counts. Only built when both numbers resolved.
 */
public record EarlyRound(
        @JsonProperty("applied")  int applied,
        @JsonProperty("admitted") int admitted
) {}
