package com.eainde.cds.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * First-time, first-year admissions counts and the rates derived from them.
 *
 * @param applied        total applicants
 * @param admitted       total admitted
 * @param enrolled       total enrolled
 * @param acceptanceRate admitted / applied, 0 when not derivable
 * @param yield          enrolled / admitted, 0 when not derivable
 * @param earlyDecision  Early Decision counts or null
 * @param earlyAction    Early Action counts or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"applied", "admitted", "enrolled", "acceptanceRate", "yield", "earlyDecision", "earlyAction"})
public record Admissions(
        @JsonProperty("applied")        int applied,
        @JsonProperty("admitted")       int admitted,
        @JsonProperty("enrolled")       int enrolled,
        @JsonProperty("acceptanceRate") double acceptanceRate,
        @JsonProperty("yield")          double yield,
        @JsonProperty("earlyDecision")  EarlyRound earlyDecision,
        @JsonProperty("earlyAction")    EarlyRound earlyAction
) {

    /**
     * Builds the record and derives both rates from the counts.
     */
    public static Admissions of(int applied, int admitted, int enrolled,
                                EarlyRound earlyDecision, EarlyRound earlyAction) {
        return new Admissions(applied, admitted, enrolled,
                Rates.ratio(admitted, applied),
                Rates.ratio(enrolled, admitted),
                earlyDecision, earlyAction);
    }

    public static Admissions of(int applied, int admitted, int enrolled) {
        return of(applied, admitted, enrolled, null, null);
    }
}
