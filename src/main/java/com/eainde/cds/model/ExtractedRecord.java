package com.eainde.cds.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The normalized record for one document / reporting period.
 *
 * <p>Built once from a single document's text and tables and never modified afterwards.
 * Unresolved fields hold 0; there is no separate "missing" marker.</p>
 */
public record ExtractedRecord(
        @JsonProperty("admissions")   Admissions admissions,
        @JsonProperty("testScores")   TestScores testScores,
        @JsonProperty("demographics") Demographics demographics,
        @JsonProperty("costs")        Costs costs,
        @JsonProperty("financialAid") FinancialAid financialAid
) {}
