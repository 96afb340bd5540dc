package com.eainde.cds.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param percentReceivingAid   fraction of students receiving aid, 0 when unresolved
 * @param averageAidPackage     average financial aid package
 * @param averageNeedBasedGrant average need-based grant
 * @param percentNeedFullyMet   fraction whose need was fully met, 0 when unresolved
 */
public record FinancialAid(
        @JsonProperty("percentReceivingAid")   double percentReceivingAid,
        @JsonProperty("averageAidPackage")     int averageAidPackage,
        @JsonProperty("averageNeedBasedGrant") int averageNeedBasedGrant,
        @JsonProperty("percentNeedFullyMet")   double percentNeedFullyMet
) {}
