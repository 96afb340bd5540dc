package com.eainde.cds.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Enrollment, race/ethnicity and residency breakdowns.
 *
 * @param enrollment  headcounts by level
 * @param byRace      count per {@link RaceCategory#key()}, always all nine keys in enum order
 * @param byResidency counts by residency
 */
public record Demographics(
        @JsonProperty("enrollment")  Enrollment enrollment,
        @JsonProperty("byRace")      Map<String, Integer> byRace,
        @JsonProperty("byResidency") Residency byResidency
) {

    public Demographics {
        byRace = Collections.unmodifiableMap(new LinkedHashMap<>(byRace));
    }

    /**
     * Builds the record from per-category counts; categories without a count are 0.
     */
    public static Demographics of(Enrollment enrollment, Map<RaceCategory, Integer> raceCounts,
                                  Residency residency) {
        Map<RaceCategory, Integer> counts = raceCounts.isEmpty()
                ? new EnumMap<>(RaceCategory.class)
                : new EnumMap<>(raceCounts);
        Map<String, Integer> byRace = new LinkedHashMap<>();
        for (RaceCategory category : RaceCategory.values()) {
            byRace.put(category.key(), counts.getOrDefault(category, 0));
        }
        return new Demographics(enrollment, byRace, residency);
    }

    public int raceCount(RaceCategory category) {
        return byRace.getOrDefault(category.key(), 0);
    }
}
