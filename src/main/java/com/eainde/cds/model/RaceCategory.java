package com.eainde.cds.model;

import java.util.List;

/**
 * The nine fixed race/ethnicity buckets and the row keywords that map onto each.
 *
 * <p>Keywords are lower-case substrings of a row's classification key. Declaration order
 * is the match order: the first keyword found on a row decides its bucket.</p>
 */
public enum RaceCategory {

    INTERNATIONAL("international", List.of("nonresident", "international")),
    HISPANIC_LATINO("hispanicLatino", List.of("hispanic", "latino")),
    BLACK_AFRICAN_AMERICAN("blackAfricanAmerican", List.of("black", "african american")),
    WHITE("white", List.of("white")),
    ASIAN("asian", List.of("asian")),
    AMERICAN_INDIAN_ALASKA_NATIVE("americanIndianAlaskaNative", List.of("american indian", "alaska native")),
    NATIVE_HAWAIIAN_PACIFIC_ISLANDER("nativeHawaiianPacificIslander", List.of("native hawaiian", "pacific islander")),
    TWO_OR_MORE_RACES("twoOrMoreRaces", List.of("two or more", "multiracial")),
    UNKNOWN("unknown", List.of("unknown", "race/ethnicity unknown"));

    private final String key;
    private final List<String> keywords;

    RaceCategory(String key, List<String> keywords) {
        this.key = key;
        this.keywords = keywords;
    }

    /** JSON key of this bucket inside {@code byRace}. */
    public String key() {
        return key;
    }

    public List<String> keywords() {
        return keywords;
    }
}
