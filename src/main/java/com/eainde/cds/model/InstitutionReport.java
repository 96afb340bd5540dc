package com.eainde.cds.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * All records extracted for one institution, keyed by reporting-period label.
 *
 * @param name  display name
 * @param slug  lower-case identifier, also the output file name
 * @param years records ordered by period label
 */
public record InstitutionReport(
        @JsonProperty("name")  String name,
        @JsonProperty("slug")  String slug,
        @JsonProperty("years") Map<String, ExtractedRecord> years
) {

    public InstitutionReport {
        years = Collections.unmodifiableMap(new TreeMap<>(years));
    }

    public static InstitutionReport empty(String name, String slug) {
        return new InstitutionReport(name, slug, Map.of());
    }
}
