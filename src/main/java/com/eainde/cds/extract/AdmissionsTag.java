package com.eainde.cds.extract;

import com.eainde.cds.scan.PlausibleRange;

import java.util.Optional;

/**
 * Classification of a row in a gender-disaggregated admissions table, with the plausible
 * range of the count it carries.
 */
public enum AdmissionsTag {

    MEN_APPLIED(Gender.MEN, Metric.APPLIED, PlausibleRange.open(20_000, 100_000)),
    WOMEN_APPLIED(Gender.WOMEN, Metric.APPLIED, PlausibleRange.open(20_000, 100_000)),
    OTHER_APPLIED(Gender.OTHER, Metric.APPLIED, PlausibleRange.open(100, 20_000)),

    MEN_ADMITTED(Gender.MEN, Metric.ADMITTED, PlausibleRange.open(2_000, 20_000)),
    WOMEN_ADMITTED(Gender.WOMEN, Metric.ADMITTED, PlausibleRange.open(2_000, 20_000)),
    OTHER_ADMITTED(Gender.OTHER, Metric.ADMITTED, PlausibleRange.open(50, 5_000)),

    MEN_ENROLLED(Gender.MEN, Metric.ENROLLED, PlausibleRange.open(1_000, 10_000)),
    WOMEN_ENROLLED(Gender.WOMEN, Metric.ENROLLED, PlausibleRange.open(1_000, 10_000)),
    OTHER_ENROLLED(Gender.OTHER, Metric.ENROLLED, PlausibleRange.open(1, 1_000)),

    UNCLASSIFIED(null, null, null);

    public enum Gender { MEN, WOMEN, OTHER }

    public enum Metric { APPLIED, ADMITTED, ENROLLED }

    private final Gender gender;
    private final Metric metric;
    private final PlausibleRange range;

    AdmissionsTag(Gender gender, Metric metric, PlausibleRange range) {
        this.gender = gender;
        this.metric = metric;
        this.range = range;
    }

    public static Optional<AdmissionsTag> of(Gender gender, Metric metric) {
        for (AdmissionsTag tag : values()) {
            if (tag.gender == gender && tag.metric == metric) {
                return Optional.of(tag);
            }
        }
        return Optional.empty();
    }

    public Gender gender() {
        return gender;
    }

    public Metric metric() {
        return metric;
    }

    /** Null for {@link #UNCLASSIFIED}. */
    public PlausibleRange range() {
        return range;
    }
}
