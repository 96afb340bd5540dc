package com.eainde.cds.config;

import com.eainde.cds.scan.FieldRanges;
import com.eainde.cds.scan.PlausibleRange;
import lombok.Data;

/**
 * Per-institution extraction settings, bound from {@code cds.schools.<slug>}.
 *
 * <p>Enrollment bounds are exclusive. A missing lower bound falls back to the generic
 * floor of the field; missing both bounds means the generic range.</p>
 */
@Data
public class SchoolProfile {

    /** Use the gender-disaggregated admissions reducer. */
    private boolean genderedAdmissions = false;

    /** Run the line-oriented score, cost and aid passes ahead of the generic rules. */
    private boolean lineScans = false;

    /** Display name written to the report, e.g. "UCLA"; title case of the argument when unset. */
    private String displayName;

    private Integer undergraduateMin;
    private Integer undergraduateMax;
    private Integer graduateMin;
    private Integer graduateMax;

    public static SchoolProfile defaults() {
        return new SchoolProfile();
    }

    public PlausibleRange undergraduateRange() {
        return range(undergraduateMin, undergraduateMax, FieldRanges.UNDERGRADUATE);
    }

    public PlausibleRange graduateRange() {
        return range(graduateMin, graduateMax, FieldRanges.GRADUATE);
    }

    private static PlausibleRange range(Integer min, Integer max, PlausibleRange generic) {
        if (min == null && max == null) return generic;
        long low = min != null ? min : generic.min();
        return max != null ? PlausibleRange.open(low, max) : PlausibleRange.above(low);
    }
}
