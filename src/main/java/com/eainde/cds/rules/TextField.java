package com.eainde.cds.rules;

/**
 * Every field that has text rules, with the role its captures play.
 */
public enum TextField {

    APPLIED(CaptureRole.COUNT),
    ADMITTED(CaptureRole.COUNT),
    ENROLLED(CaptureRole.COUNT),
    EARLY_DECISION_APPLIED(CaptureRole.COUNT),
    EARLY_DECISION_ADMITTED(CaptureRole.COUNT),
    EARLY_ACTION_APPLIED(CaptureRole.COUNT),
    EARLY_ACTION_ADMITTED(CaptureRole.COUNT),

    SAT_READING_WRITING(CaptureRole.PERCENTILE_PAIR),
    SAT_MATH(CaptureRole.PERCENTILE_PAIR),
    SAT_COMPOSITE(CaptureRole.PERCENTILE_PAIR),
    ACT_COMPOSITE(CaptureRole.PERCENTILE_PAIR),
    SAT_SUBMISSION_RATE(CaptureRole.PERCENTAGE),
    ACT_SUBMISSION_RATE(CaptureRole.PERCENTAGE),

    UNDERGRADUATE_ENROLLMENT(CaptureRole.COUNT),
    GRADUATE_ENROLLMENT(CaptureRole.COUNT),

    TUITION(CaptureRole.COUNT),
    FEES(CaptureRole.COUNT),
    ROOM_AND_BOARD(CaptureRole.COUNT),

    PERCENT_RECEIVING_AID(CaptureRole.PERCENTAGE),
    PERCENT_NEED_FULLY_MET(CaptureRole.PERCENTAGE),
    AVERAGE_AID_PACKAGE(CaptureRole.COUNT),
    AVERAGE_NEED_BASED_GRANT(CaptureRole.COUNT);

    private final CaptureRole role;

    TextField(CaptureRole role) {
        this.role = role;
    }

    public CaptureRole role() {
        return role;
    }
}
