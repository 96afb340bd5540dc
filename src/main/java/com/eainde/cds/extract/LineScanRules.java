package com.eainde.cds.extract;

import com.eainde.cds.model.Percentiles;
import com.eainde.cds.scan.PlausibleRange;
import com.eainde.cds.strategy.LineScanStrategy;
import com.eainde.cds.strategy.LineScanStrategy.Pick;

import java.util.regex.Pattern;

import static com.eainde.cds.scan.RowMatcher.containsAll;

/**
 * Line-oriented passes for sources whose sections are laid out as prose rather than ruled
 * tables. Enabled per school with {@code line-scans: true}; when enabled they run ahead of
 * the generic text rules and table scans of the same field.
 *
 * <p>Ranges are calibrated for large public universities: in-state tuition around $13k,
 * out-of-state around $43k.</p>
 */
public final class LineScanRules {

    private static final Pattern FOUR_DIGITS = Pattern.compile("\\b(\\d{4})\\b");
    private static final Pattern THREE_DIGITS = Pattern.compile("\\b(\\d{3})\\b");
    private static final Pattern TWO_DIGITS = Pattern.compile("\\b(\\d{2})\\b");

    static final PlausibleRange SAT_COMPOSITE = PlausibleRange.between(1000, 1600);
    static final PlausibleRange SAT_SECTION = PlausibleRange.between(500, 800);
    static final PlausibleRange ACT_COMPOSITE = PlausibleRange.between(20, 36);

    static final PlausibleRange IN_STATE_TUITION = PlausibleRange.open(10_000, 20_000);
    static final PlausibleRange OUT_OF_STATE_TUITION = PlausibleRange.open(35_000, 50_000);
    static final PlausibleRange ROOM_AND_BOARD = PlausibleRange.open(12_000, 25_000);
    static final PlausibleRange NEED_BASED_GRANT = PlausibleRange.open(10_000, 50_000);

    private LineScanRules() {}

    // =========================================================================
    //  Test scores
    // =========================================================================

    public static LineScanStrategy<Percentiles> satComposite() {
        return LineScanStrategy.pair("sat.composite", containsAll("sat composite"), FOUR_DIGITS, SAT_COMPOSITE);
    }

    public static LineScanStrategy<Percentiles> satReadingWriting() {
        return LineScanStrategy.pair("sat.readingWriting",
                containsAll("evidence", "reading").or(containsAll("ebrw")), THREE_DIGITS, SAT_SECTION);
    }

    public static LineScanStrategy<Percentiles> satMath() {
        return LineScanStrategy.pair("sat.math",
                containsAll("sat math").excluding("evidence"), THREE_DIGITS, SAT_SECTION);
    }

    public static LineScanStrategy<Percentiles> actComposite() {
        return LineScanStrategy.pair("act.composite", containsAll("act composite"), TWO_DIGITS, ACT_COMPOSITE);
    }

    // =========================================================================
    //  Costs
    // =========================================================================

    /** Out-of-state tuition is preferred, so it is tried before the in-state rate. */
    public static LineScanStrategy<Integer> outOfStateTuition() {
        return LineScanStrategy.amount("costs.tuition.outOfState", containsAll("tuition"),
                OUT_OF_STATE_TUITION, Pick.FIRST_LINE);
    }

    public static LineScanStrategy<Integer> inStateTuition() {
        return LineScanStrategy.amount("costs.tuition.inState", containsAll("tuition"),
                IN_STATE_TUITION, Pick.FIRST_LINE);
    }

    public static LineScanStrategy<Integer> roomAndBoard() {
        return LineScanStrategy.amount("costs.roomAndBoard", containsAll("room", "board"),
                ROOM_AND_BOARD, Pick.LAST_LINE);
    }

    // =========================================================================
    //  Financial aid
    // =========================================================================

    public static LineScanStrategy<Integer> averageNeedBasedGrant() {
        return LineScanStrategy.amount("financialAid.averageNeedBasedGrant",
                containsAll("average", "need-based", "grant"), NEED_BASED_GRANT, Pick.LAST_LINE);
    }

    public static LineScanStrategy<Double> percentNeedFullyMet() {
        return LineScanStrategy.percentage("financialAid.percentNeedFullyMet", containsAll("fully met"));
    }
}
