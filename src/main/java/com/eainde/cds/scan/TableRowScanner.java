package com.eainde.cds.scan;

import com.eainde.cds.ingest.RawTable;
import com.eainde.cds.model.Percentiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Scans every row of every table for one field.
 *
 * <h3>Per row</h3>
 * <ol>
 *   <li>Build the lower-case classification key from the cells.</li>
 *   <li>Skip the row unless the rule's {@link RowMatcher} claims it.</li>
 *   <li>Take every numeric token of every cell and drop those outside the rule's range.</li>
 * </ol>
 * The surviving candidates of all claimed rows are then resolved by the rule's
 * {@link TieBreakPolicy}.
 */
public final class TableRowScanner {

    private static final Logger log = LoggerFactory.getLogger(TableRowScanner.class);

    private TableRowScanner() {}

    /**
     * Flattens tables into classified rows, table order then row order.
     */
    public static List<TableRow> rows(List<RawTable> tables) {
        List<TableRow> rows = new ArrayList<>();
        for (RawTable table : tables) {
            for (List<String> cells : table.rows()) {
                rows.add(TableRow.of(cells));
            }
        }
        return rows;
    }

    /**
     * Resolves a single count.
     *
     * @throws IllegalArgumentException when the rule uses {@link TieBreakPolicy#MIN_MAX_PAIR}
     */
    public static Optional<Integer> scanCount(List<RawTable> tables, RowScanRule rule) {
        return scanRows(rows(tables), rule);
    }

    /**
     * Resolves a single count from rows that are already classified.
     */
    public static Optional<Integer> scanRows(List<TableRow> rows, RowScanRule rule) {
        if (rule.policy() == TieBreakPolicy.MIN_MAX_PAIR) {
            throw new IllegalArgumentException("Rule " + rule.name() + " resolves pairs, not counts");
        }
        Integer best = null;
        for (TableRow row : rows) {
            List<Integer> survivors = survivors(row, rule);
            if (survivors.isEmpty()) continue;

            switch (rule.policy()) {
                case FIRST_NON_ZERO_WINS:
                    return found(rule, survivors.get(0));
                case FIRST_ROW_MAX:
                    return found(rule, Collections.max(survivors));
                case MAX_WINS:
                    int rowMax = Collections.max(survivors);
                    if (best == null || rowMax > best) {
                        best = rowMax;
                    }
                    break;
                default:
                    throw new IllegalStateException("Unhandled policy " + rule.policy());
            }
        }
        return best == null ? Optional.empty() : found(rule, best);
    }

    /**
     * Resolves a percentile pair from the minimum and maximum survivors of a row.
     *
     * @throws IllegalArgumentException unless the rule uses {@link TieBreakPolicy#MIN_MAX_PAIR}
     */
    public static Optional<Percentiles> scanPair(List<RawTable> tables, RowScanRule rule) {
        if (rule.policy() != TieBreakPolicy.MIN_MAX_PAIR) {
            throw new IllegalArgumentException("Rule " + rule.name() + " resolves counts, not pairs");
        }
        Percentiles pair = null;
        for (TableRow row : rows(tables)) {
            List<Integer> survivors = survivors(row, rule);
            if (survivors.size() < 2) continue;
            pair = Percentiles.of(Collections.min(survivors), Collections.max(survivors));
        }
        if (pair != null) {
            log.debug("Table scan resolved {} = [{}, {}]", rule.name(), pair.p25(), pair.p75());
        }
        return Optional.ofNullable(pair);
    }

    private static List<Integer> survivors(TableRow row, RowScanRule rule) {
        if (!rule.matcher().matches(row)) return List.of();
        List<Integer> survivors = new ArrayList<>();
        for (Integer candidate : row.candidates()) {
            if (rule.range().contains(candidate)) {
                survivors.add(candidate);
            } else if (log.isTraceEnabled()) {
                log.trace("Rejected {} for {}: outside {}", candidate, rule.name(), rule.range());
            }
        }
        return survivors;
    }

    private static Optional<Integer> found(RowScanRule rule, int value) {
        log.debug("Table scan resolved {} = {} ({})", rule.name(), value, rule.policy());
        return Optional.of(value);
    }
}
