package com.eainde.cds.strategy;

import com.eainde.cds.ingest.DocumentContent;
import com.eainde.cds.model.Percentiles;
import com.eainde.cds.scan.RowScanRule;
import com.eainde.cds.scan.TableRowScanner;
import com.eainde.cds.scan.TieBreakPolicy;

import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Resolves a field by scanning the document's tables with a {@link RowScanRule}.
 */
public final class TableScanStrategy<T> implements ExtractionStrategy<T> {

    private final RowScanRule rule;
    private final Function<DocumentContent, Optional<T>> scan;

    private TableScanStrategy(RowScanRule rule,
                              BiFunction<DocumentContent, RowScanRule, Optional<T>> scan) {
        this.rule = rule;
        this.scan = document -> scan.apply(document, rule);
    }

    public static TableScanStrategy<Integer> count(RowScanRule rule) {
        if (rule.policy() == TieBreakPolicy.MIN_MAX_PAIR) {
            throw new IllegalArgumentException("Rule " + rule.name() + " resolves pairs, not counts");
        }
        return new TableScanStrategy<>(rule, (document, r) -> TableRowScanner.scanCount(document.tables(), r));
    }

    public static TableScanStrategy<Percentiles> pair(RowScanRule rule) {
        if (rule.policy() != TieBreakPolicy.MIN_MAX_PAIR) {
            throw new IllegalArgumentException("Rule " + rule.name() + " resolves counts, not pairs");
        }
        return new TableScanStrategy<>(rule, (document, r) -> TableRowScanner.scanPair(document.tables(), r));
    }

    @Override
    public Optional<T> attempt(DocumentContent document) {
        if (document.tables().isEmpty()) return Optional.empty();
        return scan.apply(document);
    }

    @Override
    public String describe() {
        return "table scan " + rule.name();
    }
}
