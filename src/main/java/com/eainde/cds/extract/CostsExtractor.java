package com.eainde.cds.extract;

import com.eainde.cds.ingest.DocumentContent;
import com.eainde.cds.model.Costs;
import com.eainde.cds.rules.TextField;
import com.eainde.cds.rules.TextRuleSet;
import com.eainde.cds.scan.RowScanRule;
import com.eainde.cds.scan.RowScanRules;
import com.eainde.cds.strategy.ExtractionStrategy;
import com.eainde.cds.strategy.FieldCascade;
import com.eainde.cds.strategy.TableScanStrategy;
import com.eainde.cds.strategy.TextRuleStrategy;

import java.util.List;

/**
 * Cost of attendance (G1). Text first, then a range-gated table scan; schools with line
 * scans enabled read {@code $} amounts from lines ahead of both. The total is the exact sum
 * of the three components.
 */
public class CostsExtractor implements SectionExtractor<Costs> {

    private final FieldCascade<Integer> tuition;
    private final FieldCascade<Integer> fees;
    private final FieldCascade<Integer> roomAndBoard;

    public CostsExtractor(TextRuleSet rules) {
        this(rules, false);
    }

    /**
     * @param lineScans read {@code $} amounts from lines first; tuition then prefers the
     *                  out-of-state rate over the in-state one
     */
    public CostsExtractor(TextRuleSet rules, boolean lineScans) {
        this.tuition = lineScans
                ? count("costs.tuition", rules, TextField.TUITION, RowScanRules.TUITION,
                        List.of(LineScanRules.outOfStateTuition(), LineScanRules.inStateTuition()))
                : count("costs.tuition", rules, TextField.TUITION, RowScanRules.TUITION, List.of());
        this.fees = count("costs.fees", rules, TextField.FEES, RowScanRules.FEES, List.of());
        this.roomAndBoard = count("costs.roomAndBoard", rules, TextField.ROOM_AND_BOARD, RowScanRules.ROOM_AND_BOARD,
                lineScans ? List.of(LineScanRules.roomAndBoard()) : List.of());
    }

    private static FieldCascade<Integer> count(String name, TextRuleSet rules, TextField field,
                                               RowScanRule tableRule,
                                               List<ExtractionStrategy<Integer>> lineScans) {
        FieldCascade.Builder<Integer> cascade = FieldCascade.named(name);
        lineScans.forEach(cascade::then);
        return cascade
                .then(TextRuleStrategy.count(rules.rule(field)))
                .then(TableScanStrategy.count(tableRule))
                .build();
    }

    @Override
    public Costs extract(DocumentContent document) {
        return Costs.of(
                tuition.resolveOr(document, 0),
                fees.resolveOr(document, 0),
                roomAndBoard.resolveOr(document, 0));
    }
}
