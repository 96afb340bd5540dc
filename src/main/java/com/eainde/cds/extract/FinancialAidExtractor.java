package com.eainde.cds.extract;

import com.eainde.cds.ingest.DocumentContent;
import com.eainde.cds.model.FinancialAid;
import com.eainde.cds.model.Rates;
import com.eainde.cds.numeric.NumericNormalizer;
import com.eainde.cds.rules.TextField;
import com.eainde.cds.rules.TextRuleSet;
import com.eainde.cds.scan.RowMatcher;
import com.eainde.cds.scan.RowScanRules;
import com.eainde.cds.scan.TableRow;
import com.eainde.cds.scan.TableRowScanner;
import com.eainde.cds.strategy.ExtractionStrategy;
import com.eainde.cds.strategy.FieldCascade;
import com.eainde.cds.strategy.TableScanStrategy;
import com.eainde.cds.strategy.TextRuleStrategy;

import java.util.Optional;

/**
 * Financial aid (H). Percentages go through {@link NumericNormalizer#parsePercentage} and
 * must be usable rates; currency amounts are counts.
 */
public class FinancialAidExtractor implements SectionExtractor<FinancialAid> {

    private static final RowMatcher FULLY_MET = RowMatcher.containsAny("fully met", "full need");

    private final FieldCascade<Double> percentReceivingAid;
    private final FieldCascade<Integer> averageAidPackage;
    private final FieldCascade<Integer> averageNeedBasedGrant;
    private final FieldCascade<Double> percentNeedFullyMet;

    public FinancialAidExtractor(TextRuleSet rules) {
        this(rules, false);
    }

    /**
     * @param lineScans read the need-based grant and the fully-met percentage from lines
     *                  before the generic rules
     */
    public FinancialAidExtractor(TextRuleSet rules, boolean lineScans) {
        this.percentReceivingAid = FieldCascade.<Double>named("financialAid.percentReceivingAid")
                .then(TextRuleStrategy.percentage(rules.rule(TextField.PERCENT_RECEIVING_AID)))
                .build();
        this.averageAidPackage = FieldCascade.<Integer>named("financialAid.averageAidPackage")
                .then(TextRuleStrategy.count(rules.rule(TextField.AVERAGE_AID_PACKAGE)))
                .build();
        FieldCascade.Builder<Integer> grant = FieldCascade.named("financialAid.averageNeedBasedGrant");
        FieldCascade.Builder<Double> fullyMet = FieldCascade.named("financialAid.percentNeedFullyMet");
        if (lineScans) {
            grant.then(LineScanRules.averageNeedBasedGrant());
            fullyMet.then(LineScanRules.percentNeedFullyMet());
        }
        this.averageNeedBasedGrant = grant
                .then(TextRuleStrategy.count(rules.rule(TextField.AVERAGE_NEED_BASED_GRANT)))
                .then(TableScanStrategy.count(RowScanRules.NEED_BASED_GRANT))
                .build();
        this.percentNeedFullyMet = fullyMet
                .then(TextRuleStrategy.percentage(rules.rule(TextField.PERCENT_NEED_FULLY_MET)))
                .then(new FullyMetRowStrategy())
                .build();
    }

    @Override
    public FinancialAid extract(DocumentContent document) {
        return new FinancialAid(
                percentReceivingAid.resolveOr(document, 0.0),
                averageAidPackage.resolveOr(document, 0),
                averageNeedBasedGrant.resolveOr(document, 0),
                percentNeedFullyMet.resolveOr(document, 0.0));
    }

    /**
     * First cell of a "fully met" row that reads as a positive rate, whatever its column.
     */
    static final class FullyMetRowStrategy implements ExtractionStrategy<Double> {

        @Override
        public Optional<Double> attempt(DocumentContent document) {
            for (TableRow row : TableRowScanner.rows(document.tables())) {
                if (!FULLY_MET.matches(row)) continue;
                for (String cell : row.cells()) {
                    Double value = NumericNormalizer.parsePercentage(cell);
                    if (Rates.isRate(value)) {
                        return Optional.of(value);
                    }
                }
            }
            return Optional.empty();
        }

        @Override
        public String describe() {
            return "fully-met row scan";
        }
    }
}
