package com.eainde.cds.extract;

import com.eainde.cds.ingest.DocumentContent;
import com.eainde.cds.model.Admissions;
import com.eainde.cds.rules.TextField;
import com.eainde.cds.rules.TextRuleSet;
import com.eainde.cds.scan.RowScanRules;
import com.eainde.cds.strategy.FieldCascade;
import com.eainde.cds.strategy.TableScanStrategy;
import com.eainde.cds.strategy.TextRuleStrategy;

/**
 * First-time, first-year admissions (C1) plus the optional early rounds (C21/C22).
 *
 * <p>Each count is resolved from text first; the table scan only fills a count the text
 * rules left unresolved. Rates are derived from the counts.</p>
 */
public class AdmissionsExtractor implements SectionExtractor<Admissions> {

    private final FieldCascade<Integer> applied;
    private final FieldCascade<Integer> admitted;
    private final FieldCascade<Integer> enrolled;
    private final EarlyRoundExtractor earlyRounds;

    public AdmissionsExtractor(TextRuleSet rules) {
        this.applied = FieldCascade.<Integer>named("admissions.applied")
                .then(TextRuleStrategy.count(rules.rule(TextField.APPLIED)))
                .then(TableScanStrategy.count(RowScanRules.APPLIED))
                .build();
        this.admitted = FieldCascade.<Integer>named("admissions.admitted")
                .then(TextRuleStrategy.count(rules.rule(TextField.ADMITTED)))
                .then(TableScanStrategy.count(RowScanRules.ADMITTED))
                .build();
        this.enrolled = FieldCascade.<Integer>named("admissions.enrolled")
                .then(TextRuleStrategy.count(rules.rule(TextField.ENROLLED)))
                .then(TableScanStrategy.count(RowScanRules.ENROLLED))
                .build();
        this.earlyRounds = new EarlyRoundExtractor(rules);
    }

    @Override
    public Admissions extract(DocumentContent document) {
        return Admissions.of(
                applied.resolveOr(document, 0),
                admitted.resolveOr(document, 0),
                enrolled.resolveOr(document, 0),
                earlyRounds.earlyDecision(document).orElse(null),
                earlyRounds.earlyAction(document).orElse(null));
    }
}
