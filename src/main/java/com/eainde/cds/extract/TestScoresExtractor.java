package com.eainde.cds.extract;

import com.eainde.cds.ingest.DocumentContent;
import com.eainde.cds.model.ActScores;
import com.eainde.cds.model.Percentiles;
import com.eainde.cds.model.SatScores;
import com.eainde.cds.model.TestScores;
import com.eainde.cds.rules.TextField;
import com.eainde.cds.rules.TextRuleSet;
import com.eainde.cds.scan.FieldRanges;
import com.eainde.cds.scan.PlausibleRange;
import com.eainde.cds.scan.RowScanRule;
import com.eainde.cds.scan.RowScanRules;
import com.eainde.cds.strategy.FieldCascade;
import com.eainde.cds.strategy.LineScanStrategy;
import com.eainde.cds.strategy.TableScanStrategy;
import com.eainde.cds.strategy.TextRuleStrategy;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * SAT and ACT percentiles (C9).
 *
 * <p>Percentile pairs come from the tables first and from text only when no table row
 * resolves them; schools with line scans enabled try their score lines before either.
 * The SAT composite is the component-wise sum of the two sections whenever both are
 * available; a directly reported composite is used only otherwise.</p>
 */
@Slf4j
public class TestScoresExtractor implements SectionExtractor<TestScores> {

    private final FieldCascade<Percentiles> readingWriting;
    private final FieldCascade<Percentiles> math;
    private final FieldCascade<Percentiles> satComposite;
    private final FieldCascade<Percentiles> actComposite;
    private final FieldCascade<Double> satSubmissionRate;
    private final FieldCascade<Double> actSubmissionRate;

    public TestScoresExtractor(TextRuleSet rules) {
        this(rules, false);
    }

    /**
     * @param lineScans run the {@link LineScanRules} passes ahead of tables and text rules
     */
    public TestScoresExtractor(TextRuleSet rules, boolean lineScans) {
        this.readingWriting = pair("sat.readingWriting", rules, TextField.SAT_READING_WRITING,
                RowScanRules.SAT_READING_WRITING, FieldRanges.SAT_SECTION,
                lineScans ? LineScanRules.satReadingWriting() : null);
        this.math = pair("sat.math", rules, TextField.SAT_MATH,
                RowScanRules.SAT_MATH, FieldRanges.SAT_SECTION,
                lineScans ? LineScanRules.satMath() : null);
        this.satComposite = pair("sat.composite", rules, TextField.SAT_COMPOSITE,
                RowScanRules.SAT_COMPOSITE, FieldRanges.SAT_COMPOSITE,
                lineScans ? LineScanRules.satComposite() : null);
        this.actComposite = pair("act.composite", rules, TextField.ACT_COMPOSITE,
                RowScanRules.ACT_COMPOSITE, FieldRanges.ACT_COMPOSITE,
                lineScans ? LineScanRules.actComposite() : null);
        this.satSubmissionRate = FieldCascade.<Double>named("sat.submissionRate")
                .then(TextRuleStrategy.percentage(rules.rule(TextField.SAT_SUBMISSION_RATE)))
                .build();
        this.actSubmissionRate = FieldCascade.<Double>named("act.submissionRate")
                .then(TextRuleStrategy.percentage(rules.rule(TextField.ACT_SUBMISSION_RATE)))
                .build();
    }

    private static FieldCascade<Percentiles> pair(String name, TextRuleSet rules, TextField field,
                                                  RowScanRule tableRule, PlausibleRange range,
                                                  LineScanStrategy<Percentiles> lineScan) {
        FieldCascade.Builder<Percentiles> cascade = FieldCascade.named(name);
        if (lineScan != null) {
            cascade.then(lineScan);
        }
        return cascade
                .then(TableScanStrategy.pair(tableRule))
                .then(TextRuleStrategy.pair(rules.rule(field), range))
                .build();
    }

    @Override
    public TestScores extract(DocumentContent document) {
        return new TestScores(sat(document).orElse(null), act(document).orElse(null));
    }

    private Optional<SatScores> sat(DocumentContent document) {
        Percentiles rw = readingWriting.resolveOr(document, Percentiles.EMPTY);
        Percentiles m = math.resolveOr(document, Percentiles.EMPTY);

        Percentiles composite;
        if (rw.isResolved() && m.isResolved()) {
            composite = rw.plus(m);
            log.debug("SAT composite summed from sections: [{}, {}]", composite.p25(), composite.p75());
        } else {
            composite = satComposite.resolveOr(document, Percentiles.EMPTY);
        }

        if (!composite.isResolved() && !rw.isResolved() && !m.isResolved()) {
            return Optional.empty();
        }
        return Optional.of(new SatScores(composite, rw, m, satSubmissionRate.resolveOr(document, 0.0)));
    }

    private Optional<ActScores> act(DocumentContent document) {
        return actComposite.resolve(document)
                .map(composite -> new ActScores(composite, actSubmissionRate.resolveOr(document, 0.0)));
    }
}
