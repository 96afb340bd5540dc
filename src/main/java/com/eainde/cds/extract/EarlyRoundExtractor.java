package com.eainde.cds.extract;

import com.eainde.cds.ingest.DocumentContent;
import com.eainde.cds.model.EarlyRound;
import com.eainde.cds.rules.TextField;
import com.eainde.cds.rules.TextRuleSet;
import com.eainde.cds.strategy.TextRuleStrategy;

import java.util.Optional;

/**
 * Early Decision and Early Action counts, read from text with an applied rule then an
 * admitted rule. A round is only reported when both numbers resolve.
 */
public class EarlyRoundExtractor {

    private final TextRuleStrategy<Integer> decisionApplied;
    private final TextRuleStrategy<Integer> decisionAdmitted;
    private final TextRuleStrategy<Integer> actionApplied;
    private final TextRuleStrategy<Integer> actionAdmitted;

    public EarlyRoundExtractor(TextRuleSet rules) {
        this.decisionApplied = TextRuleStrategy.count(rules.rule(TextField.EARLY_DECISION_APPLIED));
        this.decisionAdmitted = TextRuleStrategy.count(rules.rule(TextField.EARLY_DECISION_ADMITTED));
        this.actionApplied = TextRuleStrategy.count(rules.rule(TextField.EARLY_ACTION_APPLIED));
        this.actionAdmitted = TextRuleStrategy.count(rules.rule(TextField.EARLY_ACTION_ADMITTED));
    }

    public Optional<EarlyRound> earlyDecision(DocumentContent document) {
        return round(document, decisionApplied, decisionAdmitted);
    }

    public Optional<EarlyRound> earlyAction(DocumentContent document) {
        return round(document, actionApplied, actionAdmitted);
    }

    private static Optional<EarlyRound> round(DocumentContent document,
                                              TextRuleStrategy<Integer> applied,
                                              TextRuleStrategy<Integer> admitted) {
        Optional<Integer> appliedCount = applied.attempt(document);
        if (appliedCount.isEmpty()) return Optional.empty();
        return admitted.attempt(document)
                .map(admittedCount -> new EarlyRound(appliedCount.get(), admittedCount));
    }
}
