package com.eainde.cds.extract;

import com.eainde.cds.ingest.DocumentContent;
import com.eainde.cds.ingest.RawTable;
import com.eainde.cds.model.FinancialAid;
import com.eainde.cds.rules.TextRuleSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FinancialAidExtractorTest {

    private final FinancialAidExtractor extractor = new FinancialAidExtractor(TextRuleSet.STANDARD);

    @Test
    @DisplayName("should read percentages as fractions and amounts as counts")
    void fromText() {
        String text = String.join("\n",
                "Percent of students receiving aid 62%",
                "Average financial aid package $52,000",
                "Average need-based grant award $48,000",
                "Percent of need fully met 100%");

        FinancialAid aid = extractor.extract(DocumentContent.textOnly(text));

        assertThat(aid).isEqualTo(new FinancialAid(0.62, 52000, 48000, 1.0));
    }

    @Test
    @DisplayName("the fully-met row scan takes the first cell that reads as a rate")
    void fullyMetRow() {
        RawTable table = RawTable.of(List.of(
                List.of("Percent of need fully met", "n/a", "72%", "80%"),
                List.of("Average need-based grant", "$45,500")));

        FinancialAid aid = extractor.extract(DocumentContent.of("", List.of(table)));

        assertThat(aid.percentNeedFullyMet()).isEqualTo(0.72);
        assertThat(aid.averageNeedBasedGrant()).isEqualTo(45500);
    }

    @Test
    @DisplayName("implausible percentages are left unresolved")
    void implausiblePercentage() {
        FinancialAid aid = extractor.extract(DocumentContent.textOnly("Percent of students receiving aid 250%"));

        assertThat(aid.percentReceivingAid()).isZero();
    }
}
