package com.eainde.cds.extract;

import com.eainde.cds.extract.GenderedAdmissionsExtractor.TaggedCount;
import com.eainde.cds.ingest.DocumentContent;
import com.eainde.cds.model.Admissions;
import com.eainde.cds.rules.TextRuleSet;
import com.eainde.cds.scan.TableRow;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GenderedAdmissionsExtractorTest {

    private final GenderedAdmissionsExtractor extractor = new GenderedAdmissionsExtractor(TextRuleSet.STANDARD);

    private static List<TaggedCount> classify(String line) {
        return GenderedAdmissionsExtractor.classify(TableRow.ofLine(line));
    }

    // =========================================================================
    //  Classification
    // =========================================================================

    @Nested
    @DisplayName("Row classification")
    class Classification {

        @Test
        @DisplayName("'women' rows are never counted as men")
        void womenNotMen() {
            assertThat(classify("Total first-year women who applied 60,000"))
                    .containsExactly(new TaggedCount(AdmissionsTag.WOMEN_APPLIED, 60000));
        }

        @Test
        @DisplayName("'men' is matched as a whole word")
        void menWholeWord() {
            assertThat(classify("Total first-year men who applied 45,000"))
                    .containsExactly(new TaggedCount(AdmissionsTag.MEN_APPLIED, 45000));
        }

        @Test
        @DisplayName("rows without a first-year marker are unclassified")
        void needsFirstYearMarker() {
            assertThat(classify("Men who applied 45,000"))
                    .extracting(TaggedCount::tag)
                    .containsExactly(AdmissionsTag.UNCLASSIFIED);
        }

        @Test
        @DisplayName("the glyph-damaged 'admi' spelling counts as admitted")
        void glyphLoss() {
            assertThat(classify("First-time, first-year women admi(cid:425)ed 5,500"))
                    .containsExactly(new TaggedCount(AdmissionsTag.WOMEN_ADMITTED, 5500));
        }

        @Test
        @DisplayName("enrollment rows must be full-time")
        void fullTimeOnly() {
            assertThat(classify("First-year men who enrolled 2,500"))
                    .extracting(TaggedCount::tag)
                    .containsExactly(AdmissionsTag.UNCLASSIFIED);
            assertThat(classify("Full-time, first-year men who enrolled 2,500"))
                    .containsExactly(new TaggedCount(AdmissionsTag.MEN_ENROLLED, 2500));
        }

        @Test
        @DisplayName("the first in-range token is the candidate")
        void firstInRange() {
            assertThat(classify("First-year another gender applied 5 of 1,200"))
                    .containsExactly(new TaggedCount(AdmissionsTag.OTHER_APPLIED, 1200));
        }

        @Test
        @DisplayName("a later row with the same tag replaces an earlier one")
        void lastRowWins() {
            Map<AdmissionsTag, Integer> counts = GenderedAdmissionsExtractor.reduce(List.of(
                    TableRow.ofLine("First-year women applied 50,000"),
                    TableRow.ofLine("First-year women applied 60,000")));

            assertThat(counts).containsExactly(Map.entry(AdmissionsTag.WOMEN_APPLIED, 60000));
        }
    }

    // =========================================================================
    //  Aggregation
    // =========================================================================

    @Test
    @DisplayName("should sum the gender buckets of each metric")
    void sumsBuckets() {
        String text = String.join("\n",
                "Total first-time, first-year men who applied 45,000",
                "Total first-time, first-year women who applied 60,000",
                "Total first-time, first-year another gender who applied 1,200",
                "Total first-time, first-year men who were admitted 4,000",
                "Total first-time, first-year women who were admitted 5,500",
                "Total first-time, first-year another gender who were admitted 120",
                "Total full-time, first-time, first-year men who enrolled 2,500",
                "Total full-time, first-time, first-year women who enrolled 3,400",
                "Total full-time, first-time, first-year another gender who enrolled 40");

        Admissions admissions = extractor.extract(DocumentContent.textOnly(text));

        assertThat(admissions.applied()).isEqualTo(106200);
        assertThat(admissions.admitted()).isEqualTo(9620);
        assertThat(admissions.enrolled()).isEqualTo(5940);
        assertThat(admissions.acceptanceRate()).isEqualTo(0.0906);
        assertThat(admissions.yield()).isEqualTo(0.6175);
    }
}
