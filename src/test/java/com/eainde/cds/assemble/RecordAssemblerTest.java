package com.eainde.cds.assemble;

import com.eainde.cds.config.SchoolProfile;
import com.eainde.cds.ingest.DocumentContent;
import com.eainde.cds.ingest.RawTable;
import com.eainde.cds.model.Admissions;
import com.eainde.cds.model.Costs;
import com.eainde.cds.model.ExtractedRecord;
import com.eainde.cds.model.FinancialAid;
import com.eainde.cds.model.Percentiles;
import com.eainde.cds.model.TestScores;
import com.eainde.cds.rules.TextRuleSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecordAssemblerTest {

    private static final String REPORT_TEXT = String.join("\n",
            "C1 Total first-time, first-year applicants 12,345",
            "Total first-time, first-year admitted 2,000",
            "SAT Evidence-Based Reading and Writing 600 - 700",
            "SAT Math 620 - 780",
            "Tuition: $58,000",
            "Required fees: $1,200",
            "Room and board: $16,000");

    private final RecordAssembler assembler = RecordAssembler.standard();

    // =========================================================================
    //  Assembly
    // =========================================================================

    @Nested
    @DisplayName("Assembly")
    class Assembly {

        @Test
        @DisplayName("should combine the sections of one document")
        void combines() {
            ExtractedRecord record = assembler.assemble(DocumentContent.textOnly(REPORT_TEXT));

            assertThat(record.admissions().applied()).isEqualTo(12345);
            assertThat(record.admissions().acceptanceRate()).isEqualTo(0.162);
            assertThat(record.testScores().sat().composite()).isEqualTo(new Percentiles(1220, 1350, 1480));
            assertThat(record.costs().totalCOA()).isEqualTo(75200);
        }

        @Test
        @DisplayName("should be idempotent")
        void idempotent() {
            RawTable table = RawTable.of(List.of(
                    List.of("Total applicants", "12,000", "men", "6,500"),
                    List.of("Hispanic/Latino", "1,200")));
            DocumentContent document = DocumentContent.of(REPORT_TEXT, List.of(table));

            assertThat(assembler.assemble(document)).isEqualTo(assembler.assemble(document));
        }

        @Test
        @DisplayName("a document without tables still yields its text fields, the rest default to 0")
        void textOnly() {
            ExtractedRecord record = assembler.assemble(DocumentContent.textOnly(
                    "Total first-time, first-year applicants 12,345"));

            assertThat(record.admissions()).isEqualTo(Admissions.of(12345, 0, 0));
            assertThat(record.testScores()).isEqualTo(TestScores.NONE);
            assertThat(record.demographics().enrollment().total()).isZero();
            assertThat(record.costs()).isEqualTo(Costs.of(0, 0, 0));
            assertThat(record.financialAid()).isEqualTo(new FinancialAid(0.0, 0, 0, 0.0));
        }
    }

    // =========================================================================
    //  Profiles
    // =========================================================================

    @Test
    @DisplayName("a gendered profile switches the admissions variant")
    void genderedProfile() {
        SchoolProfile profile = new SchoolProfile();
        profile.setGenderedAdmissions(true);
        RecordAssembler gendered = RecordAssembler.forProfile(TextRuleSet.STANDARD, profile);
        String text = String.join("\n",
                "First-year men who applied 45,000",
                "First-year women who applied 60,000");

        ExtractedRecord record = gendered.assemble(DocumentContent.textOnly(text));

        assertThat(record.admissions().applied()).isEqualTo(105000);
    }

    @Test
    @DisplayName("a line-scan profile reads costs and scores from prose lines")
    void lineScanProfile() {
        SchoolProfile profile = new SchoolProfile();
        profile.setLineScans(true);
        RecordAssembler lineScans = RecordAssembler.forProfile(TextRuleSet.STANDARD, profile);
        String text = String.join("\n",
                "ACT Composite 29 34",
                "Tuition: in-state $13,500; out-of-state $43,200");

        ExtractedRecord record = lineScans.assemble(DocumentContent.textOnly(text));

        assertThat(record.costs().tuition()).isEqualTo(43200);
        assertThat(record.testScores().act().composite()).isEqualTo(new Percentiles(29, 31, 34));
    }
}
