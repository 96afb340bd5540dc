package com.eainde.cds.assemble;

import com.eainde.cds.config.SchoolProfile;
import com.eainde.cds.extract.AdmissionsExtractor;
import com.eainde.cds.extract.CostsExtractor;
import com.eainde.cds.extract.DemographicsExtractor;
import com.eainde.cds.extract.FinancialAidExtractor;
import com.eainde.cds.extract.GenderedAdmissionsExtractor;
import com.eainde.cds.extract.SectionExtractor;
import com.eainde.cds.extract.TestScoresExtractor;
import com.eainde.cds.ingest.DocumentContent;
import com.eainde.cds.model.Admissions;
import com.eainde.cds.model.Costs;
import com.eainde.cds.model.Demographics;
import com.eainde.cds.model.ExtractedRecord;
import com.eainde.cds.model.FinancialAid;
import com.eainde.cds.model.TestScores;
import com.eainde.cds.rules.TextRuleSet;

import java.util.Objects;

/**
 * Runs the five section extractors over one document and combines their outputs into an
 * {@link ExtractedRecord}. The sections are independent of each other.
 */
public class RecordAssembler {

    private final SectionExtractor<Admissions> admissions;
    private final SectionExtractor<TestScores> testScores;
    private final SectionExtractor<Demographics> demographics;
    private final SectionExtractor<Costs> costs;
    private final SectionExtractor<FinancialAid> financialAid;

    public RecordAssembler(SectionExtractor<Admissions> admissions,
                           SectionExtractor<TestScores> testScores,
                           SectionExtractor<Demographics> demographics,
                           SectionExtractor<Costs> costs,
                           SectionExtractor<FinancialAid> financialAid) {
        this.admissions = Objects.requireNonNull(admissions, "admissions");
        this.testScores = Objects.requireNonNull(testScores, "testScores");
        this.demographics = Objects.requireNonNull(demographics, "demographics");
        this.costs = Objects.requireNonNull(costs, "costs");
        this.financialAid = Objects.requireNonNull(financialAid, "financialAid");
    }

    /**
     * The standard extractors, with the admissions variant, enrollment ranges and line
     * scans the school's profile asks for.
     */
    public static RecordAssembler forProfile(TextRuleSet rules, SchoolProfile profile) {
        SectionExtractor<Admissions> admissions = profile.isGenderedAdmissions()
                ? new GenderedAdmissionsExtractor(rules)
                : new AdmissionsExtractor(rules);
        boolean lineScans = profile.isLineScans();
        return new RecordAssembler(
                admissions,
                new TestScoresExtractor(rules, lineScans),
                new DemographicsExtractor(rules, profile.undergraduateRange(), profile.graduateRange()),
                new CostsExtractor(rules, lineScans),
                new FinancialAidExtractor(rules, lineScans));
    }

    public static RecordAssembler standard() {
        return forProfile(TextRuleSet.STANDARD, SchoolProfile.defaults());
    }

    public ExtractedRecord assemble(DocumentContent document) {
        return new ExtractedRecord(
                admissions.extract(document),
                testScores.extract(document),
                demographics.extract(document),
                costs.extract(document),
                financialAid.extract(document));
    }
}
