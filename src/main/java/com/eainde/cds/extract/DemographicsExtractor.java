package com.eainde.cds.extract;

import com.eainde.cds.ingest.DocumentContent;
import com.eainde.cds.model.Demographics;
import com.eainde.cds.model.Enrollment;
import com.eainde.cds.model.RaceCategory;
import com.eainde.cds.model.Residency;
import com.eainde.cds.rules.TextField;
import com.eainde.cds.rules.TextRuleSet;
import com.eainde.cds.scan.FieldRanges;
import com.eainde.cds.scan.PlausibleRange;
import com.eainde.cds.scan.RowScanRules;
import com.eainde.cds.scan.TableRow;
import com.eainde.cds.scan.TableRowScanner;
import com.eainde.cds.strategy.FieldCascade;
import com.eainde.cds.strategy.TableScanStrategy;
import com.eainde.cds.strategy.TextRuleStrategy;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Enrollment (B1), race/ethnicity (B2) and residency.
 *
 * <h3>Race/ethnicity</h3>
 * Every table row is matched against the category keywords in {@link RaceCategory}
 * declaration order; the first keyword found decides the row's category and the row's
 * largest in-range number is its count. The first row of a category wins, deliberately:
 * later rows for a category that already holds a count are ignored, never folded in as a
 * last-row-wins overwrite. "Non-Hispanic" qualifiers are masked before matching.
 *
 * <h3>Residency</h3>
 * In-state and out-of-state counts come from rows that are not about prices. International
 * mirrors the nonresident race/ethnicity count.
 */
@Slf4j
public class DemographicsExtractor implements SectionExtractor<Demographics> {

    private static final Pattern NON_HISPANIC = Pattern.compile("non[-\\s]?hispanic");

    private final FieldCascade<Integer> undergraduate;
    private final FieldCascade<Integer> graduate;
    private final FieldCascade<Integer> inState;
    private final FieldCascade<Integer> outOfState;

    public DemographicsExtractor(TextRuleSet rules) {
        this(rules, FieldRanges.UNDERGRADUATE, FieldRanges.GRADUATE);
    }

    /**
     * @param undergraduateRange institution-scale range for undergraduate headcount
     * @param graduateRange      institution-scale range for graduate headcount
     */
    public DemographicsExtractor(TextRuleSet rules, PlausibleRange undergraduateRange,
                                 PlausibleRange graduateRange) {
        this.undergraduate = FieldCascade.<Integer>named("enrollment.undergraduate")
                .then(TextRuleStrategy.count(rules.rule(TextField.UNDERGRADUATE_ENROLLMENT), undergraduateRange))
                .then(TableScanStrategy.count(RowScanRules.UNDERGRADUATE.withRange(undergraduateRange)))
                .build();
        this.graduate = FieldCascade.<Integer>named("enrollment.graduate")
                .then(TextRuleStrategy.count(rules.rule(TextField.GRADUATE_ENROLLMENT), graduateRange))
                .then(TableScanStrategy.count(RowScanRules.GRADUATE.withRange(graduateRange)))
                .build();
        this.inState = FieldCascade.<Integer>named("residency.inState")
                .then(TableScanStrategy.count(RowScanRules.IN_STATE))
                .build();
        this.outOfState = FieldCascade.<Integer>named("residency.outOfState")
                .then(TableScanStrategy.count(RowScanRules.OUT_OF_STATE))
                .build();
    }

    @Override
    public Demographics extract(DocumentContent document) {
        Enrollment enrollment = Enrollment.of(
                undergraduate.resolveOr(document, 0),
                graduate.resolveOr(document, 0));

        Map<RaceCategory, Integer> byRace = raceCounts(TableRowScanner.rows(document.tables()));

        Residency residency = new Residency(
                inState.resolveOr(document, 0),
                outOfState.resolveOr(document, 0),
                byRace.getOrDefault(RaceCategory.INTERNATIONAL, 0));

        return Demographics.of(enrollment, byRace, residency);
    }

    static Map<RaceCategory, Integer> raceCounts(List<TableRow> rows) {
        Map<RaceCategory, Integer> counts = new EnumMap<>(RaceCategory.class);
        for (TableRow row : rows) {
            Optional<RaceCategory> category = categorize(row);
            if (category.isEmpty() || counts.containsKey(category.get())) continue;

            Optional<Integer> largest = row.candidates().stream()
                    .filter(FieldRanges.RACE::contains)
                    .max(Integer::compare);
            if (largest.isPresent()) {
                counts.put(category.get(), largest.get());
                log.debug("Race/ethnicity {} = {}", category.get().key(), largest.get());
            }
        }
        return Collections.unmodifiableMap(counts);
    }

    static Optional<RaceCategory> categorize(TableRow row) {
        String key = NON_HISPANIC.matcher(row.key()).replaceAll(" ");
        for (RaceCategory category : RaceCategory.values()) {
            for (String keyword : category.keywords()) {
                if (key.contains(keyword)) {
                    return Optional.of(category);
                }
            }
        }
        return Optional.empty();
    }
}
