package com.eainde.cds.extract;

import com.eainde.cds.extract.AdmissionsTag.Gender;
import com.eainde.cds.extract.AdmissionsTag.Metric;
import com.eainde.cds.ingest.DocumentContent;
import com.eainde.cds.model.Admissions;
import com.eainde.cds.rules.TextRuleSet;
import com.eainde.cds.scan.RowMatcher;
import com.eainde.cds.scan.TableRow;
import com.eainde.cds.scan.TableRowScanner;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.eainde.cds.scan.RowMatcher.containsAll;
import static com.eainde.cds.scan.RowMatcher.containsAny;
import static com.eainde.cds.scan.RowMatcher.containsWord;

/**
 * Admissions for sources that only report per-gender rows.
 *
 * <h3>Reduction</h3>
 * Text lines, then table rows, are each classified into zero or more {@link TaggedCount}s
 * (one per metric the row mentions). The last count seen for a tag wins; the three gender
 * buckets of each metric are then summed into the aggregate.
 *
 * <h3>Classification</h3>
 * <ul>
 *   <li>A row must carry a first-year marker ({@code freshman}, {@code first-time},
 *       {@code first-year}).</li>
 *   <li>Gender branches are exclusive, in order: women, then men as a whole word on a row
 *       without "women", then another gender / unknown.</li>
 *   <li>Enrollment rows must be full-time rows.</li>
 *   <li>The candidate is the first token of the row inside the tag's range.</li>
 * </ul>
 */
@Slf4j
public class GenderedAdmissionsExtractor implements SectionExtractor<Admissions> {

    /**
     * A classified row. {@link AdmissionsTag#UNCLASSIFIED} rows carry 0.
     */
    public record TaggedCount(AdmissionsTag tag, int value) {

        static final TaggedCount UNCLASSIFIED = new TaggedCount(AdmissionsTag.UNCLASSIFIED, 0);
    }

    private static final RowMatcher FIRST_YEAR = containsAny("freshman", "first-time", "first-year");
    private static final RowMatcher WOMEN = containsAll("women");
    private static final RowMatcher MEN = containsWord("men").excluding("women");
    private static final RowMatcher OTHER = containsAny("another gender", "unknown/other");

    private static final RowMatcher APPLIED = containsAll("applied");
    // "admi" survives the glyph loss that turns "admitted" into "admi(cid:425)ed"
    private static final RowMatcher ADMITTED = containsAny("admitted", "admi");
    private static final RowMatcher ENROLLED = containsAll("enrolled").and(containsAny("full-time", "full-"));

    private final EarlyRoundExtractor earlyRounds;

    public GenderedAdmissionsExtractor(TextRuleSet rules) {
        this.earlyRounds = new EarlyRoundExtractor(rules);
    }

    @Override
    public Admissions extract(DocumentContent document) {
        List<TableRow> rows = new ArrayList<>();
        for (String line : document.lines()) {
            rows.add(TableRow.ofLine(line));
        }
        rows.addAll(TableRowScanner.rows(document.tables()));

        Map<AdmissionsTag, Integer> counts = reduce(rows);
        log.debug("Gendered admissions counts: {}", counts);

        return Admissions.of(
                sum(counts, Metric.APPLIED),
                sum(counts, Metric.ADMITTED),
                sum(counts, Metric.ENROLLED),
                earlyRounds.earlyDecision(document).orElse(null),
                earlyRounds.earlyAction(document).orElse(null));
    }

    /**
     * Folds rows into the last count per tag.
     */
    static Map<AdmissionsTag, Integer> reduce(List<TableRow> rows) {
        Map<AdmissionsTag, Integer> counts = new EnumMap<>(AdmissionsTag.class);
        for (TableRow row : rows) {
            for (TaggedCount tagged : classify(row)) {
                if (tagged.tag() != AdmissionsTag.UNCLASSIFIED) {
                    counts.put(tagged.tag(), tagged.value());
                }
            }
        }
        return counts;
    }

    /**
     * @return one entry per metric the row reports, or a single unclassified entry
     */
    static List<TaggedCount> classify(TableRow row) {
        if (!FIRST_YEAR.matches(row)) return List.of(TaggedCount.UNCLASSIFIED);
        Optional<Gender> gender = gender(row);
        if (gender.isEmpty()) return List.of(TaggedCount.UNCLASSIFIED);

        List<TaggedCount> tagged = new ArrayList<>(3);
        if (APPLIED.matches(row)) candidate(row, gender.get(), Metric.APPLIED).ifPresent(tagged::add);
        if (ADMITTED.matches(row)) candidate(row, gender.get(), Metric.ADMITTED).ifPresent(tagged::add);
        if (ENROLLED.matches(row)) candidate(row, gender.get(), Metric.ENROLLED).ifPresent(tagged::add);
        return tagged.isEmpty() ? List.of(TaggedCount.UNCLASSIFIED) : tagged;
    }

    private static Optional<Gender> gender(TableRow row) {
        if (WOMEN.matches(row)) return Optional.of(Gender.WOMEN);
        if (MEN.matches(row)) return Optional.of(Gender.MEN);
        if (OTHER.matches(row)) return Optional.of(Gender.OTHER);
        return Optional.empty();
    }

    private static Optional<TaggedCount> candidate(TableRow row, Gender gender, Metric metric) {
        AdmissionsTag tag = AdmissionsTag.of(gender, metric).orElseThrow();
        for (Integer value : row.candidates()) {
            if (tag.range().contains(value)) {
                return Optional.of(new TaggedCount(tag, value));
            }
        }
        return Optional.empty();
    }

    private static int sum(Map<AdmissionsTag, Integer> counts, Metric metric) {
        int total = 0;
        for (Map.Entry<AdmissionsTag, Integer> entry : counts.entrySet()) {
            if (entry.getKey().metric() == metric) {
                total += entry.getValue();
            }
        }
        return total;
    }
}
