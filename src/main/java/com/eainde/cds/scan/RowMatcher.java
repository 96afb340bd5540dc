package com.eainde.cds.scan;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides whether a row is claimed for a field. Keywords are matched against the row's
 * lower-case {@link TableRow#key()}.
 */
@FunctionalInterface
public interface RowMatcher {

    boolean matches(TableRow row);

    // =========================================================================
    //  Factories
    // =========================================================================

    static RowMatcher containsAll(String... keywords) {
        return row -> {
            for (String keyword : keywords) {
                if (!row.contains(keyword)) return false;
            }
            return true;
        };
    }

    static RowMatcher containsAny(String... keywords) {
        return row -> {
            for (String keyword : keywords) {
                if (row.contains(keyword)) return true;
            }
            return false;
        };
    }

    static RowMatcher startsWith(String prefix) {
        return row -> row.key().stripLeading().startsWith(prefix);
    }

    /** Whole-word match, so "men" is not found inside "women". */
    static RowMatcher containsWord(String word) {
        Pattern pattern = Pattern.compile("\\b" + Pattern.quote(word.toLowerCase(Locale.ROOT)) + "\\b");
        return row -> pattern.matcher(row.key()).find();
    }

    // =========================================================================
    //  Combinators
    // =========================================================================

    default RowMatcher and(RowMatcher other) {
        return row -> matches(row) && other.matches(row);
    }

    default RowMatcher or(RowMatcher other) {
        return row -> matches(row) || other.matches(row);
    }

    /** Rejects rows mentioning any of the keywords, even when this matcher claims them. */
    default RowMatcher excluding(String... keywords) {
        RowMatcher excluded = containsAny(keywords);
        return row -> matches(row) && !excluded.matches(row);
    }
}
