package com.eainde.cds.period;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Infers the reporting period label from a document's file name.
 *
 * <pre>
 * "CDS_2024-2025.pdf"             → "2024-2025"
 * "Brown CDS_2016_2017_Final.pdf" → "2016-2017"
 * "cds2019.pdf"                   → "2019-2020"
 * "common-data-set.pdf"           → "unknown"
 * </pre>
 */
public final class ReportingPeriodResolver {

    public static final String UNKNOWN = "unknown";

    private static final Pattern YEAR_PAIR = Pattern.compile("(\\d{4})[-_](\\d{4})");
    private static final Pattern SINGLE_YEAR = Pattern.compile("(\\d{4})");

    private ReportingPeriodResolver() {}

    public static String resolve(String fileName) {
        if (fileName == null) return UNKNOWN;

        Matcher pair = YEAR_PAIR.matcher(fileName);
        if (pair.find()) {
            return pair.group(1) + "-" + pair.group(2);
        }
        Matcher single = SINGLE_YEAR.matcher(fileName);
        if (single.find()) {
            int year = Integer.parseInt(single.group(1));
            return year + "-" + (year + 1);
        }
        return UNKNOWN;
    }
}
