package com.eainde.cds.ingest;

import com.eainde.cds.numeric.NumericNormalizer;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Everything the extraction engine reads from one document: the full text (pages joined
 * by newlines) and the tables found on its pages. Read-only.
 *
 * <p>Numbers split around a thousands separator by text extraction ("60 ,123") are repaired
 * on construction.</p>
 */
public record DocumentContent(String text, List<RawTable> tables) {

    private static final Pattern LINE_BREAK = Pattern.compile("\\R");

    public DocumentContent {
        text = text == null ? "" : NumericNormalizer.repairSplitNumbers(text);
        tables = tables == null ? List.of() : List.copyOf(tables);
    }

    public static DocumentContent of(String text, List<RawTable> tables) {
        return new DocumentContent(text, tables);
    }

    public static DocumentContent textOnly(String text) {
        return new DocumentContent(text, List.of());
    }

    /**
     * @return the text split into lines, blank lines included
     */
    public List<String> lines() {
        if (text.isEmpty()) return List.of();
        return List.of(LINE_BREAK.split(text));
    }
}
