package com.eainde.cds.scan;

import com.eainde.cds.numeric.NumericNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One table row prepared for classification.
 *
 * @param cells the raw cells, nullable
 * @param key   lower-case concatenation of the non-null cells, separated by single spaces
 */
public record TableRow(List<String> cells, String key) {

    public TableRow {
        cells = Collections.unmodifiableList(new ArrayList<>(cells));
    }

    public static TableRow of(List<String> cells) {
        String key = cells.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.joining(" "))
                .toLowerCase(Locale.ROOT);
        return new TableRow(cells, key);
    }

    /** A line of prose treated as a single-cell row. */
    public static TableRow ofLine(String line) {
        return of(Collections.singletonList(line));
    }

    public boolean contains(String keyword) {
        return key.contains(keyword);
    }

    /**
     * Every numeric value of every cell, in cell order. Non-numeric cells contribute nothing.
     *
     * @see NumericNormalizer#cellValues(String)
     */
    public List<Integer> candidates() {
        List<Integer> values = new ArrayList<>();
        for (String cell : cells) {
            values.addAll(NumericNormalizer.cellValues(cell));
        }
        return values;
    }
}
