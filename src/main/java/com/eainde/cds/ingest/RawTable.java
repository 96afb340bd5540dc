package com.eainde.cds.ingest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One table as handed over by ingestion: ordered rows of ordered, nullable cell strings.
 */
public record RawTable(List<List<String>> rows) {

    public RawTable {
        List<List<String>> copy = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            // cells may be null, so List.copyOf is not an option
            copy.add(row == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(row)));
        }
        rows = Collections.unmodifiableList(copy);
    }

    public static RawTable of(List<List<String>> rows) {
        return new RawTable(rows);
    }
}
