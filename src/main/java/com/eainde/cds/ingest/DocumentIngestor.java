package com.eainde.cds.ingest;

import java.nio.file.Path;

/**
 * Turns a binary document into text and tables.
 */
public interface DocumentIngestor {

    /**
     * @param document path of the document to read
     * @return its text and tables
     * @throws DocumentIngestionException when the document cannot be opened or parsed
     */
    DocumentContent ingest(Path document);
}
