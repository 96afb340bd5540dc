package com.eainde.cds.ingest;

/**
 * A document could not be opened or parsed. Raised per document; batch processing
 * records it and moves on to the next document.
 */
public class DocumentIngestionException extends RuntimeException {

    public DocumentIngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
