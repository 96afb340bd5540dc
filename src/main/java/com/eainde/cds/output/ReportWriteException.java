package com.eainde.cds.output;

/**
 * Thrown when a report cannot be serialized or written.
 */
public class ReportWriteException extends RuntimeException {

    public ReportWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
