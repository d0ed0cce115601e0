package com.docaudit.core.source;

/**
 * Thrown when the requested documents cannot be enumerated or read.
 * Aborts the run before any report is produced.
 */
public class DocumentSourceException extends RuntimeException {

    public DocumentSourceException(String message) {
        super(message);
    }

    public DocumentSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
