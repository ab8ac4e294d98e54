package com.fintech.enrichment.exception;

public class TableReadException extends EnrichmentException {

    public TableReadException(String message) {
        super(message);
    }

    public TableReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
