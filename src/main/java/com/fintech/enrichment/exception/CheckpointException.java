package com.fintech.enrichment.exception;

public class CheckpointException extends EnrichmentException {

    public CheckpointException(String message, Throwable cause) {
        super(message, cause);
    }
}
