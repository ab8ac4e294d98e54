package com.fintech.enrichment.exception;

/**
 * Base exception for merchant enrichment errors.
 */
public class EnrichmentException extends RuntimeException {

    public EnrichmentException(String message) {
        super(message);
    }

    public EnrichmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
