package com.fintech.enrichment.exception;

/**
 * Transient capability failure: rate limiting, temporary unavailability,
 * fetch timeouts and HTTP errors.
 */
public class RetriableCapabilityException extends CapabilityException {

    public RetriableCapabilityException(String message, String capability) {
        super(message, capability, true);
    }

    public RetriableCapabilityException(String message, String capability, Throwable cause) {
        super(message, capability, true, cause);
    }
}
