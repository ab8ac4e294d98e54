package com.fintech.enrichment.exception;

/**
 * Terminal capability failure, e.g. an exhausted daily quota or rejected credentials.
 * Never retried.
 */
public class NonRetriableCapabilityException extends CapabilityException {

    public NonRetriableCapabilityException(String message, String capability) {
        super(message, capability, false);
    }

    public NonRetriableCapabilityException(String message, String capability, Throwable cause) {
        super(message, capability, false, cause);
    }
}
