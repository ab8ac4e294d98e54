package com.fintech.enrichment.exception;

/**
 * Thrown when a call to an external capability (search, language model,
 * website fetch, place lookup) fails.
 * <p>
 * The retryable flag drives the resilience layer: retryable failures are
 * retried with back-off, everything else is re-raised immediately.
 */
public abstract class CapabilityException extends EnrichmentException {

    private final String capability;
    private final boolean isRetryable;

    protected CapabilityException(String message, String capability, boolean isRetryable) {
        super(message);
        this.capability = capability;
        this.isRetryable = isRetryable;
    }

    protected CapabilityException(String message, String capability, boolean isRetryable, Throwable cause) {
        super(message, cause);
        this.capability = capability;
        this.isRetryable = isRetryable;
    }

    public String getCapability() {
        return capability;
    }

    public boolean isRetryable() {
        return isRetryable;
    }
}
