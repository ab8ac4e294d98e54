package com.fintech.enrichment.exception;

/**
 * Thrown when resolving a row is cut short by an error. Carries the cost already
 * spent on the row so the failure record still accounts for it.
 */
public class ResolutionAbortedException extends EnrichmentException {

    private final double partialCost;

    public ResolutionAbortedException(Throwable cause, double partialCost) {
        super(cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage(), cause);
        this.partialCost = partialCost;
    }

    public double getPartialCost() {
        return partialCost;
    }
}
