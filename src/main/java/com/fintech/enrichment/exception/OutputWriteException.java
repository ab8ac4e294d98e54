package com.fintech.enrichment.exception;

/**
 * Writing the output table failed. Fatal to the run; the checkpoint is kept
 * so the job can be retried from the last good state.
 */
public class OutputWriteException extends EnrichmentException {

    public OutputWriteException(String message) {
        super(message);
    }

    public OutputWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
