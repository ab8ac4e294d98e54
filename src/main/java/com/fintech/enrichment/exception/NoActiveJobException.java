package com.fintech.enrichment.exception;

public class NoActiveJobException extends EnrichmentException {

    public NoActiveJobException() {
        super("No enrichment job has been started");
    }
}
