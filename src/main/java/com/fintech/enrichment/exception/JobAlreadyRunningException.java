package com.fintech.enrichment.exception;

public class JobAlreadyRunningException extends EnrichmentException {

    public JobAlreadyRunningException(String jobId) {
        super("Job " + jobId + " is already running");
    }
}
