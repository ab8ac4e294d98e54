package com.fintech.enrichment.exception;

import java.util.List;

/**
 * Raised by {@code start()} when a job cannot be started: missing input,
 * unwritable output location, invalid credentials or an invalid row range.
 * No worker is created when this is thrown.
 */
public class PreflightException extends EnrichmentException {

    private final List<String> problems;

    public PreflightException(List<String> problems) {
        super("Preflight checks failed: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
