package com.fintech.enrichment.job;

/**
 * Receives the single terminal message of a run: {@code "Completed Successfully"},
 * {@code "Stopped"} or {@code "Failed: <detail>"}. Invoked on the worker thread.
 */
@FunctionalInterface
public interface JobCompletionListener {

    JobCompletionListener NONE = message -> { };

    void onCompletion(String message);
}
