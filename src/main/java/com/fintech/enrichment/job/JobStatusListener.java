package com.fintech.enrichment.job;

/**
 * Receives progress after every row. Invoked on the worker thread.
 */
@FunctionalInterface
public interface JobStatusListener {

    JobStatusListener NONE = (processed, total, message) -> { };

    void onStatus(int processedCount, int totalCount, String message);
}
