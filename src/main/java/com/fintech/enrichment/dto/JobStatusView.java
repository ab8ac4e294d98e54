package com.fintech.enrichment.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Snapshot of a job's progress for the REST surface.
 */
@Value
@Builder
public class JobStatusView {
    String jobId;
    String inputPath;
    boolean running;
    boolean paused;
    int processedCount;
    int totalCount;
    int lastProcessedRow;
    String message;
    String completionMessage;
}
