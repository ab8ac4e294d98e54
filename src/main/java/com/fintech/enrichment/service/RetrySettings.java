package com.fintech.enrichment.service;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Retry budget and back-off shape for capability calls.
 */
@Value
@Builder
public class RetrySettings {

    /**
     * Retries after the first attempt for transient failures.
     */
    @Builder.Default
    int maxRetries = 3;

    @Builder.Default
    Duration initialDelay = Duration.ofSeconds(2);

    @Builder.Default
    double backoffFactor = 2.0;

    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(60);

    /**
     * Randomises each delay between the current and the next back-off step.
     */
    @Builder.Default
    boolean jitter = true;

    /**
     * Retries allowed for an unparseable language-model answer.
     */
    @Builder.Default
    int malformedResponseRetries = 1;
}
