package com.fintech.enrichment.config;

import com.fintech.enrichment.exception.RetriableCapabilityException;
import com.fintech.enrichment.service.ResilienceExecutor;
import com.fintech.enrichment.service.RetrySettings;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Retry and circuit-breaker setup for capability calls.
 * <p>
 * One circuit breaker per shared capability (search, language-model, place-lookup)
 * protects the batch when a service keeps failing. Website fetches are retried but never
 * tripped, since a dead candidate says nothing about the next site.
 * - CLOSED: normal operation, each attempt goes through
 * - OPEN: the service is failing, attempts are rejected and retried after back-off
 * - HALF_OPEN: testing whether the service has recovered
 * Only transient failures count towards opening the circuit.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(
            @Value("${enrichment.circuit-breaker.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${enrichment.circuit-breaker.wait-duration-seconds:30}") long waitDurationSeconds) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // Number of calls to record before calculating failure rate
                .slidingWindowSize(10)
                .failureRateThreshold(failureRateThreshold)
                // Time to wait before transitioning from OPEN to HALF_OPEN
                .waitDurationInOpenState(Duration.ofSeconds(waitDurationSeconds))
                .permittedNumberOfCallsInHalfOpenState(3)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .recordExceptions(RetriableCapabilityException.class)
                .build();

        return CircuitBreakerRegistry.of(config);
    }

    @Bean
    public RetrySettings retrySettings(
            @Value("${enrichment.retry.max-retries:3}") int maxRetries,
            @Value("${enrichment.retry.initial-delay-ms:2000}") long initialDelayMs,
            @Value("${enrichment.retry.backoff-factor:2.0}") double backoffFactor,
            @Value("${enrichment.retry.max-delay-ms:60000}") long maxDelayMs,
            @Value("${enrichment.retry.jitter:true}") boolean jitter,
            @Value("${enrichment.retry.malformed-response-retries:1}") int malformedResponseRetries) {
        return RetrySettings.builder()
                .maxRetries(maxRetries)
                .initialDelay(Duration.ofMillis(initialDelayMs))
                .backoffFactor(backoffFactor)
                .maxDelay(Duration.ofMillis(maxDelayMs))
                .jitter(jitter)
                .malformedResponseRetries(malformedResponseRetries)
                .build();
    }

    @Bean
    public ResilienceExecutor resilienceExecutor(RetrySettings retrySettings,
                                                 CircuitBreakerRegistry circuitBreakerRegistry) {
        return new ResilienceExecutor(retrySettings, circuitBreakerRegistry);
    }
}
