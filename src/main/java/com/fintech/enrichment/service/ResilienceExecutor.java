package com.fintech.enrichment.service;

import com.fintech.enrichment.exception.MalformedModelResponseException;
import com.fintech.enrichment.exception.RetriableCapabilityException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryPolicy;
import org.springframework.retry.backoff.ExponentialBackOffPolicy;
import org.springframework.retry.backoff.ExponentialRandomBackOffPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.ExceptionClassifierRetryPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs every external capability call with retry, back-off and a circuit breaker.
 * <p>
 * Classification:
 * - {@link RetriableCapabilityException}: retried up to {@code maxRetries} times with
 *   exponential back-off, then re-raised
 * - {@link MalformedModelResponseException}: retried {@code malformedResponseRetries} times
 * - anything else (quota exhaustion, unclassified errors): re-raised immediately
 * <p>
 * One circuit breaker per capability guards each attempt and records only transient
 * failures. An attempt rejected by an open breaker counts as a transient failure, so it
 * is retried after back-off like any other and the row only fails once retries run out.
 * Calls whose failures are specific to their target (one website among many) go through
 * {@link #retry(String, Supplier)} and bypass the breaker.
 */
@Slf4j
public class ResilienceExecutor {

    private final RetrySettings settings;
    private final RetryTemplate retryTemplate;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    public ResilienceExecutor(RetrySettings settings, CircuitBreakerRegistry circuitBreakerRegistry) {
        this(settings, circuitBreakerRegistry, new ThreadWaitSleeper());
    }

    public ResilienceExecutor(RetrySettings settings, CircuitBreakerRegistry circuitBreakerRegistry,
                              Sleeper sleeper) {
        this.settings = settings;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.retryTemplate = buildRetryTemplate(settings, sleeper);
    }

    /**
     * Executes one capability call.
     *
     * @param capability name used for the circuit breaker and logging ("search", "language-model", ...)
     * @param call       the external call
     * @return the call's result
     */
    public <T> T call(String capability, Supplier<T> call) {
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(capability);
        return execute(capability, () -> {
            try {
                return circuitBreaker.executeSupplier(call);
            } catch (CallNotPermittedException e) {
                log.warn("Circuit breaker for {} is open, rejecting attempt", capability);
                throw new RetriableCapabilityException(
                        "Circuit breaker open for " + capability + ", service temporarily unavailable", capability, e);
            }
        });
    }

    /**
     * Executes one call with retry and back-off only. Used where a failure says something
     * about the target rather than about the capability, e.g. a dead website candidate.
     */
    public <T> T retry(String capability, Supplier<T> call) {
        return execute(capability, call);
    }

    private <T> T execute(String capability, Supplier<T> attempt) {
        try {
            return retryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("Retrying {} call (attempt {}) after {}: {}",
                            capability,
                            context.getRetryCount() + 1,
                            context.getLastThrowable().getClass().getSimpleName(),
                            context.getLastThrowable().getMessage());
                }
                return attempt.get();
            });
        } catch (RetriableCapabilityException e) {
            log.error("{} call failed after retries: {}", capability, e.getMessage());
            throw e;
        }
    }

    public RetrySettings getSettings() {
        return settings;
    }

    private static RetryTemplate buildRetryTemplate(RetrySettings settings, Sleeper sleeper) {
        Map<Class<? extends Throwable>, RetryPolicy> policies = new HashMap<>();
        policies.put(RetriableCapabilityException.class, new SimpleRetryPolicy(settings.getMaxRetries() + 1));
        policies.put(MalformedModelResponseException.class,
                new SimpleRetryPolicy(settings.getMalformedResponseRetries() + 1));

        // Unclassified exceptions fall through to a never-retry policy
        ExceptionClassifierRetryPolicy retryPolicy = new ExceptionClassifierRetryPolicy();
        retryPolicy.setPolicyMap(policies);

        ExponentialBackOffPolicy backOffPolicy = settings.isJitter()
                ? new ExponentialRandomBackOffPolicy()
                : new ExponentialBackOffPolicy();
        backOffPolicy.setInitialInterval(settings.getInitialDelay().toMillis());
        backOffPolicy.setMultiplier(settings.getBackoffFactor());
        backOffPolicy.setMaxInterval(settings.getMaxDelay().toMillis());
        backOffPolicy.setSleeper(sleeper);

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(retryPolicy);
        template.setBackOffPolicy(backOffPolicy);
        return template;
    }
}
