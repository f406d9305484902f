package com.purchasingpower.testgen.client;

import com.purchasingpower.testgen.exception.CircuitBreakerOpenException;
import com.purchasingpower.testgen.exception.ErrorCategory;
import com.purchasingpower.testgen.exception.GenerationBackendException;
import com.purchasingpower.testgen.service.resilience.CircuitBreaker;
import com.purchasingpower.testgen.service.resilience.RetryExecutor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Wraps a backend with retry and a circuit breaker.
 *
 * <p>The breaker sits outside the retry loop: it records one outcome per
 * {@link #generate} call, after retries are exhausted. One instance, and so one
 * breaker, is shared by every task of a run.
 *
 * <p>Failures leave as {@link GenerationBackendException}; a rejected call
 * while the breaker is OPEN is reported with category PROVIDER and zero attempts.
 */
@Slf4j
public class ResilientGenerationBackend implements GenerationBackend {

    @Getter
    private final GenerationBackend delegate;
    @Getter
    private final CircuitBreaker circuitBreaker;
    private final RetryExecutor retryExecutor;

    public ResilientGenerationBackend(GenerationBackend delegate, RetryExecutor retryExecutor,
                                      CircuitBreaker circuitBreaker) {
        this.delegate = delegate;
        this.retryExecutor = retryExecutor;
        this.circuitBreaker = circuitBreaker;
    }

    @Override
    public GenerationResponse generate(GenerationRequest request) {
        try {
            return circuitBreaker.call(() ->
                    retryExecutor.execute(delegate.getProviderName() + " generation",
                            () -> delegate.generate(request)));
        } catch (CircuitBreakerOpenException e) {
            log.warn("Skipping {} call: {}", delegate.getProviderName(), e.getMessage());
            throw new GenerationBackendException(e.getMessage(), ErrorCategory.PROVIDER, false,
                    delegate.getProviderName(), 0, e);
        }
    }

    @Override
    public String getProviderName() {
        return delegate.getProviderName();
    }

    @Override
    public String getModel() {
        return delegate.getModel();
    }
}
