package com.purchasingpower.testgen.service.resilience;

import com.purchasingpower.testgen.exception.CircuitBreakerOpenException;
import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Stops calling a failing dependency for a cool-down period.
 *
 * <p>CLOSED opens after {@code failureThreshold} consecutive failures. OPEN
 * rejects every call with {@link CircuitBreakerOpenException}, without invoking
 * it, until {@code recoveryTimeout} has passed since the last failure; the next
 * call then runs in HALF_OPEN. Success in any state resets to CLOSED, failure
 * in HALF_OPEN reopens the circuit.
 *
 * <p>All state reads and transitions happen under the instance monitor. The
 * wrapped call itself runs outside of it.
 */
@Slf4j
public class CircuitBreaker {

    private final String name;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final Clock clock;

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private Instant lastFailureTime;

    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout, Clock clock) {
        Preconditions.checkArgument(failureThreshold >= 1, "failureThreshold must be at least 1");
        Preconditions.checkNotNull(recoveryTimeout, "recoveryTimeout must not be null");
        this.name = name;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.clock = clock;
    }

    public CircuitBreaker(String name, int failureThreshold, Duration recoveryTimeout) {
        this(name, failureThreshold, recoveryTimeout, Clock.systemUTC());
    }

    public <T> T call(Supplier<T> supplier) {
        acquirePermission();
        T result;
        try {
            result = supplier.get();
        } catch (RuntimeException e) {
            onFailure();
            throw e;
        }
        onSuccess();
        return result;
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    public String getName() {
        return name;
    }

    private synchronized void acquirePermission() {
        if (state != CircuitState.OPEN) {
            return;
        }
        if (lastFailureTime != null
                && !clock.instant().isBefore(lastFailureTime.plus(recoveryTimeout))) {
            log.info("Circuit breaker '{}' moving to HALF_OPEN", name);
            state = CircuitState.HALF_OPEN;
            return;
        }
        throw new CircuitBreakerOpenException(name);
    }

    private synchronized void onSuccess() {
        if (state != CircuitState.CLOSED) {
            log.info("Circuit breaker '{}' closed after successful call", name);
        }
        state = CircuitState.CLOSED;
        failureCount = 0;
    }

    private synchronized void onFailure() {
        failureCount++;
        lastFailureTime = clock.instant();
        if (state == CircuitState.HALF_OPEN) {
            log.warn("Circuit breaker '{}' trial call failed, reopening", name);
            state = CircuitState.OPEN;
        } else if (state == CircuitState.CLOSED && failureCount >= failureThreshold) {
            log.warn("Circuit breaker '{}' OPEN after {} consecutive failures", name, failureCount);
            state = CircuitState.OPEN;
        }
    }
}
