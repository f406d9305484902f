package com.purchasingpower.testgen.exception;

import lombok.Getter;

/**
 * Call rejected without reaching the backend because the circuit is OPEN.
 */
@Getter
public class CircuitBreakerOpenException extends RuntimeException {

    private final String circuitName;

    public CircuitBreakerOpenException(String circuitName) {
        super("Circuit breaker '" + circuitName + "' is OPEN");
        this.circuitName = circuitName;
    }
}
