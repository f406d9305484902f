package com.purchasingpower.testgen.exception;

import lombok.Getter;

/**
 * Terminal failure of a resilient backend call.
 *
 * <p>Raised once retries are exhausted or a non-retryable error is seen.
 * Carries the classification and the last underlying cause.
 */
@Getter
public class GenerationBackendException extends RuntimeException {

    private final ErrorCategory category;

    private final boolean retryable;

    private final String provider;

    private final int attempts;

    public GenerationBackendException(String message, ErrorCategory category, boolean retryable,
                                      String provider, int attempts, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.retryable = retryable;
        this.provider = provider;
        this.attempts = attempts;
    }
}
