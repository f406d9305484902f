package com.purchasingpower.testgen.exception;

/**
 * Standardized failure categories for calls to the generation backend.
 */
public enum ErrorCategory {
    AUTHENTICATION,
    RATE_LIMIT,
    NETWORK,
    TIMEOUT,
    CONTENT,
    CONFIGURATION,
    PROVIDER,
    UNKNOWN
}
