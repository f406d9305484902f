package com.purchasingpower.testgen.service.resilience;

public enum BackoffStrategy {
    FIXED,
    LINEAR,
    EXPONENTIAL,
    EXPONENTIAL_WITH_JITTER
}
