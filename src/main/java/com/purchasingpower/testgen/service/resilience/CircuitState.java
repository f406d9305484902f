package com.purchasingpower.testgen.service.resilience;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
