package com.purchasingpower.testgen.model.generation;

import java.util.Arrays;
import java.util.Locale;

/**
 * Scheduling modes for generation tasks.
 */
public enum ExecutionMode {
    SEQUENTIAL,
    CONCURRENT,
    ADAPTIVE;

    public static ExecutionMode fromName(String name) {
        return Arrays.stream(values())
                .filter(mode -> mode.name().equals(name.trim().toUpperCase(Locale.ROOT)))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown execution strategy: " + name + ". Available: sequential, concurrent, adaptive"));
    }
}
