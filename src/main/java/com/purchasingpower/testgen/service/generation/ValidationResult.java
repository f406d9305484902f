package com.purchasingpower.testgen.service.generation;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of validating generated test code. Immutable.
 */
@Value
@Builder
public class ValidationResult {
    boolean valid;
    List<Violation> violations;
    String summary;

    public static ValidationResult success() {
        return ValidationResult.builder()
                .valid(true)
                .violations(List.of())
                .summary("No violations found")
                .build();
    }

    public static ValidationResult failure(List<Violation> violations) {
        return ValidationResult.builder()
                .valid(false)
                .violations(List.copyOf(violations))
                .summary(String.format("Found %d violations", violations.size()))
                .build();
    }

    @Value
    @Builder
    public static class Violation {
        String rule;        // e.g. "missing-include"
        String message;
    }
}
