package com.purchasingpower.testgen.model.function;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Tests that already exist for the source file, as reported by the test matcher.
 */
@Value
@Builder
@Jacksonized
public class ExistingTestsContext {

    @Builder.Default
    List<String> matchedFiles = List.of();

    @Builder.Default
    List<String> existingTestFunctions = List.of();

    @Builder.Default
    List<String> existingTestClasses = List.of();

    String coverageSummary;
}
