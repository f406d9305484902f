package com.purchasingpower.testgen.model.generation;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Run-level metadata computed once all tasks have finished.
 */
@Value
@Builder
public class GenerationStatistics {
    LocalDateTime startTime;
    LocalDateTime endTime;
    double durationSeconds;

    String projectName;
    String provider;
    String model;
    String outputDirectory;

    int totalFunctions;
    int successful;
    int failed;
    double successRate;

    long totalTokens;
    double averageTokens;

    /** Truncated error text -> names of the functions that failed with it. */
    Map<String, List<String>> failureBreakdown;
}
