package com.purchasingpower.testgen.model.generation;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings for a single pipeline run.
 *
 * <p>Passed explicitly through the orchestrator and its steps instead of being
 * read from a global configuration object.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class GenerationRunConfig {

    @Builder.Default
    String projectName = "project";

    Path outputDir;

    /** Directory holding existing unit tests; {@code null} disables fixture lookup. */
    Path unitTestDir;

    @Builder.Default
    ExecutionMode executionMode = ExecutionMode.CONCURRENT;

    @Builder.Default
    int maxWorkers = 3;

    @Builder.Default
    int minWorkers = 1;

    @Builder.Default
    int initialWorkers = 3;

    @Builder.Default
    Duration delayBetweenRequests = Duration.ofSeconds(1);

    @Builder.Default
    boolean savePrompts = true;

    @Builder.Default
    boolean aggregateTests = true;

    @Builder.Default
    boolean writeSummary = true;

    @Builder.Default
    boolean timestampedOutput = false;

    String provider;

    String model;
}
