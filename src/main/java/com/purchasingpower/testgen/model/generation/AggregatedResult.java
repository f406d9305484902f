package com.purchasingpower.testgen.model.generation;

import lombok.Value;

import java.util.List;

/**
 * Everything a pipeline run produced. Read-only once the run has completed.
 */
@Value
public class AggregatedResult {
    GenerationRunConfig config;
    List<GenerationResult> results;
    GenerationStatistics statistics;

    public AggregatedResult(GenerationRunConfig config, List<GenerationResult> results,
                            GenerationStatistics statistics) {
        this.config = config;
        this.results = List.copyOf(results);
        this.statistics = statistics;
    }

    public int getSuccessfulCount() {
        return (int) results.stream().filter(GenerationResult::isSuccess).count();
    }

    public int getFailedCount() {
        return results.size() - getSuccessfulCount();
    }

    public int getTotalCount() {
        return results.size();
    }

    public double getSuccessRate() {
        return results.isEmpty() ? 0.0 : (double) getSuccessfulCount() / results.size();
    }
}
