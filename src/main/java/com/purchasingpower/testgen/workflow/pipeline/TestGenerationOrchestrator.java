package com.purchasingpower.testgen.workflow.pipeline;

import com.google.common.base.Preconditions;
import com.purchasingpower.testgen.model.function.FunctionWithContext;
import com.purchasingpower.testgen.model.generation.AggregatedResult;
import com.purchasingpower.testgen.model.generation.GenerationRunConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Runs the generation pipeline: prepare tasks, render and save prompts,
 * execute, aggregate.
 *
 * <p>Per-task failures are recorded in the results and never abort the run.
 * Only a failing step (for example an output directory that cannot be created)
 * does.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TestGenerationOrchestrator {

    /**
     * Spring injects all PipelineStep beans, sorted by their @Order annotation.
     */
    private final List<PipelineStep> steps;

    public AggregatedResult run(List<FunctionWithContext> inputs, GenerationRunConfig config) {
        Preconditions.checkNotNull(inputs, "inputs must not be null");
        Preconditions.checkNotNull(config, "config must not be null");
        Preconditions.checkNotNull(config.getOutputDir(), "outputDir must be set");

        log.info("Starting test generation for project '{}' ({} functions)", config.getProjectName(), inputs.size());
        PipelineContext context = new PipelineContext(config, List.copyOf(inputs), LocalDateTime.now());

        try {
            for (PipelineStep step : steps) {
                log.info(">> Executing Step: {}", step.getClass().getSimpleName());
                step.execute(context);
            }
        } catch (RuntimeException e) {
            log.error("Pipeline aborted due to error in step execution", e);
            throw e;
        }

        log.info("Pipeline completed for '{}': {} successful, {} failed", config.getProjectName(),
                context.getAggregatedResult().getSuccessfulCount(), context.getAggregatedResult().getFailedCount());
        return context.getAggregatedResult();
    }
}
