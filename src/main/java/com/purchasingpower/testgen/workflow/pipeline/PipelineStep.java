package com.purchasingpower.testgen.workflow.pipeline;

/**
 * One phase of a generation run.
 * Implementations are detected by Spring and sorted by @Order.
 */
public interface PipelineStep {

    /**
     * @param context state of the current run, filled in by the earlier steps
     * @throws RuntimeException if the step fails and the run should abort
     */
    void execute(PipelineContext context);
}
