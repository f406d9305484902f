package com.purchasingpower.testgen.workflow.execution;

import com.purchasingpower.testgen.exception.ErrorCategory;
import com.purchasingpower.testgen.model.generation.GenerationResult;
import com.purchasingpower.testgen.model.generation.GenerationTask;

import java.util.List;

/**
 * Schedules generation tasks.
 *
 * <p>Results are returned in the order of {@code tasks}, one per task. A task
 * whose processor throws yields a failed result; the other tasks still run.
 *
 * @since 1.0.0
 */
public interface ExecutionStrategy {

    List<GenerationResult> execute(List<GenerationTask> tasks, TaskProcessor processor);

    String getName();

    /**
     * Runs the processor and converts any exception into a failed result.
     */
    static GenerationResult processSafely(GenerationTask task, TaskProcessor processor) {
        try {
            GenerationResult result = processor.process(task);
            if (result == null) {
                return failed(task, "Processor returned no result");
            }
            return result;
        } catch (RuntimeException e) {
            return failed(task, "Processing error: " + e.getMessage());
        }
    }

    private static GenerationResult failed(GenerationTask task, String error) {
        return GenerationResult.failure(task, error, task.getPrompt()).toBuilder()
                .errorCategory(ErrorCategory.UNKNOWN)
                .build();
    }
}
