package com.purchasingpower.testgen.workflow.execution;

import com.purchasingpower.testgen.model.generation.GenerationResult;
import com.purchasingpower.testgen.model.generation.GenerationTask;

/**
 * Processes one task end to end. May throw; strategies turn exceptions into failed results.
 */
@FunctionalInterface
public interface TaskProcessor {

    GenerationResult process(GenerationTask task);
}
