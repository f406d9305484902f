package com.purchasingpower.testgen.workflow.pipeline;

import com.purchasingpower.testgen.model.generation.GenerationResult;
import com.purchasingpower.testgen.model.generation.GenerationTask;
import com.purchasingpower.testgen.service.generation.CoreTestGenerator;
import com.purchasingpower.testgen.service.generation.PromptGenerator;
import com.purchasingpower.testgen.workflow.execution.ExecutionStrategy;
import com.purchasingpower.testgen.workflow.execution.ExecutionStrategyFactory;
import com.purchasingpower.testgen.workflow.execution.TaskProcessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs the tasks with the configured strategy.
 * Each task: render prompt if missing, generate, write code and debug artifacts.
 */
@Slf4j
@Component
@Order(3)
@RequiredArgsConstructor
public class GenerationExecutionStep implements PipelineStep {

    private final ExecutionStrategyFactory strategyFactory;
    private final PromptGenerator promptGenerator;
    private final CoreTestGenerator coreTestGenerator;

    @Override
    public void execute(PipelineContext context) {
        ExecutionStrategy strategy = strategyFactory.create(context.getConfig());
        log.info("Executing {} tasks with '{}' strategy", context.getTasks().size(), strategy.getName());

        List<GenerationResult> results = strategy.execute(context.getTasks(), processor(context));
        context.setResults(results);
    }

    TaskProcessor processor(PipelineContext context) {
        return task -> {
            if (!task.hasPrompt()) {
                task.setPrompt(promptGenerator.generatePrompt(task));
            }
            GenerationResult result = coreTestGenerator.generate(task, task.getPrompt());
            return context.getFileManager().saveResult(result);
        };
    }
}
