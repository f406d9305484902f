package com.purchasingpower.testgen.workflow.pipeline;

import com.purchasingpower.testgen.model.generation.GenerationTask;
import com.purchasingpower.testgen.service.generation.PromptGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.UncheckedIOException;

/**
 * Renders every prompt and saves it before any backend call, so an interrupted
 * run still leaves its prompts on disk.
 *
 * <p>A prompt that fails to render is left unset; the task is retried at
 * execution time and fails there on its own.
 */
@Slf4j
@Component
@Order(2)
@RequiredArgsConstructor
public class PromptPersistenceStep implements PipelineStep {

    private final PromptGenerator promptGenerator;

    @Override
    public void execute(PipelineContext context) {
        int saved = 0;
        for (GenerationTask task : context.getTasks()) {
            try {
                task.setPrompt(promptGenerator.generatePrompt(task));
            } catch (RuntimeException e) {
                log.error("Cannot render prompt for '{}': {}", task.getFunctionName(), e.getMessage());
                continue;
            }
            if (context.getConfig().isSavePrompts()) {
                try {
                    context.getFileManager().savePrompt(task);
                    saved++;
                } catch (UncheckedIOException e) {
                    log.warn("Cannot save prompt for '{}': {}", task.getFunctionName(), e.getMessage());
                }
            }
        }
        log.info("💾 Rendered {} prompts, saved {}", context.getTasks().size(), saved);
    }
}
