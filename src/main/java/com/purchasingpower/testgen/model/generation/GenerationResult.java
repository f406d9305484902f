package com.purchasingpower.testgen.model.generation;

import com.purchasingpower.testgen.exception.ErrorCategory;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.nio.file.Path;

/**
 * Outcome of generating tests for one task.
 *
 * <p>Created by the test generator. The file manager attaches
 * {@code outputPath} and {@code fileInfo} once the result has been written.
 *
 * @since 1.0.0
 */
@Getter
@Builder(toBuilder = true)
@ToString(of = {"success", "error", "model", "outputPath"})
public class GenerationResult {

    private final GenerationTask task;

    private final boolean success;

    /** Extracted test code (fences removed). */
    @Builder.Default
    private final String code = "";

    /** Text exactly as returned by the backend. */
    @Builder.Default
    private final String rawResponse = "";

    private final String prompt;

    private final String error;

    private final ErrorCategory errorCategory;

    @Builder.Default
    private final TokenUsage usage = TokenUsage.empty();

    private final String model;

    @Setter
    private Path outputPath;

    @Setter
    private DebugFileInfo fileInfo;

    public static GenerationResult failure(GenerationTask task, String error, String prompt) {
        return GenerationResult.builder()
                .task(task)
                .success(false)
                .error(error)
                .prompt(prompt)
                .build();
    }

    public String getFunctionName() {
        return task.getFunctionName();
    }
}
