package com.purchasingpower.testgen.service.generation;

import com.purchasingpower.testgen.client.GenerationBackend;
import com.purchasingpower.testgen.client.GenerationRequest;
import com.purchasingpower.testgen.client.GenerationResponse;
import com.purchasingpower.testgen.exception.ErrorCategory;
import com.purchasingpower.testgen.exception.GenerationBackendException;
import com.purchasingpower.testgen.model.generation.GenerationResult;
import com.purchasingpower.testgen.model.generation.GenerationTask;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Sends one prompt to the generation backend and turns the reply into a result.
 *
 * <p>Validation is lenient: code that fails validation is logged and still
 * returned as a successful result.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CoreTestGenerator {

    public static final int MAX_TOKENS = 2500;
    public static final double TEMPERATURE = 0.3;

    private final GenerationBackend generationBackend;
    private final PromptGenerator promptGenerator;
    private final TestCodeValidator testCodeValidator;

    public GenerationResult generate(GenerationTask task, String prompt) {
        String functionName = task.getFunctionName();
        GenerationResponse response;
        try {
            GenerationRequest request = GenerationRequest.builder()
                    .prompt(prompt)
                    .systemPrompt(promptGenerator.getSystemPrompt(task.getLanguage()))
                    .maxTokens(MAX_TOKENS)
                    .temperature(TEMPERATURE)
                    .language(task.getLanguage())
                    .build();
            response = generationBackend.generate(request);
        } catch (GenerationBackendException e) {
            log.error("❌ Generation failed for '{}' [{}]: {}", functionName, e.getCategory(), e.getMessage());
            return failure(task, prompt, e.getMessage(), e.getCategory());
        } catch (IllegalArgumentException e) {
            log.error("❌ Invalid generation request for '{}': {}", functionName, e.getMessage());
            return failure(task, prompt, e.getMessage(), ErrorCategory.CONFIGURATION);
        }

        if (!response.isSuccess()) {
            log.error("❌ Backend rejected '{}': {}", functionName, response.getError());
            return failure(task, prompt, response.getError(), ErrorCategory.PROVIDER).toBuilder()
                    .model(response.getModel())
                    .build();
        }

        String rawResponse = response.getCode() == null ? "" : response.getCode();
        String code = CodeBlockExtractor.extract(rawResponse);

        ValidationResult validation = testCodeValidator.validate(code, task.getLanguage());
        if (!validation.isValid()) {
            log.warn("Generated code for '{}' did not pass validation ({}), keeping it: {}",
                    functionName, validation.getSummary(), validation.getViolations());
        }

        log.info("✅ Generated tests for '{}' ({} tokens)", functionName, response.getUsage().getTotalTokens());
        return GenerationResult.builder()
                .task(task)
                .success(true)
                .code(code)
                .rawResponse(rawResponse)
                .prompt(prompt)
                .usage(response.getUsage())
                .model(response.getModel())
                .build();
    }

    private GenerationResult failure(GenerationTask task, String prompt, String error, ErrorCategory category) {
        return GenerationResult.failure(task, error, prompt).toBuilder()
                .errorCategory(category)
                .build();
    }
}
