package com.purchasingpower.testgen.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.Map;

/**
 * Prompt template loaded from YAML configuration.
 *
 * YAML structure:
 * <pre>
 * name: test-generation
 * version: 1.0
 * systemPrompt: |
 *   You are an experienced ...
 * languageSystemPrompts:
 *   c: |
 *     ...
 * userPrompt: |
 *   # Target function ...
 * </pre>
 *
 * {@code userPrompt} is a Mustache template; {@code systemPrompt} is the
 * fallback for languages without an entry in {@code languageSystemPrompts}.
 *
 * @see com.purchasingpower.testgen.service.generation.PromptLibraryService
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;
    private String description;
    private String systemPrompt;
    private Map<String, String> languageSystemPrompts = Map.of();
    private String userPrompt;
}
