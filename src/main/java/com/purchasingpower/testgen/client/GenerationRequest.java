package com.purchasingpower.testgen.client;

import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.Value;

/**
 * One call to a generation backend.
 */
@Value
public class GenerationRequest {

    String prompt;

    /** Instructions sent ahead of the prompt; backends without a system role prepend it. */
    String systemPrompt;

    int maxTokens;

    double temperature;

    String language;

    @Builder
    private GenerationRequest(String prompt, String systemPrompt, int maxTokens, double temperature,
                              String language) {
        Preconditions.checkArgument(prompt != null && !prompt.isBlank(), "prompt must not be blank");
        Preconditions.checkArgument(maxTokens > 0, "maxTokens must be positive, got %s", maxTokens);
        Preconditions.checkArgument(temperature >= 0.0 && temperature <= 2.0,
                "temperature must be within [0, 2], got %s", temperature);
        this.prompt = prompt;
        this.systemPrompt = systemPrompt;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
        this.language = language == null ? "c" : language;
    }
}
