package com.purchasingpower.testgen.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class LlmProperties {

    /** openai, deepseek, dify, mock or local. */
    @NotBlank
    private String provider = "mock";

    /** Model identifier; blank means the provider's default model. */
    private String model;

    private String apiKey;

    /** Overrides the provider's default endpoint. */
    private String baseUrl;

    @Min(1)
    private int timeoutSeconds = 300;
}
