package com.purchasingpower.testgen.client;

/**
 * A text-generation service that turns prompts into test code.
 *
 * <p>Implementations raise {@link com.purchasingpower.testgen.exception.BackendHttpException},
 * {@link com.purchasingpower.testgen.exception.BackendConnectionException} or
 * {@link com.purchasingpower.testgen.exception.BackendTimeoutException} for transport
 * failures so they can be classified for retry.
 *
 * @since 1.0.0
 */
public interface GenerationBackend {

    GenerationResponse generate(GenerationRequest request);

    /**
     * Provider identifier (openai, deepseek, dify, mock, local).
     */
    String getProviderName();

    String getModel();
}
