package com.purchasingpower.testgen.client;

import com.purchasingpower.testgen.model.generation.TokenUsage;
import lombok.Builder;
import lombok.Value;

/**
 * Backend reply. Transport failures are raised as exceptions instead;
 * {@code success=false} is reserved for replies the backend itself rejected.
 */
@Value
@Builder
public class GenerationResponse {

    boolean success;

    /** Generated text as returned, code fences included. */
    String code;

    String error;

    @Builder.Default
    TokenUsage usage = TokenUsage.empty();

    String model;

    public static GenerationResponse failed(String error, String model) {
        return GenerationResponse.builder().success(false).error(error).model(model).build();
    }
}
