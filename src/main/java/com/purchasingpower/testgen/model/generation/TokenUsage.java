package com.purchasingpower.testgen.model.generation;

import lombok.Value;

/**
 * Token accounting reported by the backend for one call.
 */
@Value
public class TokenUsage {
    int promptTokens;
    int completionTokens;
    int totalTokens;

    /**
     * Builds a usage record, deriving the total when the backend did not report one.
     */
    public static TokenUsage of(int promptTokens, int completionTokens, int totalTokens) {
        int total = totalTokens == 0 ? promptTokens + completionTokens : totalTokens;
        return new TokenUsage(promptTokens, completionTokens, total);
    }

    public static TokenUsage empty() {
        return new TokenUsage(0, 0, 0);
    }
}
