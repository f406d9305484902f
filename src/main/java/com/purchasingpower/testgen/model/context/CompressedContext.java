package com.purchasingpower.testgen.model.context;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Bounded view of a function and its surroundings, sized to fit the model's token budget.
 *
 * <p>Only the content fields are serialized for token counting; the sizing
 * metadata ({@code compressionLevel}, {@code tokenCount}, {@code availableTokens})
 * is excluded.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
public class CompressedContext {

    TargetFunctionSummary targetFunction;

    DependencyContext dependencies;

    @Builder.Default
    List<UsagePattern> usagePatterns = List.of();

    CompilationInfo compilationInfo;

    /** Progressive compression level applied (0 = none, 3 = most aggressive). */
    @JsonIgnore
    int compressionLevel;

    @JsonIgnore
    int tokenCount;

    @JsonIgnore
    int availableTokens;

    @JsonIgnore
    public boolean isWithinBudget() {
        return tokenCount <= availableTokens;
    }
}
