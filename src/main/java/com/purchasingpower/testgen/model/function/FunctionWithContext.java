package com.purchasingpower.testgen.model.function;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One entry of the analyzer output: a function plus the context gathered for it.
 */
@Value
@Builder
@Jacksonized
public class FunctionWithContext {
    FunctionDescriptor function;
    RawContext context;
    ExistingTestsContext existingTestsContext;
}
