package com.purchasingpower.testgen.service.context;

import com.purchasingpower.testgen.model.context.CompressedContext;
import com.purchasingpower.testgen.model.function.FunctionDescriptor;
import com.purchasingpower.testgen.model.function.RawContext;

/**
 * Builds a token-bounded view of a function and its context.
 *
 * <p>The target function body is always carried in full. When the result is
 * over budget, dependencies and usage examples are dropped progressively;
 * if that is still not enough the over-budget context is returned anyway.
 */
public interface ContextCompressor {

    CompressedContext compress(FunctionDescriptor function, RawContext context);
}
