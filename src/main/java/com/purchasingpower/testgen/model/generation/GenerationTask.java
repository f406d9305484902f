package com.purchasingpower.testgen.model.generation;

import com.purchasingpower.testgen.model.function.ExistingTestsContext;
import com.purchasingpower.testgen.model.function.FunctionDescriptor;
import com.purchasingpower.testgen.model.function.RawContext;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.nio.file.Path;

/**
 * One unit of generation work: a function, its context and where its tests go.
 *
 * <p>Immutable after creation except for {@code prompt}, which is attached
 * once rendered. {@code index} is the task's position in the run and is used
 * to restore input order after concurrent execution.
 *
 * @since 1.0.0
 */
@Getter
@Builder
@ToString(of = {"index", "suiteName", "targetFile"})
public class GenerationTask {

    private final int index;

    private final FunctionDescriptor function;

    private final RawContext context;

    /** Aggregate test file for the function's source file. */
    private final Path targetFile;

    private final String suiteName;

    private final String existingFixtureCode;

    private final ExistingTestsContext existingTestsContext;

    @Setter
    private volatile String prompt;

    public String getFunctionName() {
        return function != null && function.getName() != null ? function.getName() : "unknown";
    }

    public String getLanguage() {
        return function != null && function.getLanguage() != null ? function.getLanguage() : "c";
    }

    public boolean hasPrompt() {
        return prompt != null && !prompt.isBlank();
    }
}
