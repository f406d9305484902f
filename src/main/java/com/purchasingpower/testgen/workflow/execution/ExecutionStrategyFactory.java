package com.purchasingpower.testgen.workflow.execution;

import com.purchasingpower.testgen.model.generation.ExecutionMode;
import com.purchasingpower.testgen.model.generation.GenerationRunConfig;
import com.purchasingpower.testgen.service.resilience.Sleeper;
import org.springframework.stereotype.Component;

/**
 * Builds the execution strategy named in the run configuration.
 */
@Component
public class ExecutionStrategyFactory {

    private final Sleeper sleeper;

    public ExecutionStrategyFactory() {
        this(Sleeper.THREAD);
    }

    ExecutionStrategyFactory(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    public ExecutionStrategy create(GenerationRunConfig config) {
        return create(config.getExecutionMode(), config);
    }

    public ExecutionStrategy create(ExecutionMode mode, GenerationRunConfig config) {
        SequentialExecution sequential = new SequentialExecution(config.getDelayBetweenRequests(), sleeper);
        return switch (mode) {
            case SEQUENTIAL -> sequential;
            case CONCURRENT -> new ConcurrentExecution(config.getMaxWorkers());
            case ADAPTIVE -> new AdaptiveExecution(config.getMinWorkers(), config.getMaxWorkers(),
                    config.getInitialWorkers(), sequential);
        };
    }
}
