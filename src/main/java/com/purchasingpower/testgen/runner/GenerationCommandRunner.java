package com.purchasingpower.testgen.runner;

import com.purchasingpower.testgen.configuration.AppProperties;
import com.purchasingpower.testgen.model.function.FunctionWithContext;
import com.purchasingpower.testgen.model.generation.AggregatedResult;
import com.purchasingpower.testgen.service.output.TestResultAggregator;
import com.purchasingpower.testgen.workflow.pipeline.TestGenerationOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Starts a run on startup when {@code app.input-file} is set.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "app", name = "input-file")
@RequiredArgsConstructor
public class GenerationCommandRunner implements CommandLineRunner {

    private final AppProperties appProperties;
    private final AnalysisInputLoader inputLoader;
    private final TestGenerationOrchestrator orchestrator;
    private final TestResultAggregator resultAggregator;

    @Override
    public void run(String... args) throws Exception {
        List<FunctionWithContext> functions = inputLoader.load(Path.of(appProperties.getInputFile()));
        AggregatedResult result = orchestrator.run(functions, appProperties.toRunConfig());
        log.info("\n{}", resultAggregator.generateSummaryReport(result));
    }
}
