package com.purchasingpower.testgen.workflow.pipeline;

import com.purchasingpower.testgen.model.function.FunctionDescriptor;
import com.purchasingpower.testgen.model.function.FunctionWithContext;
import com.purchasingpower.testgen.model.function.RawContext;
import com.purchasingpower.testgen.model.generation.GenerationRunConfig;
import com.purchasingpower.testgen.model.generation.GenerationTask;
import com.purchasingpower.testgen.service.fixture.FixtureFinder;
import com.purchasingpower.testgen.service.output.TestFileAggregator;
import com.purchasingpower.testgen.service.output.TestFileManager;
import com.purchasingpower.testgen.service.output.TestFileOrganizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the output directory and builds one task per eligible function.
 *
 * <p>Static functions are skipped: they cannot be called from a separate test
 * translation unit. Tasks are indexed in input order.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class TaskPreparationStep implements PipelineStep {

    private final FixtureFinder fixtureFinder;
    private final TestFileAggregator testFileAggregator;

    @Override
    public void execute(PipelineContext context) {
        GenerationRunConfig config = context.getConfig();
        Path outputDirectory = resolveOutputDirectory(context);
        TestFileOrganizer organizer = new TestFileOrganizer(outputDirectory);
        context.setOutputDirectory(outputDirectory);
        context.setOrganizer(organizer);
        context.setFileManager(new TestFileManager(organizer, testFileAggregator, config.isAggregateTests()));

        Map<String, Optional<String>> fixtures = new HashMap<>();
        List<GenerationTask> tasks = new ArrayList<>();
        int skipped = 0;

        for (FunctionWithContext input : context.getInputs()) {
            FunctionDescriptor function = input.getFunction();
            if (function == null) {
                log.warn("Skipping analyzer entry without a function");
                skipped++;
                continue;
            }
            if (function.isStatic()) {
                log.debug("Skipping static function '{}'", function.getName());
                skipped++;
                continue;
            }

            String stem = function.getSourceStem();
            String suiteName = stem.replace('.', '_') + "Test";
            String fixture = config.getUnitTestDir() == null ? null
                    : fixtures.computeIfAbsent(suiteName,
                            name -> fixtureFinder.findFixtureDefinition(name, config.getUnitTestDir()))
                    .orElse(null);

            tasks.add(GenerationTask.builder()
                    .index(tasks.size())
                    .function(function)
                    .context(input.getContext() != null ? input.getContext() : RawContext.empty())
                    .targetFile(outputDirectory.resolve("test_" + stem + ".cpp"))
                    .suiteName(suiteName)
                    .existingFixtureCode(fixture)
                    .existingTestsContext(input.getExistingTestsContext())
                    .build());
        }

        context.setTasks(tasks);
        context.setSkippedFunctions(skipped);
        log.info("Prepared {} tasks ({} functions skipped), output in {}", tasks.size(), skipped, outputDirectory);
    }

    private Path resolveOutputDirectory(PipelineContext context) {
        GenerationRunConfig config = context.getConfig();
        try {
            if (config.isTimestampedOutput()) {
                return TestFileOrganizer.createTimestampedDirectory(config.getOutputDir(),
                        config.getProjectName(), context.getStartTime());
            }
            Files.createDirectories(config.getOutputDir());
            return config.getOutputDir();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create output directory " + config.getOutputDir(), e);
        }
    }
}
