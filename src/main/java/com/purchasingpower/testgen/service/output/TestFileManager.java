package com.purchasingpower.testgen.service.output;

import com.purchasingpower.testgen.exception.ErrorCategory;
import com.purchasingpower.testgen.exception.TestMergeException;
import com.purchasingpower.testgen.model.generation.DebugFileInfo;
import com.purchasingpower.testgen.model.generation.GenerationResult;
import com.purchasingpower.testgen.model.generation.GenerationTask;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes everything a run produces for one output directory.
 *
 * <p>Successful code goes into the per-source aggregate file (or a
 * per-function file when aggregation is off); debug artifacts are written for
 * every result, failed ones included.
 */
@Slf4j
public class TestFileManager {

    private final TestFileOrganizer organizer;
    private final TestFileAggregator aggregator;
    private final boolean aggregateTests;

    public TestFileManager(TestFileOrganizer organizer, TestFileAggregator aggregator, boolean aggregateTests) {
        this.organizer = organizer;
        this.aggregator = aggregator;
        this.aggregateTests = aggregateTests;
    }

    public Path savePrompt(GenerationTask task) {
        try {
            return organizer.savePrompt(task.getFunctionName(), task.getPrompt());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot save prompt for " + task.getFunctionName(), e);
        }
    }

    /**
     * Persists a result and attaches its output path and debug file info.
     *
     * @return the same result, or a failed copy when its code could not be merged
     */
    public GenerationResult saveResult(GenerationResult result) {
        GenerationResult saved = result;
        if (result.isSuccess()) {
            saved = writeTestCode(result);
        }
        saved.setFileInfo(writeDebugArtifacts(saved));
        return saved;
    }

    private GenerationResult writeTestCode(GenerationResult result) {
        GenerationTask task = result.getTask();
        try {
            Path output;
            if (aggregateTests) {
                output = task.getTargetFile();
                aggregator.aggregate(output, result.getCode());
            } else {
                output = organizer.getBaseDir()
                        .resolve("test_" + TestFileOrganizer.sanitize(task.getFunctionName()) + ".cpp");
                Files.createDirectories(output.getParent());
                Files.writeString(output, result.getCode(), StandardCharsets.UTF_8);
            }
            result.setOutputPath(output);
            log.info("📄 Tests for '{}' written to {}", task.getFunctionName(), output);
            return result;
        } catch (TestMergeException e) {
            log.error("Merge failed for '{}' into {}: {}", task.getFunctionName(), e.getTargetFile(), e.getMessage());
            return result.toBuilder()
                    .success(false)
                    .error("Merge failed: " + e.getMessage())
                    .errorCategory(ErrorCategory.CONTENT)
                    .build();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write tests for " + task.getFunctionName(), e);
        }
    }

    private DebugFileInfo writeDebugArtifacts(GenerationResult result) {
        String rawResponse = result.isSuccess() || !result.getRawResponse().isEmpty()
                ? result.getRawResponse()
                : "Generation failed: " + result.getError();
        try {
            return organizer.organizeTestOutput(result.getFunctionName(), result.getPrompt(), rawResponse,
                    result.isSuccess() ? result.getCode() : null);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write debug artifacts for " + result.getFunctionName(), e);
        }
    }
}
