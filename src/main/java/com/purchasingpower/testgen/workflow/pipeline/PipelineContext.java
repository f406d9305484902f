package com.purchasingpower.testgen.workflow.pipeline;

import com.purchasingpower.testgen.model.function.FunctionWithContext;
import com.purchasingpower.testgen.model.generation.AggregatedResult;
import com.purchasingpower.testgen.model.generation.GenerationResult;
import com.purchasingpower.testgen.model.generation.GenerationRunConfig;
import com.purchasingpower.testgen.model.generation.GenerationTask;
import com.purchasingpower.testgen.service.output.TestFileManager;
import com.purchasingpower.testgen.service.output.TestFileOrganizer;
import lombok.Data;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * State carried through the steps of one run.
 */
@Data
public class PipelineContext {

    private final GenerationRunConfig config;
    private final List<FunctionWithContext> inputs;
    private final LocalDateTime startTime;

    private Path outputDirectory;
    private TestFileOrganizer organizer;
    private TestFileManager fileManager;

    private List<GenerationTask> tasks = new ArrayList<>();
    private List<GenerationResult> results = new ArrayList<>();
    private int skippedFunctions;

    private LocalDateTime endTime;
    private AggregatedResult aggregatedResult;
}
