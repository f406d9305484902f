package com.purchasingpower.testgen.configuration;

import com.purchasingpower.testgen.model.generation.ExecutionMode;
import com.purchasingpower.testgen.model.generation.GenerationRunConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @NotBlank
    private String projectName = "project";

    @NotBlank(message = "Output directory path is required")
    private String outputDir = "./generated_tests";

    /** Existing unit tests, searched for fixtures. Optional. */
    private String unitTestDir;

    /** Analyzer output (JSON). When set, a run starts on application startup. */
    private String inputFile;

    @NotBlank
    private String executionStrategy = "concurrent";

    @Min(1)
    private int maxWorkers = 3;

    @Min(1)
    private int minWorkers = 1;

    @Min(1)
    private int initialWorkers = 3;

    @Min(0)
    private long delayBetweenRequestsMs = 1000;

    private boolean savePrompts = true;

    private boolean aggregateTests = true;

    private boolean writeSummary = true;

    private boolean timestampedOutput = true;

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private LlmProperties llm = new LlmProperties();

    public GenerationRunConfig toRunConfig() {
        return GenerationRunConfig.builder()
                .projectName(projectName)
                .outputDir(Path.of(outputDir))
                .unitTestDir(unitTestDir == null || unitTestDir.isBlank() ? null : Path.of(unitTestDir))
                .executionMode(ExecutionMode.fromName(executionStrategy))
                .maxWorkers(maxWorkers)
                .minWorkers(minWorkers)
                .initialWorkers(initialWorkers)
                .delayBetweenRequests(Duration.ofMillis(delayBetweenRequestsMs))
                .savePrompts(savePrompts)
                .aggregateTests(aggregateTests)
                .writeSummary(writeSummary)
                .timestampedOutput(timestampedOutput)
                .provider(llm.getProvider())
                .model(llm.getModel() == null || llm.getModel().isBlank() ? null : llm.getModel())
                .build();
    }
}
