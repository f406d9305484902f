package com.purchasingpower.testgen;

import com.purchasingpower.testgen.client.GenerationBackend;
import com.purchasingpower.testgen.client.MockBackend;
import com.purchasingpower.testgen.client.ResilientGenerationBackend;
import com.purchasingpower.testgen.configuration.AppProperties;
import com.purchasingpower.testgen.runner.GenerationCommandRunner;
import com.purchasingpower.testgen.workflow.pipeline.PipelineStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Boots the application with the mock backend and an analyzer file, so the
 * command runner performs a full run on startup.
 */
@SpringBootTest
@DisplayName("Test Generation Application Tests")
class TestGenApplicationTest {

    @TempDir
    static Path outputDir;

    @DynamicPropertySource
    static void properties(DynamicPropertyRegistry registry) {
        registry.add("app.output-dir", () -> outputDir.toString());
        registry.add("app.input-file", () -> "src/test/resources/analysis/math_utils.json");
        registry.add("app.project-name", () -> "math");
        registry.add("app.execution-strategy", () -> "sequential");
        registry.add("app.delay-between-requests-ms", () -> "0");
        registry.add("app.timestamped-output", () -> "false");
        registry.add("app.llm.provider", () -> "mock");
        registry.add("app.llm.api-key", () -> "");
    }

    @Autowired
    private GenerationBackend generationBackend;

    @Autowired
    private AppProperties appProperties;

    @Autowired
    private List<PipelineStep> steps;

    @Autowired
    private GenerationCommandRunner commandRunner;

    @Test
    @DisplayName("Should wire the mock backend behind the resilience wrapper")
    void testContext_ShouldWireBackend() {
        ResilientGenerationBackend resilient = assertInstanceOf(ResilientGenerationBackend.class, generationBackend);
        assertInstanceOf(MockBackend.class, resilient.getDelegate());
        assertEquals("mock", appProperties.getLlm().getProvider());
        assertNotNull(commandRunner);
    }

    @Test
    @DisplayName("Should order pipeline steps by their @Order")
    void testContext_ShouldOrderSteps() {
        assertEquals(List.of("TaskPreparationStep", "PromptPersistenceStep", "GenerationExecutionStep",
                        "ResultAggregationStep"),
                steps.stream().map(step -> step.getClass().getSimpleName()).toList());
    }

    @Test
    @DisplayName("Should have generated tests for the non-static functions on startup")
    void testStartupRun_ShouldWriteAggregateFile() throws Exception {
        Path aggregate = outputDir.resolve("test_math_utils.cpp");

        assertTrue(Files.exists(aggregate), "Aggregate file written by the startup run");
        assertThat(Files.readString(aggregate))
                .contains("addBasic")
                .contains("multiplyBasic")
                .doesNotContain("clampBasic");
        assertTrue(Files.exists(outputDir.resolve("README.md")));
        assertThat(Files.readString(outputDir.resolve("1_prompts/prompt_multiply.txt")))
                .contains("Existing test functions: MultiplyByZero");
    }
}
