package com.purchasingpower.testgen.service.output;

import com.purchasingpower.testgen.exception.ErrorCategory;
import com.purchasingpower.testgen.model.function.FunctionDescriptor;
import com.purchasingpower.testgen.model.generation.GenerationResult;
import com.purchasingpower.testgen.model.generation.GenerationTask;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Test File Manager Tests")
class TestFileManagerTest {

    @TempDir
    Path outputDir;

    private TestFileManager manager;
    private GenerationTask task;

    @BeforeEach
    void setUp() {
        manager = new TestFileManager(new TestFileOrganizer(outputDir), new TestFileAggregator(), true);
        task = GenerationTask.builder()
                .index(0)
                .function(FunctionDescriptor.builder().name("add").file("src/math.c").build())
                .targetFile(outputDir.resolve("test_math.cpp"))
                .suiteName("mathTest")
                .prompt("Function name: add")
                .build();
    }

    @Test
    @DisplayName("Should write the aggregate file and all three debug artifacts")
    void testSaveResult_ShouldWriteArtifacts() throws Exception {
        // Given
        GenerationResult result = GenerationResult.builder()
                .task(task)
                .success(true)
                .code("#include <gtest/gtest.h>\nTEST(mathTest, Adds) {\n}\n")
                .rawResponse("```cpp\n#include <gtest/gtest.h>\nTEST(mathTest, Adds) {\n}\n```")
                .prompt(task.getPrompt())
                .build();

        // When
        GenerationResult saved = manager.saveResult(result);

        // Then
        assertTrue(saved.isSuccess());
        assertEquals(outputDir.resolve("test_math.cpp"), saved.getOutputPath());
        assertTrue(Files.readString(saved.getOutputPath()).contains("TEST(mathTest, Adds)"));
        assertEquals(outputDir.resolve("1_prompts/prompt_add.txt"), saved.getFileInfo().getPromptPath());
        assertEquals(outputDir.resolve("2_raw_responses/response_add.txt"), saved.getFileInfo().getResponsePath());
        assertEquals(outputDir.resolve("3_pure_tests/test_add.cpp"), saved.getFileInfo().getTestPath());
        assertTrue(Files.exists(saved.getFileInfo().getTestPath()));
    }

    @Test
    @DisplayName("Should record the error as the raw response of a failed result")
    void testSaveResult_ShouldWriteFailureArtifact() throws Exception {
        GenerationResult failed = GenerationResult.failure(task, "HTTP 401 client error", task.getPrompt());

        GenerationResult saved = manager.saveResult(failed);

        assertNull(saved.getOutputPath());
        assertNull(saved.getFileInfo().getTestPath());
        assertEquals("Generation failed: HTTP 401 client error",
                Files.readString(saved.getFileInfo().getResponsePath()));
        assertFalse(Files.exists(outputDir.resolve("test_math.cpp")));
    }

    @Test
    @DisplayName("Should turn a merge failure into a failed result")
    void testSaveResult_ShouldReportMergeFailure() throws Exception {
        Files.createDirectories(outputDir);
        Files.writeString(outputDir.resolve("test_math.cpp"), "#include <gtest/gtest.h>\nTEST(mathTest, Ok) {}\n");
        GenerationResult result = GenerationResult.builder()
                .task(task)
                .success(true)
                .code("TEST(mathTest, Broken) {\n")
                .rawResponse("raw")
                .build();

        GenerationResult saved = manager.saveResult(result);

        assertFalse(saved.isSuccess());
        assertEquals(ErrorCategory.CONTENT, saved.getErrorCategory());
        assertTrue(saved.getError().startsWith("Merge failed: "));
        assertNotNull(saved.getFileInfo().getResponsePath(), "Raw response is still kept for debugging");
    }

    @Test
    @DisplayName("Should keep a truncated reply as the first content of a new test file")
    void testSaveResult_ShouldCreateFileFromTruncatedReply() throws Exception {
        GenerationResult result = GenerationResult.builder()
                .task(task)
                .success(true)
                .code("TEST(mathTest, Truncated) {\n    EXPECT_EQ(3, add(1, 2));\n")
                .rawResponse("raw")
                .build();

        GenerationResult saved = manager.saveResult(result);

        assertTrue(saved.isSuccess());
        assertEquals("TEST(mathTest, Truncated) {\n    EXPECT_EQ(3, add(1, 2));\n",
                Files.readString(outputDir.resolve("test_math.cpp")));
    }

    @Test
    @DisplayName("Should write one file per function when aggregation is off")
    void testSaveResult_ShouldWritePerFunctionFile() throws Exception {
        TestFileManager perFunction = new TestFileManager(new TestFileOrganizer(outputDir), new TestFileAggregator(), false);
        GenerationResult result = GenerationResult.builder()
                .task(task).success(true).code("TEST(a, b) {}").build();

        GenerationResult saved = perFunction.saveResult(result);

        assertEquals(outputDir.resolve("test_add.cpp"), saved.getOutputPath());
        assertEquals("TEST(a, b) {}", Files.readString(saved.getOutputPath()));
    }

    @Test
    @DisplayName("Should save prompts under sanitized names")
    void testSavePrompt_ShouldSanitizeName() throws Exception {
        GenerationTask operator = GenerationTask.builder()
                .index(1)
                .function(FunctionDescriptor.builder().name("operator==").file("src/vec.cpp").build())
                .prompt("prompt")
                .build();

        Path path = manager.savePrompt(operator);

        assertEquals(outputDir.resolve("1_prompts/prompt_operator__.txt"), path);
        assertEquals("prompt", Files.readString(path));
    }
}
