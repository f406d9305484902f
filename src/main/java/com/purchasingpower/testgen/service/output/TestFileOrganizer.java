package com.purchasingpower.testgen.service.output;

import com.purchasingpower.testgen.model.generation.DebugFileInfo;
import com.purchasingpower.testgen.model.generation.GenerationStatistics;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Lays out debug artifacts under an output directory:
 * <pre>
 * 1_prompts/prompt_&lt;fn&gt;.txt         prompt sent to the backend
 * 2_raw_responses/response_&lt;fn&gt;.txt  reply as received
 * 3_pure_tests/test_&lt;fn&gt;.cpp         code extracted from the reply
 * README.md                          run summary
 * </pre>
 */
@Slf4j
@Getter
public class TestFileOrganizer {

    public static final String PROMPTS_DIR = "1_prompts";
    public static final String RESPONSES_DIR = "2_raw_responses";
    public static final String PURE_TESTS_DIR = "3_pure_tests";

    private static final DateTimeFormatter DIR_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final DateTimeFormatter README_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Path baseDir;

    public TestFileOrganizer(Path baseDir) {
        this.baseDir = baseDir;
    }

    /**
     * Creates {@code <parent>/<project>_<yyyyMMdd_HHmmss>}.
     */
    public static Path createTimestampedDirectory(Path parent, String projectName, LocalDateTime now)
            throws IOException {
        Path dir = parent.resolve(sanitize(projectName) + "_" + now.format(DIR_TIMESTAMP));
        Files.createDirectories(dir);
        return dir;
    }

    public Path savePrompt(String functionName, String prompt) throws IOException {
        Path path = baseDir.resolve(PROMPTS_DIR).resolve("prompt_" + sanitize(functionName) + ".txt");
        write(path, prompt);
        return path;
    }

    /**
     * Writes all three artifacts. {@code pureCode} is written even when empty;
     * prompt and response only when present.
     */
    public DebugFileInfo organizeTestOutput(String functionName, String prompt, String rawResponse,
                                            String pureCode) throws IOException {
        String safeName = sanitize(functionName);
        Path promptPath = null;
        if (prompt != null && !prompt.isEmpty()) {
            promptPath = baseDir.resolve(PROMPTS_DIR).resolve("prompt_" + safeName + ".txt");
            write(promptPath, prompt);
        }
        Path responsePath = null;
        if (rawResponse != null && !rawResponse.isEmpty()) {
            responsePath = baseDir.resolve(RESPONSES_DIR).resolve("response_" + safeName + ".txt");
            write(responsePath, rawResponse);
        }
        Path testPath = null;
        if (pureCode != null) {
            testPath = baseDir.resolve(PURE_TESTS_DIR).resolve("test_" + safeName + ".cpp");
            write(testPath, pureCode);
        }
        return new DebugFileInfo(promptPath, responsePath, testPath);
    }

    public Path writeReadme(GenerationStatistics stats) throws IOException {
        StringBuilder readme = new StringBuilder()
                .append("# Test Generation Results\n\n")
                .append("## Generation Information\n")
                .append("- **Timestamp**: ").append(stats.getEndTime().format(README_TIMESTAMP)).append('\n')
                .append("- **Project**: ").append(stats.getProjectName()).append('\n')
                .append("- **LLM Provider**: ").append(stats.getProvider()).append('\n')
                .append("- **Model**: ").append(stats.getModel()).append('\n')
                .append("- **Total Functions**: ").append(stats.getTotalFunctions()).append('\n')
                .append("- **Successful**: ").append(stats.getSuccessful()).append('\n')
                .append("- **Failed**: ").append(stats.getFailed()).append('\n')
                .append(String.format("- **Success Rate**: %.1f%%%n", stats.getSuccessRate() * 100))
                .append(String.format("- **Duration**: %.2f s%n", stats.getDurationSeconds()))
                .append("- **Total Tokens**: ").append(stats.getTotalTokens()).append('\n')
                .append(String.format("- **Average Tokens**: %.1f%n", stats.getAverageTokens()));

        if (!stats.getFailureBreakdown().isEmpty()) {
            readme.append("\n## Failures\n");
            for (Map.Entry<String, List<String>> failure : stats.getFailureBreakdown().entrySet()) {
                readme.append("- `").append(failure.getKey()).append("`: ")
                        .append(String.join(", ", failure.getValue())).append('\n');
            }
        }

        readme.append("\n## Directory Structure\n")
                .append("- `").append(PROMPTS_DIR).append("/`: Input prompts sent to the LLM\n")
                .append("- `").append(RESPONSES_DIR).append("/`: Raw responses from the LLM\n")
                .append("- `").append(PURE_TESTS_DIR).append("/`: Extracted pure C++ test code\n")
                .append("- `test_<source>.cpp`: Aggregated tests per source file\n")
                .append("\n## Usage Notes\n")
                .append("Generated tests use Google Test framework with MockCpp for mocking.\n");

        Path path = baseDir.resolve("README.md");
        write(path, readme.toString());
        log.info("Run summary written to {}", path);
        return path;
    }

    /**
     * Replaces characters that are not safe in file names ({@code operator==} and the like).
     */
    static String sanitize(String name) {
        if (name == null || name.isBlank()) {
            return "unknown";
        }
        return name.replaceAll("[^A-Za-z0-9_.\\-]", "_");
    }

    private static void write(Path path, String content) throws IOException {
        Files.createDirectories(path.getParent());
        Files.writeString(path, content, StandardCharsets.UTF_8);
    }
}
