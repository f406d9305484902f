package com.purchasingpower.testgen.service.output;

import com.purchasingpower.testgen.model.generation.AggregatedResult;
import com.purchasingpower.testgen.model.generation.GenerationResult;
import com.purchasingpower.testgen.model.generation.GenerationRunConfig;
import com.purchasingpower.testgen.model.generation.GenerationStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes run statistics and the text summary report.
 */
@Slf4j
@Component
public class TestResultAggregator {

    static final int ERROR_KEY_LENGTH = 50;

    public AggregatedResult aggregate(GenerationRunConfig config, Path outputDirectory,
                                      List<GenerationResult> results, LocalDateTime start, LocalDateTime end,
                                      String provider, String model) {
        int successful = (int) results.stream().filter(GenerationResult::isSuccess).count();
        int failed = results.size() - successful;
        long totalTokens = results.stream().mapToLong(r -> r.getUsage().getTotalTokens()).sum();

        Map<String, List<String>> breakdown = new LinkedHashMap<>();
        for (GenerationResult result : results) {
            if (!result.isSuccess()) {
                breakdown.computeIfAbsent(errorKey(result.getError()), k -> new ArrayList<>())
                        .add(result.getFunctionName());
            }
        }

        GenerationStatistics statistics = GenerationStatistics.builder()
                .startTime(start)
                .endTime(end)
                .durationSeconds(Duration.between(start, end).toMillis() / 1000.0)
                .projectName(config.getProjectName())
                .provider(provider)
                .model(model)
                .outputDirectory(outputDirectory.toString())
                .totalFunctions(results.size())
                .successful(successful)
                .failed(failed)
                .successRate(results.isEmpty() ? 0.0 : (double) successful / results.size())
                .totalTokens(totalTokens)
                .averageTokens(successful == 0 ? 0.0 : (double) totalTokens / successful)
                .failureBreakdown(breakdown)
                .build();

        log.info("📊 Generation finished: {}/{} successful, {} tokens total ({} avg)",
                successful, results.size(), totalTokens, String.format("%.1f", statistics.getAverageTokens()));
        return new AggregatedResult(config, results, statistics);
    }

    public String generateSummaryReport(AggregatedResult aggregated) {
        GenerationStatistics stats = aggregated.getStatistics();
        StringBuilder report = new StringBuilder()
                .append("==== Test Generation Summary ====\n")
                .append("Project:     ").append(stats.getProjectName()).append('\n')
                .append("Provider:    ").append(stats.getProvider()).append(" (").append(stats.getModel()).append(")\n")
                .append("Functions:   ").append(stats.getTotalFunctions()).append('\n')
                .append("Successful:  ").append(stats.getSuccessful()).append('\n')
                .append("Failed:      ").append(stats.getFailed()).append('\n')
                .append(String.format("Success:     %.1f%%%n", stats.getSuccessRate() * 100))
                .append(String.format("Duration:    %.2f s%n", stats.getDurationSeconds()))
                .append("Tokens:      ").append(stats.getTotalTokens()).append('\n')
                .append("Output:      ").append(stats.getOutputDirectory()).append('\n');

        List<GenerationResult> failures = aggregated.getResults().stream()
                .filter(r -> !r.isSuccess())
                .toList();
        if (!failures.isEmpty()) {
            report.append("Failed functions:\n");
            for (GenerationResult failure : failures) {
                report.append("  - ").append(failure.getFunctionName()).append(": ")
                        .append(failure.getError()).append('\n');
            }
        }
        return report.toString();
    }

    static String errorKey(String error) {
        String text = Objects.requireNonNullElse(error, "Unknown error");
        return text.length() > ERROR_KEY_LENGTH ? text.substring(0, ERROR_KEY_LENGTH) : text;
    }
}
