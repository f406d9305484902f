package com.purchasingpower.testgen.workflow.pipeline;

import com.purchasingpower.testgen.client.GenerationBackend;
import com.purchasingpower.testgen.model.generation.AggregatedResult;
import com.purchasingpower.testgen.model.generation.GenerationRunConfig;
import com.purchasingpower.testgen.service.output.TestResultAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.LocalDateTime;

/**
 * Computes run statistics and writes the README summary.
 */
@Slf4j
@Component
@Order(4)
@RequiredArgsConstructor
public class ResultAggregationStep implements PipelineStep {

    private final TestResultAggregator resultAggregator;
    private final GenerationBackend generationBackend;

    @Override
    public void execute(PipelineContext context) {
        GenerationRunConfig config = context.getConfig();
        context.setEndTime(LocalDateTime.now());

        String provider = config.getProvider() != null ? config.getProvider() : generationBackend.getProviderName();
        String model = config.getModel() != null ? config.getModel() : generationBackend.getModel();

        AggregatedResult aggregated = resultAggregator.aggregate(config, context.getOutputDirectory(),
                context.getResults(), context.getStartTime(), context.getEndTime(), provider, model);
        context.setAggregatedResult(aggregated);

        if (config.isWriteSummary()) {
            try {
                context.getOrganizer().writeReadme(aggregated.getStatistics());
            } catch (IOException e) {
                log.warn("Cannot write run summary: {}", e.getMessage());
            }
        }
    }
}
