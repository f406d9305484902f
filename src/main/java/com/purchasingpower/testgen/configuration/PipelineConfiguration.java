package com.purchasingpower.testgen.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.testgen.client.BackendProvider;
import com.purchasingpower.testgen.client.GenerationBackend;
import com.purchasingpower.testgen.client.GenerationBackendFactory;
import com.purchasingpower.testgen.config.CompressionProperties;
import com.purchasingpower.testgen.service.context.ContextCompressor;
import com.purchasingpower.testgen.service.context.ContextCompressorImpl;
import com.purchasingpower.testgen.service.context.DependencyRanker;
import com.purchasingpower.testgen.service.context.TokenCounter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the pieces that are built from configuration values rather than scanned.
 *
 * <ul>
 *   <li>{@link TokenCounter} for the configured provider/model
 *   <li>{@link ContextCompressor} using that counter
 *   <li>{@link GenerationBackend}: the selected backend behind retry and a circuit breaker
 * </ul>
 */
@Slf4j
@Configuration
public class PipelineConfiguration {

    @Bean
    public TokenCounter tokenCounter(AppProperties appProperties, ObjectMapper objectMapper) {
        LlmProperties llm = appProperties.getLlm();
        String model = llm.getModel() == null || llm.getModel().isBlank()
                ? BackendProvider.fromId(llm.getProvider()).getDefaultModel()
                : llm.getModel();
        TokenCounter counter = new TokenCounter(llm.getProvider(), model, objectMapper);
        log.info("Token budget: provider={}, model={}, limit={}", llm.getProvider(), model, counter.getModelLimit());
        return counter;
    }

    @Bean
    public ContextCompressor contextCompressor(DependencyRanker dependencyRanker, TokenCounter tokenCounter,
                                               CompressionProperties compressionProperties) {
        return new ContextCompressorImpl(dependencyRanker, tokenCounter, compressionProperties);
    }

    @Bean
    public GenerationBackend generationBackend(GenerationBackendFactory factory, AppProperties appProperties) {
        return factory.createResilient(appProperties.getLlm());
    }
}
