package com.purchasingpower.testgen.client;

import com.purchasingpower.testgen.config.GlobalRetryConfig;
import com.purchasingpower.testgen.configuration.LlmProperties;
import com.purchasingpower.testgen.service.resilience.CircuitBreaker;
import com.purchasingpower.testgen.service.resilience.ErrorClassifier;
import com.purchasingpower.testgen.service.resilience.RetryExecutor;
import com.purchasingpower.testgen.service.resilience.Sleeper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Creates the generation backend selected by {@code app.llm.provider}.
 *
 * <p>Credentials are checked here, before any pipeline work starts: a provider
 * that needs an API key fails fast with {@link IllegalStateException}.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GenerationBackendFactory {

    private final WebClient.Builder webClientBuilder;
    private final GlobalRetryConfig retryConfig;

    public GenerationBackend create(LlmProperties properties) {
        BackendProvider provider = BackendProvider.fromId(properties.getProvider());
        String model = isBlank(properties.getModel()) ? provider.getDefaultModel() : properties.getModel();
        String baseUrl = isBlank(properties.getBaseUrl()) ? provider.getDefaultBaseUrl() : properties.getBaseUrl();
        Duration timeout = Duration.ofSeconds(properties.getTimeoutSeconds());

        if (provider.requiresApiKey() && isBlank(properties.getApiKey())) {
            throw new IllegalStateException("No API key configured for provider '" + provider.getId()
                    + "'. Set app.llm.api-key.");
        }

        log.info("🚀 Generation backend configured: provider={}, model={}", provider.getId(), model);
        return switch (provider) {
            case OPENAI, DEEPSEEK -> new OpenAiCompatibleBackend(webClientBuilder, provider.getId(), baseUrl,
                    properties.getApiKey(), model, timeout);
            case DIFY -> new DifyBackend(webClientBuilder, baseUrl, properties.getApiKey(), model, timeout);
            case MOCK -> new MockBackend();
            case LOCAL -> new LocalBackend(baseUrl, model, timeout);
        };
    }

    /**
     * Creates the backend and wraps it with retry and a circuit breaker from {@code app.retry}.
     */
    public ResilientGenerationBackend createResilient(LlmProperties properties) {
        GenerationBackend backend = create(properties);
        RetryExecutor retryExecutor = new RetryExecutor(retryConfig.toRetryPolicy(), new ErrorClassifier(),
                Sleeper.THREAD, backend.getProviderName());
        GlobalRetryConfig.CircuitBreakerConfig breaker = retryConfig.getCircuitBreaker();
        CircuitBreaker circuitBreaker = new CircuitBreaker(backend.getProviderName() + "-backend",
                breaker.getFailureThreshold(), Duration.ofMillis(breaker.getRecoveryTimeoutMs()));
        return new ResilientGenerationBackend(backend, retryExecutor, circuitBreaker);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
