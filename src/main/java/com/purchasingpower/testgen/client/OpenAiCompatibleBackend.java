package com.purchasingpower.testgen.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.testgen.model.generation.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Chat-completions backend for OpenAI and API-compatible providers such as DeepSeek.
 */
@Slf4j
public class OpenAiCompatibleBackend extends AbstractHttpBackend {

    private final String providerName;

    public OpenAiCompatibleBackend(WebClient.Builder webClientBuilder, String providerName, String baseUrl,
                                   String apiKey, String model, Duration timeout) {
        super(webClientBuilder, baseUrl, apiKey, model, timeout);
        this.providerName = providerName;
    }

    @Override
    public String getProviderName() {
        return providerName;
    }

    @Override
    public GenerationResponse generate(GenerationRequest request) {
        log.info("🔵 [LLM REQUEST] Provider={}, Model={}, PromptLength={}",
                providerName, model, request.getPrompt().length());

        List<Map<String, String>> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(Map.of("role", "system", "content", request.getSystemPrompt()));
        }
        messages.add(Map.of("role", "user", "content", request.getPrompt()));

        Map<String, Object> body = Map.of(
                "model", model,
                "messages", messages,
                "max_tokens", request.getMaxTokens(),
                "temperature", request.getTemperature());

        JsonNode response = postJson("/chat/completions", body);

        JsonNode choices = response.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            return GenerationResponse.failed("No choices in " + providerName + " response", model);
        }
        String content = choices.get(0).path("message").path("content").asText("");
        if (content.isBlank()) {
            return GenerationResponse.failed("Empty content in " + providerName + " response", model);
        }

        JsonNode usage = response.path("usage");
        return GenerationResponse.builder()
                .success(true)
                .code(content)
                .usage(TokenUsage.of(
                        usage.path("prompt_tokens").asInt(0),
                        usage.path("completion_tokens").asInt(0),
                        usage.path("total_tokens").asInt(0)))
                .model(response.path("model").asText(model))
                .build();
    }
}
