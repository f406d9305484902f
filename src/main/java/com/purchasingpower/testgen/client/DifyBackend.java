package com.purchasingpower.testgen.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.testgen.model.generation.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.Map;

/**
 * Dify chat-messages backend in blocking mode.
 *
 * <p>Dify has no system role or generation parameters per request; the system
 * prompt is prepended to the query and {@code maxTokens}/{@code temperature}
 * are configured on the Dify application itself.
 */
@Slf4j
public class DifyBackend extends AbstractHttpBackend {

    static final String USER_ID = "testgen-pipeline";

    public DifyBackend(WebClient.Builder webClientBuilder, String baseUrl, String apiKey, String model,
                       Duration timeout) {
        super(webClientBuilder, baseUrl, apiKey, model, timeout);
    }

    @Override
    public String getProviderName() {
        return "dify";
    }

    @Override
    public GenerationResponse generate(GenerationRequest request) {
        log.info("🔵 [LLM REQUEST] Provider=dify, PromptLength={}", request.getPrompt().length());

        String query = request.getSystemPrompt() == null || request.getSystemPrompt().isBlank()
                ? request.getPrompt()
                : request.getSystemPrompt() + "\n\n" + request.getPrompt();

        Map<String, Object> body = Map.of(
                "inputs", Map.of(),
                "query", query,
                "response_mode", "blocking",
                "user", USER_ID);

        JsonNode response = postJson("", body);

        String answer = response.path("answer").asText("");
        if (answer.isBlank()) {
            return GenerationResponse.failed("Empty answer in dify response", model);
        }

        JsonNode usage = response.path("metadata").path("usage");
        return GenerationResponse.builder()
                .success(true)
                .code(answer)
                .usage(TokenUsage.of(
                        usage.path("prompt_tokens").asInt(0),
                        usage.path("completion_tokens").asInt(0),
                        usage.path("total_tokens").asInt(0)))
                .model(model)
                .build();
    }
}
