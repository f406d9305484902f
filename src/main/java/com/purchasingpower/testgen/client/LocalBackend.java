package com.purchasingpower.testgen.client;

import com.purchasingpower.testgen.exception.BackendConnectionException;
import com.purchasingpower.testgen.exception.BackendTimeoutException;
import com.purchasingpower.testgen.model.generation.TokenUsage;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Local model served by Ollama.
 *
 * <p>LangChain4j's own retries are disabled; retrying is left to the resilience layer.
 */
@Slf4j
public class LocalBackend implements GenerationBackend {

    private final String model;
    private final BiFunction<Integer, Double, ChatLanguageModel> modelFactory;

    public LocalBackend(String baseUrl, String model, Duration timeout) {
        this(model, (maxTokens, temperature) -> OllamaChatModel.builder()
                .baseUrl(baseUrl)
                .modelName(model)
                .temperature(temperature)
                .numPredict(maxTokens)
                .timeout(timeout)
                .maxRetries(0)
                .build());
    }

    LocalBackend(String model, BiFunction<Integer, Double, ChatLanguageModel> modelFactory) {
        this.model = model;
        this.modelFactory = modelFactory;
    }

    @Override
    public GenerationResponse generate(GenerationRequest request) {
        log.info("🔵 [LLM REQUEST] Provider=local, Model={}, PromptLength={}", model, request.getPrompt().length());

        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        messages.add(UserMessage.from(request.getPrompt()));

        ChatLanguageModel chatModel = modelFactory.apply(request.getMaxTokens(), request.getTemperature());
        Response<AiMessage> response;
        try {
            response = chatModel.generate(messages);
        } catch (RuntimeException e) {
            throw translate(e);
        }

        String text = response.content() == null ? "" : Objects.requireNonNullElse(response.content().text(), "");
        if (text.isBlank()) {
            return GenerationResponse.failed("Empty reply from local model " + model, model);
        }

        TokenUsage usage = TokenUsage.empty();
        if (response.tokenUsage() != null) {
            usage = TokenUsage.of(
                    Objects.requireNonNullElse(response.tokenUsage().inputTokenCount(), 0),
                    Objects.requireNonNullElse(response.tokenUsage().outputTokenCount(), 0),
                    Objects.requireNonNullElse(response.tokenUsage().totalTokenCount(), 0));
        }
        return GenerationResponse.builder()
                .success(true)
                .code(text)
                .usage(usage)
                .model(model)
                .build();
    }

    private RuntimeException translate(RuntimeException error) {
        for (Throwable cause = error; cause != null; cause = cause.getCause()) {
            if (cause instanceof SocketTimeoutException || cause instanceof HttpTimeoutException) {
                return new BackendTimeoutException("Local model " + model + " timed out", error);
            }
            if (cause instanceof ConnectException) {
                return new BackendConnectionException("Cannot reach Ollama: " + cause.getMessage(), error);
            }
        }
        return error;
    }

    @Override
    public String getProviderName() {
        return "local";
    }

    @Override
    public String getModel() {
        return model;
    }
}
