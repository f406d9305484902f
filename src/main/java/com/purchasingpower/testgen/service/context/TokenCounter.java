package com.purchasingpower.testgen.service.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.model.Tokenizer;
import dev.langchain4j.model.openai.OpenAiTokenizer;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Estimates the token cost of text and structured data for one provider/model pair.
 *
 * <p>Counts with the OpenAI BPE tokenizer for the configured model, falling back to the
 * {@code gpt-3.5-turbo} encoding when the model is not known to the tokenizer. The {@code mock}
 * provider has no tokenizer and uses the 4-characters-per-token approximation. Structured data
 * is serialized to JSON before counting.
 *
 * @since 1.0.0
 */
@Slf4j
@Getter
public class TokenCounter {

    public static final int DEFAULT_MODEL_LIMIT = 4000;
    public static final int MIN_AVAILABLE_TOKENS = 500;

    private static final double CONTEXT_SHARE = 0.8;
    private static final int CHARS_PER_TOKEN = 4;
    private static final String MOCK_PROVIDER = "mock";
    private static final String FALLBACK_ENCODING_MODEL = "gpt-3.5-turbo";

    private static final Map<String, Map<String, Integer>> MODEL_LIMITS = Map.of(
            "openai", Map.of(
                    "gpt-3.5-turbo", 4096,
                    "gpt-4", 8192,
                    "gpt-4-turbo", 128_000),
            "deepseek", Map.of(
                    "deepseek-chat", 128_000,
                    "deepseek-coder", 16_384),
            "mock", Map.of(
                    "mock", 8000));

    private final String provider;
    private final String model;
    private final ObjectMapper objectMapper;

    @Getter(AccessLevel.NONE)
    private final Tokenizer tokenizer;

    public TokenCounter(String provider, String model, ObjectMapper objectMapper) {
        this.provider = provider;
        this.model = model;
        this.objectMapper = objectMapper;
        this.tokenizer = MOCK_PROVIDER.equals(provider) ? null : tokenizerFor(model);
    }

    private static Tokenizer tokenizerFor(String model) {
        if (model != null && !model.isBlank()) {
            try {
                OpenAiTokenizer tokenizer = new OpenAiTokenizer(model);
                tokenizer.estimateTokenCountInText("");
                return tokenizer;
            } catch (RuntimeException e) {
                log.debug("No tokenizer encoding for model '{}', using {}: {}",
                        model, FALLBACK_ENCODING_MODEL, e.getMessage());
            }
        }
        return new OpenAiTokenizer(FALLBACK_ENCODING_MODEL);
    }

    public boolean isApproximate() {
        return tokenizer == null;
    }

    public int countTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        if (tokenizer == null) {
            return text.length() / CHARS_PER_TOKEN;
        }
        return tokenizer.estimateTokenCountInText(text);
    }

    public int countTokens(Object data) {
        if (data instanceof String text) {
            return countTokens(text);
        }
        try {
            return countTokens(objectMapper.writeValueAsString(data));
        } catch (JsonProcessingException e) {
            log.warn("Falling back to toString() for token estimate: {}", e.getMessage());
            return countTokens(String.valueOf(data));
        }
    }

    public int getModelLimit() {
        return MODEL_LIMITS.getOrDefault(provider, Map.of()).getOrDefault(model, DEFAULT_MODEL_LIMIT);
    }

    /**
     * Tokens left for context: 80% of the model limit minus the fixed prompt, never below 500.
     */
    public int getAvailableTokens(int basePromptTokens) {
        int available = (int) Math.floor(getModelLimit() * CONTEXT_SHARE) - basePromptTokens;
        return Math.max(available, MIN_AVAILABLE_TOKENS);
    }
}
