package com.purchasingpower.testgen.client;

import java.util.Arrays;
import java.util.Locale;

/**
 * Supported backends with their default endpoint and model.
 */
public enum BackendProvider {
    OPENAI("openai", "https://api.openai.com/v1", "gpt-3.5-turbo", true),
    DEEPSEEK("deepseek", "https://api.deepseek.com/v1", "deepseek-chat", true),
    DIFY("dify", "https://api.dify.ai/v1/chat-messages", "dify", true),
    MOCK("mock", null, MockBackend.MODEL, false),
    LOCAL("local", "http://localhost:11434", "qwen2.5-coder:7b", false);

    private final String id;
    private final String defaultBaseUrl;
    private final String defaultModel;
    private final boolean requiresApiKey;

    BackendProvider(String id, String defaultBaseUrl, String defaultModel, boolean requiresApiKey) {
        this.id = id;
        this.defaultBaseUrl = defaultBaseUrl;
        this.defaultModel = defaultModel;
        this.requiresApiKey = requiresApiKey;
    }

    public static BackendProvider fromId(String id) {
        if (id == null) {
            throw new IllegalArgumentException("Backend provider must be set");
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.id.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown backend provider: " + id + ". Available: openai, deepseek, dify, mock, local"));
    }

    public String getId() {
        return id;
    }

    public String getDefaultBaseUrl() {
        return defaultBaseUrl;
    }

    public String getDefaultModel() {
        return defaultModel;
    }

    public boolean requiresApiKey() {
        return requiresApiKey;
    }
}
