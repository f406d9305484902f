package com.purchasingpower.testgen.client;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Mock Backend Tests")
class MockBackendTest {

    private final MockBackend backend = new MockBackend();

    @Test
    @DisplayName("Should produce a fenced gtest fragment naming the function")
    void testGenerate_ShouldNameFunctionFromPrompt() {
        // Given
        GenerationRequest request = GenerationRequest.builder()
                .prompt("Write tests.\nFunction name: parse_header\nSignature: int parse_header(char *)")
                .maxTokens(2500)
                .temperature(0.3)
                .build();

        // When
        GenerationResponse response = backend.generate(request);

        // Then
        assertTrue(response.isSuccess());
        assertThat(response.getCode())
                .startsWith("```cpp")
                .contains("#include <gtest/gtest.h>")
                .contains("TEST(GeneratedTest, parse_headerBasic)");
        assertEquals(request.getPrompt().length() / 4, response.getUsage().getPromptTokens());
        assertEquals(response.getUsage().getPromptTokens() + response.getUsage().getCompletionTokens(),
                response.getUsage().getTotalTokens());
    }

    @Test
    @DisplayName("Should be deterministic for the same prompt")
    void testGenerate_ShouldBeDeterministic() {
        GenerationRequest request = GenerationRequest.builder()
                .prompt("Function name: add")
                .maxTokens(10)
                .temperature(0)
                .build();

        assertEquals(backend.generate(request).getCode(), backend.generate(request).getCode());
    }

    @Test
    @DisplayName("Should fall back to a generic name when the prompt has none")
    void testExtractFunctionName_ShouldFallBack() {
        assertEquals("function", MockBackend.extractFunctionName("no marker here"));
    }

    @Test
    @DisplayName("Should reject invalid requests at construction")
    void testRequest_ShouldValidateArguments() {
        assertThrows(IllegalArgumentException.class,
                () -> GenerationRequest.builder().prompt(" ").maxTokens(10).temperature(0.3).build());
        assertThrows(IllegalArgumentException.class,
                () -> GenerationRequest.builder().prompt("p").maxTokens(0).temperature(0.3).build());
        assertThrows(IllegalArgumentException.class,
                () -> GenerationRequest.builder().prompt("p").maxTokens(10).temperature(2.5).build());
        assertEquals("c", GenerationRequest.builder().prompt("p").maxTokens(10).temperature(1).build().getLanguage());
    }
}
