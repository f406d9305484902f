package com.purchasingpower.testgen.service.generation;

import com.purchasingpower.testgen.client.GenerationBackend;
import com.purchasingpower.testgen.client.GenerationRequest;
import com.purchasingpower.testgen.client.GenerationResponse;
import com.purchasingpower.testgen.exception.ErrorCategory;
import com.purchasingpower.testgen.exception.GenerationBackendException;
import com.purchasingpower.testgen.model.function.FunctionDescriptor;
import com.purchasingpower.testgen.model.function.RawContext;
import com.purchasingpower.testgen.model.generation.GenerationResult;
import com.purchasingpower.testgen.model.generation.GenerationTask;
import com.purchasingpower.testgen.model.generation.TokenUsage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Core Test Generator Tests")
class CoreTestGeneratorTest {

    @Mock
    private GenerationBackend backend;

    @Mock
    private PromptGenerator promptGenerator;

    private CoreTestGenerator generator;
    private GenerationTask task;

    @BeforeEach
    void setUp() {
        generator = new CoreTestGenerator(backend, promptGenerator, new GTestCodeValidator());
        task = GenerationTask.builder()
                .index(0)
                .function(FunctionDescriptor.builder().name("add").returnType("int").file("math.c").build())
                .context(RawContext.empty())
                .targetFile(Path.of("out/test_math.cpp"))
                .suiteName("mathTest")
                .build();
        lenient().when(promptGenerator.getSystemPrompt("c")).thenReturn("system");
    }

    @Test
    @DisplayName("Should extract the fenced code and keep the raw reply")
    void testGenerate_ShouldExtractCode() {
        // Given
        String raw = "Here you go:\n```cpp\n#include <gtest/gtest.h>\nTEST(mathTest, Adds) { EXPECT_EQ(2, add(1, 1)); }\n```\nDone.";
        when(backend.generate(any())).thenReturn(GenerationResponse.builder()
                .success(true).code(raw).usage(TokenUsage.of(100, 50, 0)).model("gpt").build());

        // When
        GenerationResult result = generator.generate(task, "prompt text");

        // Then
        assertTrue(result.isSuccess());
        assertEquals("#include <gtest/gtest.h>\nTEST(mathTest, Adds) { EXPECT_EQ(2, add(1, 1)); }", result.getCode());
        assertEquals(raw, result.getRawResponse());
        assertEquals(150, result.getUsage().getTotalTokens());
        assertEquals("prompt text", result.getPrompt());

        ArgumentCaptor<GenerationRequest> request = ArgumentCaptor.forClass(GenerationRequest.class);
        verify(backend).generate(request.capture());
        assertEquals(CoreTestGenerator.MAX_TOKENS, request.getValue().getMaxTokens());
        assertEquals(CoreTestGenerator.TEMPERATURE, request.getValue().getTemperature());
        assertEquals("system", request.getValue().getSystemPrompt());
    }

    @Test
    @DisplayName("Should keep code that fails validation")
    void testGenerate_ShouldBeLenientOnValidation() {
        when(backend.generate(any())).thenReturn(GenerationResponse.builder()
                .success(true).code("int x = 1;").model("gpt").build());

        GenerationResult result = generator.generate(task, "prompt");

        assertTrue(result.isSuccess());
        assertEquals("int x = 1;", result.getCode());
    }

    @Test
    @DisplayName("Should convert backend exceptions into failed results")
    void testGenerate_ShouldCaptureBackendFailure() {
        when(backend.generate(any())).thenThrow(new GenerationBackendException(
                "openai generation failed [AUTHENTICATION]", ErrorCategory.AUTHENTICATION, false, "openai", 1, null));

        GenerationResult result = generator.generate(task, "prompt");

        assertFalse(result.isSuccess());
        assertEquals(ErrorCategory.AUTHENTICATION, result.getErrorCategory());
        assertTrue(result.getError().contains("AUTHENTICATION"));
        assertEquals("prompt", result.getPrompt());
    }

    @Test
    @DisplayName("Should report a backend rejection as a provider failure")
    void testGenerate_ShouldHandleUnsuccessfulReply() {
        when(backend.generate(any())).thenReturn(GenerationResponse.failed("No choices", "gpt"));

        GenerationResult result = generator.generate(task, "prompt");

        assertFalse(result.isSuccess());
        assertEquals(ErrorCategory.PROVIDER, result.getErrorCategory());
        assertEquals("No choices", result.getError());
        assertEquals("gpt", result.getModel());
    }

    @Test
    @DisplayName("Should fail a blank prompt as a configuration error without calling the backend")
    void testGenerate_ShouldRejectBlankPrompt() {
        GenerationResult result = generator.generate(task, "  ");

        assertFalse(result.isSuccess());
        assertEquals(ErrorCategory.CONFIGURATION, result.getErrorCategory());
        verify(backend, never()).generate(any());
    }
}
