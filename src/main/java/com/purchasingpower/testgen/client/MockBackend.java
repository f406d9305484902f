package com.purchasingpower.testgen.client;

import com.purchasingpower.testgen.model.generation.TokenUsage;
import lombok.extern.slf4j.Slf4j;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic offline backend. Returns a small gtest fragment naming the
 * function found in the prompt.
 */
@Slf4j
public class MockBackend implements GenerationBackend {

    public static final String MODEL = "mock";

    private static final Pattern FUNCTION_NAME = Pattern.compile("(?m)^Function name:\\s*(\\w+)");

    @Override
    public GenerationResponse generate(GenerationRequest request) {
        String functionName = extractFunctionName(request.getPrompt());
        String code = "```cpp\n"
                + "#include <gtest/gtest.h>\n"
                + "\n"
                + "TEST(GeneratedTest, " + functionName + "Basic) {\n"
                + "    // " + functionName + " (" + request.getLanguage() + ")\n"
                + "    EXPECT_TRUE(true);\n"
                + "}\n"
                + "```\n";

        int promptTokens = request.getPrompt().length() / 4;
        int completionTokens = code.length() / 4;
        log.debug("Mock generation for '{}'", functionName);
        return GenerationResponse.builder()
                .success(true)
                .code(code)
                .usage(TokenUsage.of(promptTokens, completionTokens, 0))
                .model(MODEL)
                .build();
    }

    static String extractFunctionName(String prompt) {
        Matcher matcher = FUNCTION_NAME.matcher(prompt);
        return matcher.find() ? matcher.group(1) : "function";
    }

    @Override
    public String getProviderName() {
        return "mock";
    }

    @Override
    public String getModel() {
        return MODEL;
    }
}
