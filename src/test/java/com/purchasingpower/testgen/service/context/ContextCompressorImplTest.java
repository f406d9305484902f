package com.purchasingpower.testgen.service.context;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.testgen.config.CompressionProperties;
import com.purchasingpower.testgen.model.context.CalledFunctionSummary;
import com.purchasingpower.testgen.model.context.CompressedContext;
import com.purchasingpower.testgen.model.context.UsagePattern;
import com.purchasingpower.testgen.model.function.CallSite;
import com.purchasingpower.testgen.model.function.CalledFunction;
import com.purchasingpower.testgen.model.function.DataStructure;
import com.purchasingpower.testgen.model.function.FunctionDescriptor;
import com.purchasingpower.testgen.model.function.MacroDefinition;
import com.purchasingpower.testgen.model.function.RawContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("Context Compressor Tests")
class ContextCompressorImplTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private CompressionProperties properties;
    private FunctionDescriptor function;

    @BeforeEach
    void setUp() {
        properties = new CompressionProperties();
        function = FunctionDescriptor.builder()
                .name("process")
                .returnType("int")
                .file("/proj/src/process.c")
                .line(12)
                .body("int process(int x) {\n    return helper(x) + 1;\n}")
                .build();
    }

    private ContextCompressorImpl compressor(TokenCounter counter) {
        return new ContextCompressorImpl(new DependencyRanker(), counter, properties);
    }

    private RawContext richContext() {
        List<CalledFunction> callees = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            callees.add(CalledFunction.builder()
                    .name("callee" + i)
                    .location("/proj/src/other" + i + ".c:1")
                    .declaration("int callee" + i + "(int);")
                    .definition("int callee" + i + "(int v) { return v; }")
                    .isStatic(i == 0)
                    .build());
        }
        List<String> macros = new ArrayList<>();
        List<MacroDefinition> macroDefinitions = new ArrayList<>();
        List<DataStructure> structures = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            macros.add("M" + i);
            macroDefinitions.add(MacroDefinition.builder()
                    .name("M" + i).definition("#define M" + i + "(x) ((x) + " + i + ")").location("m.h:" + i).build());
            structures.add(DataStructure.builder()
                    .name("S" + i).definition("struct S" + i + " {\n int a;\n int b;\n int c;\n int d;\n};").location("s.h:" + i).build());
        }
        return RawContext.builder()
                .calledFunctions(callees)
                .macros(macros)
                .macroDefinitions(macroDefinitions)
                .dataStructures(structures)
                .callSites(List.of(
                        site("/proj/a.c", 5, "x".repeat(300)),
                        site("/proj/a.c", 9, "process(2);"),
                        site("/proj/b.c", 3, "process(3);"),
                        site("/proj/c.c", 7, "process(4);")))
                .compilationFlags(List.of("-Wall", "-I/include", "-DDEBUG=1", "-std=c11", "-O2", "-Wextra"))
                .build();
    }

    private static CallSite site(String file, int line, String context) {
        return CallSite.builder().file(file).line(line).context(context).build();
    }

    @Test
    @DisplayName("Should apply the default selection limits")
    void testCompress_ShouldSelectWithinLimits() {
        // Given
        TokenCounter counter = new TokenCounter("deepseek", "deepseek-chat", objectMapper);

        // When
        CompressedContext context = compressor(counter).compress(function, richContext());

        // Then
        assertEquals(0, context.getCompressionLevel());
        assertTrue(context.isWithinBudget());
        assertEquals(5, context.getDependencies().getCalledFunctions().size());
        assertEquals(3, context.getDependencies().getDataStructures().size());
        assertEquals(4, context.getDependencies().getMacros().size());
        assertEquals(4, context.getDependencies().getMacroDefinitions().size());
        assertEquals(3, context.getDependencies().getDataStructureDefinitions().size());
        assertEquals(List.of("-I/include", "-DDEBUG=1", "-std=c11"), context.getCompilationInfo().getKeyFlags());
        assertEquals(6, context.getCompilationInfo().getTotalFlagsCount());
    }

    @Test
    @DisplayName("Should attach definitions only for static callees")
    void testCompress_ShouldExposeStaticCalleeDefinitions() {
        TokenCounter counter = new TokenCounter("deepseek", "deepseek-chat", objectMapper);

        CompressedContext context = compressor(counter).compress(function, richContext());

        List<CalledFunctionSummary> callees = context.getDependencies().getCalledFunctions();
        assertThat(callees).filteredOn(c -> c.getDefinition() != null)
                .extracting(CalledFunctionSummary::getName)
                .containsExactly("callee0");
    }

    @Test
    @DisplayName("Should pick usage previews from distinct files, capped at 200 characters")
    void testCompress_ShouldSelectDiverseUsagePatterns() {
        TokenCounter counter = new TokenCounter("deepseek", "deepseek-chat", objectMapper);

        CompressedContext context = compressor(counter).compress(function, richContext());

        List<UsagePattern> usage = context.getUsagePatterns();
        assertEquals(List.of("/proj/a.c", "/proj/b.c"),
                usage.stream().map(UsagePattern::getFile).collect(Collectors.toList()));
        assertEquals(200, usage.get(0).getPreview().length());
    }

    @Test
    @DisplayName("Should keep a single preview when all call sites share one file")
    void testCompress_ShouldNotRepeatFiles() {
        TokenCounter counter = new TokenCounter("mock", "mock", objectMapper);
        RawContext raw = RawContext.builder()
                .callSites(List.of(site("/proj/a.c", 1, "process(1);"),
                        site("/proj/a.c", 2, "process(2);")))
                .build();

        CompressedContext context = compressor(counter).compress(function, raw);

        assertEquals(1, context.getUsagePatterns().size());
    }

    @Test
    @DisplayName("Should stop at the first level that fits the budget")
    void testCompress_ShouldStopAtLevelTwo() {
        // Given: over budget until at most 3 callees remain
        TokenCounter counter = mock(TokenCounter.class);
        when(counter.getAvailableTokens(anyInt())).thenReturn(1000);
        when(counter.countTokens(any(Object.class))).thenAnswer(invocation -> {
            CompressedContext ctx = invocation.getArgument(0);
            return ctx.getDependencies().getCalledFunctions().size() > 3 ? 5000 : 800;
        });

        // When
        CompressedContext context = compressor(counter).compress(function, richContext());

        // Then
        assertEquals(2, context.getCompressionLevel());
        assertTrue(context.isWithinBudget());
        assertEquals(3, context.getDependencies().getCalledFunctions().size());
        assertEquals(2, context.getDependencies().getMacroDefinitions().size());
        assertEquals(1, context.getDependencies().getDataStructureDefinitions().size());
        assertEquals(4, context.getDependencies().getMacros().size(), "Macro names keep the default limit");
        assertEquals(3, context.getDependencies().getDataStructures().size(), "Struct names keep the default limit");
        assertTrue(context.getUsagePatterns().stream().allMatch(u -> u.getPreview().length() <= 150),
                "Level 1 preview trimming stays in effect");
    }

    @Test
    @DisplayName("Should return a best-effort result with the full body when nothing fits")
    void testCompress_ShouldNeverTruncateBody() {
        // Given: a body that alone exceeds the minimum budget
        String hugeBody = "int process(int x) {\n" + "    x += 1;\n".repeat(800) + "    return x;\n}";
        FunctionDescriptor big = function.toBuilder().body(hugeBody).build();
        properties.setBasePromptTokens(100_000);
        TokenCounter counter = new TokenCounter("openai", "gpt-3.5-turbo", objectMapper);

        // When
        CompressedContext context = compressor(counter).compress(big, richContext());

        // Then
        assertEquals(3, context.getCompressionLevel());
        assertFalse(context.isWithinBudget());
        assertEquals(500, context.getAvailableTokens());
        assertEquals(hugeBody, context.getTargetFunction().getBody());
        assertTrue(context.getUsagePatterns().isEmpty());
        assertEquals(1, context.getDependencies().getCalledFunctions().size());
        assertTrue(context.getDependencies().getMacroDefinitions().isEmpty());
        assertTrue(context.getDependencies().getDataStructureDefinitions().isEmpty());
    }

    @Test
    @DisplayName("Should pass everything through when compression is disabled")
    void testCompress_ShouldReturnFullContextWhenDisabled() {
        properties.setEnabled(false);
        TokenCounter counter = new TokenCounter("deepseek", "deepseek-chat", objectMapper);

        CompressedContext context = compressor(counter).compress(function, richContext());

        assertEquals(8, context.getDependencies().getCalledFunctions().size());
        assertEquals(6, context.getDependencies().getMacros().size());
        assertEquals(4, context.getUsagePatterns().size());
        assertEquals(300, context.getUsagePatterns().get(0).getPreview().length());
        assertEquals(4, context.getCompilationInfo().getKeyFlags().size());
    }

    @Test
    @DisplayName("Should use the larger limits at level 0 and clamp out-of-range levels")
    void testCompress_ShouldHonorConfiguredLevel() {
        TokenCounter counter = new TokenCounter("deepseek", "deepseek-chat", objectMapper);

        properties.setLevel(0);
        assertEquals(8, compressor(counter).compress(function, richContext())
                .getDependencies().getCalledFunctions().size());

        properties.setLevel(7);
        assertEquals(3, compressor(counter).compress(function, richContext())
                .getDependencies().getCalledFunctions().size());
    }
}
