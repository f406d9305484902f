package com.purchasingpower.testgen.service.generation;

import com.purchasingpower.testgen.model.context.CalledFunctionSummary;
import com.purchasingpower.testgen.model.context.CompilationInfo;
import com.purchasingpower.testgen.model.context.CompressedContext;
import com.purchasingpower.testgen.model.context.DependencyContext;
import com.purchasingpower.testgen.model.context.TargetFunctionSummary;
import com.purchasingpower.testgen.model.context.UsagePattern;
import com.purchasingpower.testgen.model.function.ExistingTestsContext;
import com.purchasingpower.testgen.model.function.FunctionDescriptor;
import com.purchasingpower.testgen.model.generation.GenerationTask;
import com.purchasingpower.testgen.service.context.ContextCompressor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders the generation prompt for a task from its compressed context.
 *
 * <p>Functions that look like memory management (name contains free, delete,
 * alloc, malloc, new, release or destroy, or a pointer return type) get an
 * extra section with memory-safety guidance.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PromptGenerator {

    public static final String TEMPLATE = "test-generation";

    private static final List<String> MEMORY_KEYWORDS =
            List.of("free", "delete", "alloc", "malloc", "new", "release", "destroy");
    private static final String NONE = "none";

    private final ContextCompressor contextCompressor;
    private final PromptLibraryService promptLibrary;

    public String generatePrompt(GenerationTask task) {
        CompressedContext context = contextCompressor.compress(task.getFunction(), task.getContext());
        log.debug("Prompt context for '{}': {} tokens (budget {}, level {})", task.getFunctionName(),
                context.getTokenCount(), context.getAvailableTokens(), context.getCompressionLevel());

        Map<String, Object> variables = buildVariables(context, task);
        String prompt = promptLibrary.render(TEMPLATE, variables);
        log.debug("Rendered prompt for '{}' ({} chars)", task.getFunctionName(), prompt.length());
        return prompt;
    }

    public String getSystemPrompt(String language) {
        return promptLibrary.getSystemPrompt(TEMPLATE, language);
    }

    static boolean isMemoryFunction(FunctionDescriptor function) {
        String name = Objects.requireNonNullElse(function.getName(), "").toLowerCase(Locale.ROOT);
        String returnType = Objects.requireNonNullElse(function.getReturnType(), "");
        return MEMORY_KEYWORDS.stream().anyMatch(name::contains) || returnType.contains("*");
    }

    private Map<String, Object> buildVariables(CompressedContext context, GenerationTask task) {
        TargetFunctionSummary target = context.getTargetFunction();
        DependencyContext deps = context.getDependencies();
        CompilationInfo compilation = context.getCompilationInfo();
        String language = Objects.requireNonNullElse(target.getLanguage(), "c").toLowerCase(Locale.ROOT);
        boolean cpp = language.equals("cpp") || language.equals("c++");

        Map<String, Object> vars = new HashMap<>();
        vars.put("functionName", target.getName());
        vars.put("signature", target.getSignature());
        vars.put("returnType", target.getReturnType());
        vars.put("parameters", joinOrNone(target.getParameters().stream()
                .map(p -> p.getType() + " " + p.getName())
                .collect(Collectors.toList())));
        vars.put("languageDisplay", cpp ? "C++" : "C");
        vars.put("languageFence", cpp ? "cpp" : "c");
        vars.put("cpp", cpp);
        vars.put("staticLabel", target.isStaticFunction() ? "yes" : "no");
        vars.put("accessSpecifier", Objects.requireNonNullElse(target.getAccessSpecifier(), "public"));
        vars.put("location", target.getLocation());
        vars.put("body", Objects.requireNonNullElse(target.getBody(), ""));
        vars.put("suiteName", task.getSuiteName());

        vars.put("calledFunctionNames", joinOrNone(deps.getCalledFunctions().stream()
                .map(CalledFunctionSummary::getName)
                .collect(Collectors.toList())));
        vars.put("hasCallees", !deps.getCalledFunctions().isEmpty());
        vars.put("staticCallees", deps.getCalledFunctions().stream()
                .filter(f -> f.getDefinition() != null && !f.getDefinition().isBlank())
                .map(f -> entry(f.getName(), f.getDefinition(), f.getLocation()))
                .collect(Collectors.toList()));
        vars.put("macroNames", joinOrNone(deps.getMacros()));
        vars.put("macroDefinitions", deps.getMacroDefinitions().stream()
                .map(m -> entry(m.getName(), m.getDefinition(), m.getLocation()))
                .collect(Collectors.toList()));
        vars.put("dataStructureNames", joinOrNone(deps.getDataStructures()));
        vars.put("dataStructureDefinitions", deps.getDataStructureDefinitions().stream()
                .map(s -> entry(s.getName(), s.getDefinition(), s.getLocation()))
                .collect(Collectors.toList()));

        List<Map<String, Object>> usage = new ArrayList<>();
        int number = 1;
        for (UsagePattern pattern : context.getUsagePatterns()) {
            usage.add(Map.of(
                    "number", number++,
                    "file", pattern.getFile(),
                    "line", pattern.getLine(),
                    "preview", pattern.getPreview()));
        }
        vars.put("usagePatterns", usage);

        CompilationInfo info = compilation != null ? compilation : CompilationInfo.empty();
        vars.put("keyFlags", joinOrNone(info.getKeyFlags()));
        vars.put("totalFlagsCount", info.getTotalFlagsCount());

        vars.put("existingTests", existingTests(task.getExistingTestsContext()));
        String fixture = task.getExistingFixtureCode();
        vars.put("fixtureCode", fixture == null || fixture.isBlank() ? null : fixture);
        vars.put("memoryFunction", isMemoryFunction(task.getFunction()));
        return vars;
    }

    private Map<String, Object> existingTests(ExistingTestsContext tests) {
        if (tests == null) {
            return null;
        }
        return Map.of(
                "matchedFiles", joinOrNone(tests.getMatchedFiles()),
                "existingTestFunctions", joinOrNone(tests.getExistingTestFunctions()),
                "existingTestClasses", joinOrNone(tests.getExistingTestClasses()),
                "coverageSummary", Objects.requireNonNullElse(tests.getCoverageSummary(), "unknown"));
    }

    private static Map<String, Object> entry(String name, String definition, String location) {
        return Map.of(
                "name", Objects.requireNonNullElse(name, "unknown"),
                "definition", Objects.requireNonNullElse(definition, ""),
                "location", Objects.requireNonNullElse(location, "unknown"));
    }

    private static String joinOrNone(List<String> values) {
        return values == null || values.isEmpty() ? NONE : String.join(", ", values);
    }
}
