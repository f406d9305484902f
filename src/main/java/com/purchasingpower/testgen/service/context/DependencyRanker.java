package com.purchasingpower.testgen.service.context;

import com.purchasingpower.testgen.model.function.CalledFunction;
import com.purchasingpower.testgen.model.function.DataStructure;
import com.purchasingpower.testgen.model.function.FunctionDescriptor;
import com.purchasingpower.testgen.model.function.MacroDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Scores the dependencies of a target function so the compressor can keep the useful ones.
 *
 * <p><b>Scoring:</b>
 * <ul>
 *   <li>Called functions: +2.0 when located in the target's directory, +2.0 for a
 *       critical name, plus 1.2 x complexity (0.2 per parameter, +0.3 for pointer
 *       or struct return types). Minimum 0.1.</li>
 *   <li>Data structures: 0.1 per definition line when the definition declares a
 *       struct or class, +1.5 for a critical name. Minimum 0.1.</li>
 *   <li>Macros: +2.2 for function-like definitions, +1.2 for a critical name,
 *       halved when the definition has at most 3 tokens. Minimum 0.05.</li>
 * </ul>
 *
 * <p>Rankings are sorted by descending score with a stable sort, so identical
 * inputs always produce identical output.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class DependencyRanker {

    private static final double SAME_MODULE_WEIGHT = 2.0;
    private static final double COMPLEXITY_WEIGHT = 1.2;
    private static final double MACRO_COMPLEXITY_WEIGHT = 1.1;

    private static final double CRITICAL_FUNCTION_BONUS = 2.0;
    private static final double CRITICAL_STRUCT_BONUS = 1.5;
    private static final double CRITICAL_MACRO_BONUS = 1.2;

    private static final double MIN_FUNCTION_SCORE = 0.1;
    private static final double MIN_STRUCT_SCORE = 0.1;
    private static final double MIN_MACRO_SCORE = 0.05;

    private static final Pattern CRITICAL_NAME = Pattern.compile(
            "malloc|free|alloc|dealloc|create|destroy|init|cleanup|error|assert|check|validate",
            Pattern.CASE_INSENSITIVE);

    private static final Comparator<RankedDependency<?>> BY_SCORE_DESC =
            Comparator.comparingDouble((RankedDependency<?> d) -> d.score()).reversed();

    public List<RankedDependency<CalledFunction>> rankCalledFunctions(FunctionDescriptor target,
                                                                     List<CalledFunction> calledFunctions) {
        List<RankedDependency<CalledFunction>> ranked = new ArrayList<>();
        for (CalledFunction function : nullSafe(calledFunctions)) {
            double score = scoreFunction(target, function);
            ranked.add(new RankedDependency<>(function.getName(), DependencyKind.CALLED_FUNCTION,
                    ImportanceLevel.fromScore(score), score, function));
        }
        ranked.sort(BY_SCORE_DESC);
        return ranked;
    }

    public List<RankedDependency<DataStructure>> rankDataStructures(List<DataStructure> dataStructures) {
        List<RankedDependency<DataStructure>> ranked = new ArrayList<>();
        for (DataStructure structure : nullSafe(dataStructures)) {
            double score = scoreDataStructure(structure);
            ranked.add(new RankedDependency<>(structure.getName(), DependencyKind.DATA_STRUCTURE,
                    ImportanceLevel.fromScore(score), score, structure));
        }
        ranked.sort(BY_SCORE_DESC);
        return ranked;
    }

    /**
     * Ranks macro names. Names without a matching definition are scored against an empty one.
     */
    public List<RankedDependency<MacroDefinition>> rankMacros(List<String> macros,
                                                             List<MacroDefinition> definitions) {
        Map<String, MacroDefinition> byName = nullSafe(definitions).stream()
                .filter(d -> d.getName() != null)
                .collect(Collectors.toMap(MacroDefinition::getName, Function.identity(), (a, b) -> a));

        List<RankedDependency<MacroDefinition>> ranked = new ArrayList<>();
        for (String name : nullSafe(macros)) {
            MacroDefinition definition = byName.getOrDefault(name,
                    MacroDefinition.builder().name(name).definition("").build());
            double score = scoreMacro(name, definition);
            ranked.add(new RankedDependency<>(name, DependencyKind.MACRO,
                    ImportanceLevel.fromScore(score), score, definition));
        }
        ranked.sort(BY_SCORE_DESC);
        return ranked;
    }

    /**
     * Returns at most {@code maxCount} dependencies at or above {@code minImportance}, in rank order.
     */
    public static <T> List<RankedDependency<T>> selectTop(List<RankedDependency<T>> ranked,
                                                          int maxCount,
                                                          ImportanceLevel minImportance) {
        return ranked.stream()
                .filter(d -> d.importance().isAtLeast(minImportance))
                .limit(Math.max(maxCount, 0))
                .collect(Collectors.toList());
    }

    double scoreFunction(FunctionDescriptor target, CalledFunction function) {
        double score = 0.0;
        if (target != null && isSameModule(target.getFile(), function.getLocation())) {
            score += SAME_MODULE_WEIGHT;
        }
        if (isCritical(function.getName())) {
            score += CRITICAL_FUNCTION_BONUS;
        }
        score += estimateComplexity(function) * COMPLEXITY_WEIGHT;
        return Math.max(score, MIN_FUNCTION_SCORE);
    }

    double scoreDataStructure(DataStructure structure) {
        double score = 0.0;
        String definition = structure.getDefinition();
        if (definition != null && !definition.isEmpty()) {
            String lower = definition.toLowerCase(Locale.ROOT);
            if (lower.contains("struct") || lower.contains("class")) {
                long lines = definition.chars().filter(c -> c == '\n').count() + 1;
                score += lines * 0.1;
            }
        }
        if (isCritical(structure.getName())) {
            score += CRITICAL_STRUCT_BONUS;
        }
        return Math.max(score, MIN_STRUCT_SCORE);
    }

    double scoreMacro(String name, MacroDefinition definition) {
        double score = 0.0;
        String text = Objects.requireNonNullElse(definition.getDefinition(), "");
        if (text.contains("(") && text.contains(")")) {
            score += MACRO_COMPLEXITY_WEIGHT * 2;
        }
        if (isCritical(name)) {
            score += CRITICAL_MACRO_BONUS;
        }
        String trimmed = text.trim();
        int tokens = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
        if (tokens <= 3) {
            score *= 0.5;
        }
        return Math.max(score, MIN_MACRO_SCORE);
    }

    private double estimateComplexity(CalledFunction function) {
        double complexity = nullSafe(function.getParameters()).size() * 0.2;
        String returnType = function.getReturnType();
        if (returnType != null
                && (returnType.contains("*") || returnType.toLowerCase(Locale.ROOT).contains("struct"))) {
            complexity += 0.3;
        }
        return complexity;
    }

    private boolean isCritical(String name) {
        return name != null && CRITICAL_NAME.matcher(name).find();
    }

    /**
     * Same directory, ignoring a trailing {@code :line} on the callee location.
     */
    static boolean isSameModule(String targetFile, String location) {
        if (targetFile == null || targetFile.isBlank() || location == null || location.isBlank()) {
            return false;
        }
        try {
            Path targetDir = Path.of(targetFile).getParent();
            Path calleeDir = Path.of(stripLineSuffix(location)).getParent();
            return Objects.equals(targetDir, calleeDir);
        } catch (RuntimeException e) {
            log.debug("Cannot compare locations '{}' and '{}': {}", targetFile, location, e.getMessage());
            return false;
        }
    }

    private static String stripLineSuffix(String location) {
        int colon = location.lastIndexOf(':');
        if (colon > 0 && colon < location.length() - 1
                && location.substring(colon + 1).chars().allMatch(Character::isDigit)) {
            return location.substring(0, colon);
        }
        return location;
    }

    private static <E> List<E> nullSafe(List<E> list) {
        return list == null ? List.of() : list;
    }
}
