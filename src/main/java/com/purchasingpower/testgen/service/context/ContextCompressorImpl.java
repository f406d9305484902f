package com.purchasingpower.testgen.service.context;

import com.purchasingpower.testgen.config.CompressionProperties;
import com.purchasingpower.testgen.model.context.CalledFunctionSummary;
import com.purchasingpower.testgen.model.context.CompilationInfo;
import com.purchasingpower.testgen.model.context.CompressedContext;
import com.purchasingpower.testgen.model.context.DependencyContext;
import com.purchasingpower.testgen.model.context.TargetFunctionSummary;
import com.purchasingpower.testgen.model.context.UsagePattern;
import com.purchasingpower.testgen.model.function.CallSite;
import com.purchasingpower.testgen.model.function.CalledFunction;
import com.purchasingpower.testgen.model.function.DataStructure;
import com.purchasingpower.testgen.model.function.FunctionDescriptor;
import com.purchasingpower.testgen.model.function.MacroDefinition;
import com.purchasingpower.testgen.model.function.RawContext;
import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ranking-based context compressor.
 *
 * <p><b>Selection</b> (configurable level, default 1): top 5 called functions,
 * 3 data structures, 4 macros, 2 usage previews of at most 200 characters from
 * distinct files and 3 compiler flags starting with {@code -I}, {@code -D},
 * {@code -std=} or {@code -O}. Full definitions are attached for the selected
 * macros and structures and for selected static callees.
 *
 * <p><b>Over budget</b> the context is rebuilt with progressively stricter limits:
 * <ol>
 *   <li>usage previews cut to 150 characters</li>
 *   <li>dependencies at MEDIUM importance or above only; 3 functions,
 *       2 macro definitions, 1 structure definition</li>
 *   <li>no usage examples; 1 function, no macro or structure definitions</li>
 * </ol>
 *
 * @since 1.0.0
 */
@Slf4j
public class ContextCompressorImpl implements ContextCompressor {

    static final int MAX_PREVIEW_LENGTH = 200;
    static final int TRIMMED_PREVIEW_LENGTH = 150;
    static final int MAX_KEY_FLAGS = 3;
    static final int MAX_COMPRESSION_LEVEL = 3;

    private static final List<String> KEY_FLAG_PREFIXES = List.of("-I", "-D", "-std=", "-O");

    private static final SelectionLimits[] LEVEL_LIMITS = {
            SelectionLimits.initial(8, 5, 6, 3),
            SelectionLimits.initial(5, 3, 4, 2),
            SelectionLimits.initial(3, 2, 2, 1)
    };

    private final DependencyRanker ranker;
    private final TokenCounter tokenCounter;
    private final CompressionProperties properties;

    public ContextCompressorImpl(DependencyRanker ranker, TokenCounter tokenCounter,
                                 CompressionProperties properties) {
        this.ranker = ranker;
        this.tokenCounter = tokenCounter;
        this.properties = properties;
    }

    @Override
    public CompressedContext compress(FunctionDescriptor function, RawContext context) {
        Preconditions.checkNotNull(function, "function must not be null");
        RawContext raw = context != null ? context : RawContext.empty();
        int available = tokenCounter.getAvailableTokens(properties.getBasePromptTokens());

        if (!properties.isEnabled()) {
            CompressedContext full = buildUncompressed(function, raw);
            return measure(full, 0, available);
        }

        SelectionLimits limits = LEVEL_LIMITS[properties.getEffectiveLevel()];
        CompressedContext compressed = measure(build(function, raw, limits), 0, available);
        return ensureOptimalSize(compressed, function, raw, limits, available);
    }

    /**
     * Applies compression levels 1..3 until the context fits. Never throws; the
     * last attempt is returned when even level 3 is over budget.
     */
    CompressedContext ensureOptimalSize(CompressedContext context, FunctionDescriptor function,
                                        RawContext raw, SelectionLimits initial, int available) {
        CompressedContext current = context;
        for (int level = 1; level <= MAX_COMPRESSION_LEVEL && !current.isWithinBudget(); level++) {
            log.debug("Context for '{}' uses {} of {} tokens, applying compression level {}",
                    function.getName(), current.getTokenCount(), available, level);
            current = measure(build(function, raw, initial.atLevel(level)), level, available);
        }

        if (!current.isWithinBudget()) {
            log.warn("Context for '{}' still exceeds budget after level {} ({} > {} tokens)",
                    function.getName(), current.getCompressionLevel(), current.getTokenCount(), available);
        }
        return current;
    }

    private CompressedContext measure(CompressedContext context, int level, int available) {
        CompressedContext sized = context.toBuilder()
                .compressionLevel(level)
                .availableTokens(available)
                .build();
        return sized.toBuilder().tokenCount(tokenCounter.countTokens(sized)).build();
    }

    private CompressedContext build(FunctionDescriptor function, RawContext raw, SelectionLimits limits) {
        return CompressedContext.builder()
                .targetFunction(summarize(function))
                .dependencies(selectDependencies(function, raw, limits))
                .usagePatterns(selectUsagePatterns(raw.getCallSites(), limits.getMaxUsagePatterns(),
                        limits.getPreviewLength()))
                .compilationInfo(selectCompilationInfo(raw.getCompilationFlags(), MAX_KEY_FLAGS))
                .build();
    }

    private CompressedContext buildUncompressed(FunctionDescriptor function, RawContext raw) {
        DependencyContext dependencies = DependencyContext.builder()
                .calledFunctions(raw.getCalledFunctions().stream()
                        .map(this::summarize)
                        .collect(Collectors.toList()))
                .macros(List.copyOf(raw.getMacros()))
                .macroDefinitions(List.copyOf(raw.getMacroDefinitions()))
                .dataStructures(raw.getDataStructures().stream()
                        .map(DataStructure::getName)
                        .collect(Collectors.toList()))
                .dataStructureDefinitions(List.copyOf(raw.getDataStructures()))
                .build();

        return CompressedContext.builder()
                .targetFunction(summarize(function))
                .dependencies(dependencies)
                .usagePatterns(raw.getCallSites().stream()
                        .map(site -> toUsagePattern(site, Integer.MAX_VALUE))
                        .collect(Collectors.toList()))
                .compilationInfo(selectCompilationInfo(raw.getCompilationFlags(), Integer.MAX_VALUE))
                .build();
    }

    private TargetFunctionSummary summarize(FunctionDescriptor function) {
        return TargetFunctionSummary.builder()
                .name(function.getName())
                .signature(function.getSignature())
                .returnType(function.getReturnType())
                .parameters(function.getParameters())
                .body(function.getBody())
                .location(function.getLocation())
                .language(function.getLanguage())
                .staticFunction(function.isStatic())
                .accessSpecifier(function.getAccessSpecifier())
                .build();
    }

    private CalledFunctionSummary summarize(CalledFunction callee) {
        return CalledFunctionSummary.builder()
                .name(callee.getName())
                .location(Objects.requireNonNullElse(callee.getLocation(), "unknown"))
                .declaration(callee.getDeclaration())
                .definition(callee.isStatic() ? callee.getDefinition() : null)
                .build();
    }

    private DependencyContext selectDependencies(FunctionDescriptor function, RawContext raw,
                                                 SelectionLimits limits) {
        List<CalledFunctionSummary> functions = DependencyRanker.selectTop(
                        ranker.rankCalledFunctions(function, raw.getCalledFunctions()),
                        limits.getMaxFunctions(), limits.getMinImportance())
                .stream()
                .map(d -> summarize(d.payload()))
                .collect(Collectors.toList());

        List<RankedDependency<MacroDefinition>> macros = DependencyRanker.selectTop(
                ranker.rankMacros(raw.getMacros(), raw.getMacroDefinitions()),
                limits.getMaxMacros(), limits.getMinImportance());

        List<RankedDependency<DataStructure>> structures = DependencyRanker.selectTop(
                ranker.rankDataStructures(raw.getDataStructures()),
                limits.getMaxStructures(), limits.getMinImportance());

        return DependencyContext.builder()
                .calledFunctions(functions)
                .macros(macros.stream().map(RankedDependency::name).collect(Collectors.toList()))
                .macroDefinitions(macros.stream()
                        .map(RankedDependency::payload)
                        .filter(d -> d.getDefinition() != null && !d.getDefinition().isBlank())
                        .limit(limits.getMaxMacroDefinitions())
                        .collect(Collectors.toList()))
                .dataStructures(structures.stream().map(RankedDependency::name).collect(Collectors.toList()))
                .dataStructureDefinitions(structures.stream()
                        .map(RankedDependency::payload)
                        .limit(limits.getMaxStructureDefinitions())
                        .collect(Collectors.toList()))
                .build();
    }

    /**
     * One preview per source file, in call-site order, until {@code maxCount} files are covered.
     */
    List<UsagePattern> selectUsagePatterns(List<CallSite> callSites, int maxCount, int previewLength) {
        List<UsagePattern> selected = new ArrayList<>();
        Set<String> seenFiles = new HashSet<>();
        for (CallSite site : callSites) {
            if (selected.size() >= maxCount) {
                break;
            }
            String file = Objects.requireNonNullElse(site.getFile(), "unknown");
            if (seenFiles.add(file)) {
                selected.add(toUsagePattern(site, previewLength));
            }
        }
        return selected;
    }

    private UsagePattern toUsagePattern(CallSite site, int previewLength) {
        String text = Objects.requireNonNullElse(site.getContext(), "");
        return UsagePattern.builder()
                .file(Objects.requireNonNullElse(site.getFile(), "unknown"))
                .line(site.getLine())
                .preview(text.length() > previewLength ? text.substring(0, previewLength) : text)
                .build();
    }

    CompilationInfo selectCompilationInfo(List<String> flags, int maxFlags) {
        List<String> keyFlags = flags.stream()
                .filter(flag -> KEY_FLAG_PREFIXES.stream().anyMatch(flag::startsWith))
                .limit(maxFlags)
                .collect(Collectors.toList());
        return CompilationInfo.builder()
                .keyFlags(keyFlags)
                .totalFlagsCount(flags.size())
                .build();
    }

    /**
     * Selection limits for one build of the context. Levels only ever tighten the initial limits.
     */
    @Value
    @Builder(toBuilder = true)
    static class SelectionLimits {
        int maxFunctions;
        int maxStructures;
        int maxMacros;
        int maxUsagePatterns;
        int maxMacroDefinitions;
        int maxStructureDefinitions;
        int previewLength;
        ImportanceLevel minImportance;

        static SelectionLimits initial(int functions, int structures, int macros, int usagePatterns) {
            return SelectionLimits.builder()
                    .maxFunctions(functions)
                    .maxStructures(structures)
                    .maxMacros(macros)
                    .maxUsagePatterns(usagePatterns)
                    .maxMacroDefinitions(macros)
                    .maxStructureDefinitions(structures)
                    .previewLength(MAX_PREVIEW_LENGTH)
                    .minImportance(ImportanceLevel.LOW)
                    .build();
        }

        SelectionLimits atLevel(int level) {
            SelectionLimits limits = toBuilder().previewLength(TRIMMED_PREVIEW_LENGTH).build();
            if (level >= 2) {
                limits = limits.toBuilder()
                        .minImportance(ImportanceLevel.MEDIUM)
                        .maxFunctions(Math.min(maxFunctions, 3))
                        .maxMacroDefinitions(Math.min(maxMacroDefinitions, 2))
                        .maxStructureDefinitions(Math.min(maxStructureDefinitions, 1))
                        .build();
            }
            if (level >= 3) {
                limits = limits.toBuilder()
                        .maxUsagePatterns(0)
                        .maxFunctions(Math.min(maxFunctions, 1))
                        .maxMacroDefinitions(0)
                        .maxStructureDefinitions(0)
                        .build();
            }
            return limits;
        }
    }
}
