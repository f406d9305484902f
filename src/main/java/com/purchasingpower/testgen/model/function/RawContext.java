package com.purchasingpower.testgen.model.function;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Everything the code analyzer collected around one function.
 *
 * <p>Consumed as-is; the compressor only selects from it.
 *
 * @since 1.0.0
 */
@Value
@Builder
@Jacksonized
public class RawContext {

    @Builder.Default
    List<CalledFunction> calledFunctions = List.of();

    @Builder.Default
    List<String> macros = List.of();

    @Builder.Default
    List<MacroDefinition> macroDefinitions = List.of();

    @Builder.Default
    List<DataStructure> dataStructures = List.of();

    @Builder.Default
    List<CallSite> callSites = List.of();

    @Builder.Default
    List<String> compilationFlags = List.of();

    public static RawContext empty() {
        return RawContext.builder().build();
    }
}
