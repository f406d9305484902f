package com.purchasingpower.testgen.model.context;

import com.purchasingpower.testgen.model.function.DataStructure;
import com.purchasingpower.testgen.model.function.MacroDefinition;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Ranked and trimmed dependencies of the target function.
 */
@Value
@Builder(toBuilder = true)
public class DependencyContext {

    @Builder.Default
    List<CalledFunctionSummary> calledFunctions = List.of();

    @Builder.Default
    List<String> macros = List.of();

    @Builder.Default
    List<MacroDefinition> macroDefinitions = List.of();

    @Builder.Default
    List<String> dataStructures = List.of();

    @Builder.Default
    List<DataStructure> dataStructureDefinitions = List.of();
}
