package com.purchasingpower.testgen.model.function;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class MacroDefinition {
    String name;
    String definition;
    String location;
}
