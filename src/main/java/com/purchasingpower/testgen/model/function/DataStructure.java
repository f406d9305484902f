package com.purchasingpower.testgen.model.function;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A struct, class or typedef referenced by the target function.
 */
@Value
@Builder
@Jacksonized
public class DataStructure {
    String name;
    String definition;
    String location;
}
