package com.purchasingpower.testgen.model.function;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A single declared parameter of an analyzed function.
 */
@Value
@Builder
@Jacksonized
public class Parameter {
    String name;
    String type;
}
