package com.purchasingpower.testgen.model.context;

import lombok.Builder;
import lombok.Value;

/**
 * A selected callee. {@code definition} is only set for static callees.
 */
@Value
@Builder
public class CalledFunctionSummary {
    String name;
    String location;
    String declaration;
    String definition;
}
