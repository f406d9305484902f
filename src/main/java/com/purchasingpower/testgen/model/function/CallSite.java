package com.purchasingpower.testgen.model.function;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A place in the code base where the target function is called.
 */
@Value
@Builder
@Jacksonized
public class CallSite {
    String file;
    int line;
    String context; // surrounding source lines
}
