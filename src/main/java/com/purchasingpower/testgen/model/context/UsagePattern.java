package com.purchasingpower.testgen.model.context;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class UsagePattern {
    String file;
    int line;
    String preview;
}
