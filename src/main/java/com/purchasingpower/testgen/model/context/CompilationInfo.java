package com.purchasingpower.testgen.model.context;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class CompilationInfo {
    List<String> keyFlags;
    int totalFlagsCount;

    public static CompilationInfo empty() {
        return new CompilationInfo(List.of(), 0);
    }
}
