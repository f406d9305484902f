package com.purchasingpower.testgen.model.context;

import com.purchasingpower.testgen.model.function.Parameter;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * The part of a compressed context describing the function under test.
 *
 * <p>{@code body} is the complete body text. Compression never shortens it.
 */
@Value
@Builder
public class TargetFunctionSummary {
    String name;
    String signature;
    String returnType;
    List<Parameter> parameters;
    String body;
    String location;
    String language;
    boolean staticFunction;
    String accessSpecifier;
}
