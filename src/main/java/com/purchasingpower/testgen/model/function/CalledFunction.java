package com.purchasingpower.testgen.model.function;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A function invoked from the body of the target function.
 */
@Value
@Builder
@Jacksonized
public class CalledFunction {
    String name;
    String location;
    String declaration;
    String definition;
    String returnType;

    @Builder.Default
    List<Parameter> parameters = List.of();

    @JsonProperty("isStatic")
    boolean isStatic;
}
