package com.purchasingpower.testgen.model.function;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A function extracted by the code analyzer.
 *
 * <p>Owned by the analyzer and read-only to the generation pipeline.
 *
 * @since 1.0.0
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FunctionDescriptor {

    String name;

    String returnType;

    @Builder.Default
    List<Parameter> parameters = List.of();

    /** Full body text, including the signature line. */
    String body;

    /** Source file the function was found in. */
    String file;

    int line;

    @Builder.Default
    String language = "c";

    @JsonProperty("isStatic")
    boolean isStatic;

    @Builder.Default
    String accessSpecifier = "public";

    /**
     * Formats the C-style signature, e.g. {@code int add(int a, int b)}.
     */
    @JsonIgnore
    public String getSignature() {
        String params = parameters.stream()
                .map(p -> p.getType() + " " + p.getName())
                .collect(Collectors.joining(", "));
        return String.format("%s %s(%s)", returnType, name, params);
    }

    @JsonIgnore
    public String getLocation() {
        return file + ":" + line;
    }

    /**
     * File name of the source without its extension ({@code math_utils.c -> math_utils}).
     */
    @JsonIgnore
    public String getSourceStem() {
        if (file == null || file.isBlank()) {
            return "unknown";
        }
        String fileName = Path.of(file).getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
