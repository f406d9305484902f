package com.purchasingpower.testgen.runner;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.testgen.model.function.FunctionWithContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the code analyzer's output: a JSON array of
 * {@code {"function": {...}, "context": {...}, "existingTestsContext": {...}}} entries.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisInputLoader {

    private static final TypeReference<List<FunctionWithContext>> INPUT_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public List<FunctionWithContext> load(Path inputFile) throws IOException {
        if (!Files.isRegularFile(inputFile)) {
            throw new IOException("Analyzer output not found: " + inputFile);
        }
        List<FunctionWithContext> functions = objectMapper.readValue(inputFile.toFile(), INPUT_TYPE);
        log.info("Loaded {} functions from {}", functions.size(), inputFile);
        return functions;
    }
}
