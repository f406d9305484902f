package com.purchasingpower.testgen.service.generation;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Checks that code looks like a Google Test source: non-empty, no leftover
 * fences, an include directive, a test macro and an assertion.
 */
@Component
public class GTestCodeValidator implements TestCodeValidator {

    private static final Pattern INCLUDE = Pattern.compile("(?m)^\\s*#include\\s*[<\"]");
    private static final Pattern TEST_MACRO = Pattern.compile("\\b(TEST|TEST_F|TEST_P)\\s*\\(");
    private static final Pattern ASSERTION = Pattern.compile("\\b(EXPECT|ASSERT)_[A-Z_]+\\s*\\(");

    @Override
    public ValidationResult validate(String code, String language) {
        if (code == null || code.isBlank()) {
            return ValidationResult.failure(List.of(violation("empty-code", "Generated code is empty")));
        }

        List<ValidationResult.Violation> violations = new ArrayList<>();
        if (code.contains("```")) {
            violations.add(violation("code-fence", "Code still contains markdown fence markers"));
        }
        if (!INCLUDE.matcher(code).find()) {
            violations.add(violation("missing-include", "No #include directive found"));
        }
        if (!TEST_MACRO.matcher(code).find()) {
            violations.add(violation("missing-test", "No TEST/TEST_F/TEST_P macro found"));
        }
        if (!ASSERTION.matcher(code).find()) {
            violations.add(violation("missing-assertion", "No EXPECT_*/ASSERT_* assertion found"));
        }
        return violations.isEmpty() ? ValidationResult.success() : ValidationResult.failure(violations);
    }

    private static ValidationResult.Violation violation(String rule, String message) {
        return ValidationResult.Violation.builder().rule(rule).message(message).build();
    }
}
