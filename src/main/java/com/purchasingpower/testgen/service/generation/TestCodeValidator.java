package com.purchasingpower.testgen.service.generation;

/**
 * Sanity checks for generated test code.
 *
 * @since 1.0.0
 */
public interface TestCodeValidator {

    /**
     * @param code     extracted test code
     * @param language language tag of the function under test
     */
    ValidationResult validate(String code, String language);
}
