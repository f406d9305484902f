package com.purchasingpower.testgen.service.fixture;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Looks up an existing Google Test fixture class for a test suite.
 */
public interface FixtureFinder {

    /**
     * @param suiteName   fixture class name, e.g. {@code math_utilsTest}
     * @param searchRoot  directory holding existing unit tests
     * @return the fixture's class definition, or empty if none was found
     */
    Optional<String> findFixtureDefinition(String suiteName, Path searchRoot);
}
