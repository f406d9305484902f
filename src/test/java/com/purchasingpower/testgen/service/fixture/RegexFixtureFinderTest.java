package com.purchasingpower.testgen.service.fixture;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Regex Fixture Finder Tests")
class RegexFixtureFinderTest {

    private final RegexFixtureFinder finder = new RegexFixtureFinder();

    @TempDir
    Path unitTestDir;

    @Test
    @DisplayName("Should return the first fixture definition in path order")
    void testFindFixtureDefinition_ShouldFindFixture() throws Exception {
        // Given
        Files.createDirectories(unitTestDir.resolve("b"));
        Files.writeString(unitTestDir.resolve("a_fixture.h"),
                "#pragma once\nclass math_utilsTest : public ::testing::Test {\nprotected:\n    int base = 1;\n};\n");
        Files.writeString(unitTestDir.resolve("b/other.cpp"),
                "class math_utilsTest : public ::testing::Test {\n    int other;\n};\n");
        Files.writeString(unitTestDir.resolve("notes.txt"),
                "class math_utilsTest : public ::testing::Test { };");

        // When
        Optional<String> fixture = finder.findFixtureDefinition("math_utilsTest", unitTestDir);

        // Then
        assertTrue(fixture.isPresent());
        assertEquals("class math_utilsTest : public ::testing::Test {\nprotected:\n    int base = 1;\n};", fixture.get());
    }

    @Test
    @DisplayName("Should return empty when nothing matches or the directory is missing")
    void testFindFixtureDefinition_ShouldReturnEmpty() throws Exception {
        Files.writeString(unitTestDir.resolve("test.cpp"), "class OtherTest : public ::testing::Test {};");

        assertTrue(finder.findFixtureDefinition("math_utilsTest", unitTestDir).isEmpty());
        assertTrue(finder.findFixtureDefinition("math_utilsTest", unitTestDir.resolve("missing")).isEmpty());
        assertTrue(finder.findFixtureDefinition(null, unitTestDir).isEmpty());
    }

    @Test
    @DisplayName("Should not treat regex characters in the suite name specially")
    void testFindFixtureDefinition_ShouldQuoteSuiteName() throws Exception {
        Files.writeString(unitTestDir.resolve("test.cpp"), "class aXbTest : public ::testing::Test {};");

        assertTrue(finder.findFixtureDefinition("a.bTest", unitTestDir).isEmpty());
    }
}
