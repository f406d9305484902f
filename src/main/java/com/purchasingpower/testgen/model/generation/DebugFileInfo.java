package com.purchasingpower.testgen.model.generation;

import lombok.Value;

import java.nio.file.Path;

/**
 * Locations of the debug artifacts written for one function.
 */
@Value
public class DebugFileInfo {
    Path promptPath;
    Path responsePath;
    Path testPath;
}
