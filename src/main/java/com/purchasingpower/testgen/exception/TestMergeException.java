package com.purchasingpower.testgen.exception;

import lombok.Getter;

import java.nio.file.Path;

/**
 * A test source could not be merged into its aggregate file because it is malformed.
 */
@Getter
public class TestMergeException extends RuntimeException {

    private final Path targetFile;

    public TestMergeException(Path targetFile, String message) {
        super(message);
        this.targetFile = targetFile;
    }
}
