package com.purchasingpower.testgen.exception;

/**
 * The backend could not be reached (refused, reset, DNS failure).
 */
public class BackendConnectionException extends RuntimeException {

    public BackendConnectionException(String message) {
        super(message);
    }

    public BackendConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
