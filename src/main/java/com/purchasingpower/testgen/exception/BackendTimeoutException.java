package com.purchasingpower.testgen.exception;

public class BackendTimeoutException extends RuntimeException {

    public BackendTimeoutException(String message) {
        super(message);
    }

    public BackendTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
