package com.purchasingpower.testgen.exception;

import lombok.Getter;

/**
 * The backend answered with a non-2xx HTTP status.
 */
@Getter
public class BackendHttpException extends RuntimeException {

    private final int statusCode;

    private final String responseBody;

    public BackendHttpException(int statusCode, String responseBody, Throwable cause) {
        super("HTTP " + statusCode + " from generation backend", cause);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }
}
