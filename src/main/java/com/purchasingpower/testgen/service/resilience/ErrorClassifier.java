package com.purchasingpower.testgen.service.resilience;

import com.purchasingpower.testgen.exception.BackendConnectionException;
import com.purchasingpower.testgen.exception.BackendHttpException;
import com.purchasingpower.testgen.exception.BackendTimeoutException;
import com.purchasingpower.testgen.exception.ErrorCategory;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps failures of backend calls to an {@link ErrorCategory} and a retry decision.
 *
 * <p>Typed transport errors are classified first:
 * <ul>
 *   <li>HTTP 5xx: PROVIDER, retryable</li>
 *   <li>any other HTTP status: PROVIDER, not retryable</li>
 *   <li>connection failures: NETWORK, retryable</li>
 *   <li>timeouts: TIMEOUT, retryable</li>
 * </ul>
 * Anything else is matched case-insensitively against keyword lists, checked in
 * the order authentication, rate limit, timeout, provider. Unmatched errors are
 * UNKNOWN and not retried.
 */
public class ErrorClassifier {

    private static final List<String> AUTH_KEYWORDS =
            List.of("auth", "authenticat", "key", "token", "invalid");
    private static final List<String> RATE_LIMIT_KEYWORDS =
            List.of("rate", "limit", "quota", "429");
    private static final List<String> TIMEOUT_KEYWORDS =
            List.of("timeout", "timed out", "wait", "long");
    private static final List<String> PROVIDER_KEYWORDS =
            List.of("api", "server", "internal", "5");

    public ErrorClassification classify(Throwable error) {
        Throwable unwrapped = Exceptions.unwrap(error);

        Integer status = httpStatus(unwrapped);
        if (status != null) {
            boolean serverError = status >= 500;
            return new ErrorClassification(ErrorCategory.PROVIDER, serverError,
                    "HTTP " + status + (serverError ? " server error" : " client error"), unwrapped);
        }
        if (isConnectionError(unwrapped)) {
            return new ErrorClassification(ErrorCategory.NETWORK, true,
                    "Connection failed: " + unwrapped.getMessage(), unwrapped);
        }
        if (isTimeout(unwrapped)) {
            return new ErrorClassification(ErrorCategory.TIMEOUT, true,
                    "Request timed out: " + unwrapped.getMessage(), unwrapped);
        }
        return classifyByMessage(unwrapped);
    }

    private ErrorClassification classifyByMessage(Throwable error) {
        String message = String.valueOf(error.getMessage());
        String lower = message.toLowerCase(Locale.ROOT);

        if (containsAny(lower, AUTH_KEYWORDS)) {
            return new ErrorClassification(ErrorCategory.AUTHENTICATION, false, message, error);
        }
        if (containsAny(lower, RATE_LIMIT_KEYWORDS)) {
            return new ErrorClassification(ErrorCategory.RATE_LIMIT, true, message, error);
        }
        if (containsAny(lower, TIMEOUT_KEYWORDS)) {
            return new ErrorClassification(ErrorCategory.TIMEOUT, true, message, error);
        }
        if (containsAny(lower, PROVIDER_KEYWORDS)) {
            return new ErrorClassification(ErrorCategory.PROVIDER, true, message, error);
        }
        return new ErrorClassification(ErrorCategory.UNKNOWN, false, message, error);
    }

    private Integer httpStatus(Throwable error) {
        if (error instanceof BackendHttpException http) {
            return http.getStatusCode();
        }
        if (error instanceof WebClientResponseException response) {
            return response.getStatusCode().value();
        }
        return null;
    }

    private boolean isConnectionError(Throwable error) {
        if (error instanceof BackendConnectionException
                || error instanceof ConnectException
                || error instanceof UnknownHostException) {
            return true;
        }
        return error instanceof WebClientRequestException && !isTimeout(error.getCause());
    }

    private boolean isTimeout(Throwable error) {
        if (error == null) {
            return false;
        }
        if (error instanceof BackendTimeoutException
                || error instanceof SocketTimeoutException
                || error instanceof HttpTimeoutException
                || error instanceof TimeoutException) {
            return true;
        }
        return error instanceof WebClientRequestException && isTimeout(error.getCause());
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }
}
