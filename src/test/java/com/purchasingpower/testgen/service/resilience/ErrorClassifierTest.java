package com.purchasingpower.testgen.service.resilience;

import com.purchasingpower.testgen.exception.BackendConnectionException;
import com.purchasingpower.testgen.exception.BackendHttpException;
import com.purchasingpower.testgen.exception.BackendTimeoutException;
import com.purchasingpower.testgen.exception.ErrorCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Error Classifier Tests")
class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @Test
    @DisplayName("Should retry server errors but not client errors")
    void testClassify_ShouldUseHttpStatus() {
        ErrorClassification server = classifier.classify(new BackendHttpException(503, "busy", null));
        assertEquals(ErrorCategory.PROVIDER, server.getCategory());
        assertTrue(server.isRetryable());

        ErrorClassification client = classifier.classify(new BackendHttpException(400, "bad request", null));
        assertEquals(ErrorCategory.PROVIDER, client.getCategory());
        assertFalse(client.isRetryable());

        ErrorClassification tooMany = classifier.classify(new BackendHttpException(429, "slow down", null));
        assertFalse(tooMany.isRetryable(), "Typed HTTP errors below 500 are never retried");
    }

    @Test
    @DisplayName("Should classify typed connection and timeout errors as retryable")
    void testClassify_ShouldHandleTransportErrors() {
        ErrorClassification network = classifier.classify(new BackendConnectionException("refused"));
        assertEquals(ErrorCategory.NETWORK, network.getCategory());
        assertTrue(network.isRetryable());

        ErrorClassification timeout = classifier.classify(new BackendTimeoutException("slow"));
        assertEquals(ErrorCategory.TIMEOUT, timeout.getCategory());
        assertTrue(timeout.isRetryable());

        ErrorClassification socket = classifier.classify(new RuntimeException(new SocketTimeoutException("read")));
        assertEquals(ErrorCategory.TIMEOUT, socket.getCategory(),
                "Wrapped timeouts are still caught by message keywords");
        assertTrue(socket.isRetryable());
    }

    @Test
    @DisplayName("Should fall back to keyword matching in priority order")
    void testClassify_ShouldMatchKeywords() {
        assertCategory("Invalid API key provided", ErrorCategory.AUTHENTICATION, false);
        assertCategory("Quota exceeded for today", ErrorCategory.RATE_LIMIT, true);
        assertCategory("Request took too LONG", ErrorCategory.TIMEOUT, true);
        assertCategory("Internal hiccup", ErrorCategory.PROVIDER, true);
        assertCategory("something odd happened", ErrorCategory.UNKNOWN, false);
    }

    @Test
    @DisplayName("Should check authentication before rate limit")
    void testClassify_ShouldPreferAuthentication() {
        assertCategory("token rate limit", ErrorCategory.AUTHENTICATION, false);
    }

    private void assertCategory(String message, ErrorCategory expected, boolean retryable) {
        ErrorClassification classification = classifier.classify(new IllegalStateException(message));
        assertEquals(expected, classification.getCategory(), "Category for: " + message);
        assertEquals(retryable, classification.isRetryable(), "Retryable for: " + message);
    }
}
