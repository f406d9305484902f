package com.purchasingpower.testgen.service.resilience;

import com.purchasingpower.testgen.exception.BackendConnectionException;
import com.purchasingpower.testgen.exception.BackendHttpException;
import com.purchasingpower.testgen.exception.ErrorCategory;
import com.purchasingpower.testgen.exception.GenerationBackendException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Retry Executor Tests")
class RetryExecutorTest {

    private final List<Duration> sleeps = new ArrayList<>();
    private final Sleeper recordingSleeper = sleeps::add;

    private RetryExecutor executor(RetryPolicy policy) {
        return new RetryExecutor(policy, new ErrorClassifier(), recordingSleeper, "mock");
    }

    private RetryPolicy policy(int attempts, BackoffStrategy strategy) {
        return RetryPolicy.builder()
                .maxAttempts(attempts)
                .baseDelay(Duration.ofMillis(100))
                .maxDelay(Duration.ofMillis(250))
                .backoffStrategy(strategy)
                .build();
    }

    @Test
    @DisplayName("Should invoke an always-failing retryable call exactly maxAttempts times")
    void testExecute_ShouldStopAfterMaxAttempts() {
        // Given
        AtomicInteger calls = new AtomicInteger();

        // When
        GenerationBackendException error = assertThrows(GenerationBackendException.class,
                () -> executor(policy(4, BackoffStrategy.FIXED)).execute("call", () -> {
                    calls.incrementAndGet();
                    throw new BackendConnectionException("connection refused");
                }));

        // Then
        assertEquals(4, calls.get());
        assertEquals(4, error.getAttempts());
        assertEquals(ErrorCategory.NETWORK, error.getCategory());
        assertTrue(error.isRetryable());
        assertInstanceOf(BackendConnectionException.class, error.getCause(), "Last cause is preserved");
        assertEquals(3, sleeps.size(), "No sleep after the final attempt");
    }

    @Test
    @DisplayName("Should fail immediately on a non-retryable error")
    void testExecute_ShouldNotRetryClientErrors() {
        AtomicInteger calls = new AtomicInteger();

        GenerationBackendException error = assertThrows(GenerationBackendException.class,
                () -> executor(policy(5, BackoffStrategy.FIXED)).execute("call", () -> {
                    calls.incrementAndGet();
                    throw new BackendHttpException(401, "unauthorized", null);
                }));

        assertEquals(1, calls.get());
        assertFalse(error.isRetryable());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Should honor the policy's non-retryable exception types")
    void testExecute_ShouldRespectNonRetryableTypes() {
        AtomicInteger calls = new AtomicInteger();
        RetryPolicy policy = policy(3, BackoffStrategy.FIXED).toBuilder()
                .nonRetryableException(BackendConnectionException.class)
                .build();

        assertThrows(GenerationBackendException.class, () -> executor(policy).execute("call", () -> {
            calls.incrementAndGet();
            throw new BackendConnectionException("refused");
        }));

        assertEquals(1, calls.get());
    }

    @Test
    @DisplayName("Should return the value once a retry succeeds")
    void testExecute_ShouldRecoverAfterTransientFailure() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor(policy(3, BackoffStrategy.LINEAR)).execute("call", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new BackendHttpException(502, "bad gateway", null);
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
    }

    @Test
    @DisplayName("Should compute capped backoff delays for each strategy")
    void testDelayFor_ShouldFollowStrategy() {
        assertEquals(Duration.ofMillis(100), policy(5, BackoffStrategy.FIXED).delayFor(3));
        assertEquals(Duration.ofMillis(200), policy(5, BackoffStrategy.LINEAR).delayFor(2));
        assertEquals(Duration.ofMillis(250), policy(5, BackoffStrategy.LINEAR).delayFor(4), "Capped at maxDelay");
        assertEquals(Duration.ofMillis(100), policy(5, BackoffStrategy.EXPONENTIAL).delayFor(1));
        assertEquals(Duration.ofMillis(200), policy(5, BackoffStrategy.EXPONENTIAL).delayFor(2));
        assertEquals(Duration.ofMillis(250), policy(5, BackoffStrategy.EXPONENTIAL).delayFor(3));

        RetryPolicy jitter = policy(5, BackoffStrategy.EXPONENTIAL_WITH_JITTER).toBuilder()
                .maxDelay(Duration.ofSeconds(10))
                .build();
        for (int i = 0; i < 50; i++) {
            long millis = jitter.delayFor(2).toMillis();
            assertTrue(millis >= 150 && millis <= 250, "Jitter stays within 25% of 200 ms, got " + millis);
        }
    }
}
