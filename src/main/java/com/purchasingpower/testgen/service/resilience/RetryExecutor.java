package com.purchasingpower.testgen.service.resilience;

import com.purchasingpower.testgen.exception.ErrorCategory;
import com.purchasingpower.testgen.exception.GenerationBackendException;
import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs a call under a {@link RetryPolicy}.
 *
 * <p>Retryable failures are retried after the policy's backoff until
 * {@code maxAttempts} calls have been made. Non-retryable failures stop
 * immediately. Either way the caller sees one {@link GenerationBackendException}
 * carrying the classification and the last cause.
 */
@Slf4j
public class RetryExecutor {

    private final RetryPolicy policy;
    private final ErrorClassifier classifier;
    private final Sleeper sleeper;
    private final String provider;

    public RetryExecutor(RetryPolicy policy, ErrorClassifier classifier, Sleeper sleeper, String provider) {
        Preconditions.checkArgument(policy.getMaxAttempts() >= 1, "maxAttempts must be at least 1");
        this.policy = policy;
        this.classifier = classifier;
        this.sleeper = sleeper;
        this.provider = provider;
    }

    public <T> T execute(String operation, Supplier<T> call) {
        int maxAttempts = policy.getMaxAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                return call.get();
            } catch (RuntimeException e) {
                ErrorClassification classification = classifier.classify(e);
                boolean retryable = classification.isRetryable() && !policy.isNonRetryable(e);

                if (!retryable) {
                    log.error("{} failed with non-retryable {} error: {}",
                            operation, classification.getCategory(), classification.getMessage());
                    throw terminal(operation, classification, false, attempt);
                }
                if (attempt >= maxAttempts) {
                    log.error("{} failed after {} attempts: {}", operation, attempt, classification.getMessage());
                    throw terminal(operation, classification, true, attempt);
                }

                Duration delay = policy.delayFor(attempt);
                log.warn("{} attempt {}/{} failed ({}), retrying in {} ms",
                        operation, attempt, maxAttempts, classification.getCategory(), delay.toMillis());
                pause(delay, operation, classification, attempt);
            }
        }
    }

    private void pause(Duration delay, String operation, ErrorClassification classification, int attempt) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw terminal(operation, classification, true, attempt);
        }
    }

    private GenerationBackendException terminal(String operation, ErrorClassification classification,
                                                boolean retryable, int attempts) {
        ErrorCategory category = classification.getCategory();
        String message = String.format("%s failed [%s] after %d attempt(s): %s",
                operation, category, attempts, classification.getMessage());
        return new GenerationBackendException(message, category, retryable, provider, attempts,
                classification.getCause());
    }
}
