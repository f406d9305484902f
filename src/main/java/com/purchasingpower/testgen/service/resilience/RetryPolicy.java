package com.purchasingpower.testgen.service.resilience;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Stateless retry settings, shared by every call that uses them.
 *
 * <p>{@code nonRetryableExceptions} short-circuits classification: an error of
 * one of these types (or a subtype) is never retried.
 */
@Value
@Builder(toBuilder = true)
public class RetryPolicy {

    private static final double JITTER_RATIO = 0.25;

    @Builder.Default
    int maxAttempts = 3;

    @Builder.Default
    Duration baseDelay = Duration.ofSeconds(1);

    @Builder.Default
    Duration maxDelay = Duration.ofSeconds(60);

    @Builder.Default
    double multiplier = 2.0;

    @Builder.Default
    BackoffStrategy backoffStrategy = BackoffStrategy.EXPONENTIAL_WITH_JITTER;

    @Singular
    Set<Class<? extends Throwable>> nonRetryableExceptions;

    /**
     * Delay to wait after the given failed attempt (1-based), capped at {@code maxDelay}.
     */
    public Duration delayFor(int attempt) {
        long base = baseDelay.toMillis();
        double millis = switch (backoffStrategy) {
            case FIXED -> base;
            case LINEAR -> (double) base * attempt;
            case EXPONENTIAL -> base * Math.pow(multiplier, attempt - 1);
            case EXPONENTIAL_WITH_JITTER -> {
                double exponential = base * Math.pow(multiplier, attempt - 1);
                double jitter = exponential * JITTER_RATIO * (ThreadLocalRandom.current().nextDouble() * 2 - 1);
                yield exponential + jitter;
            }
        };
        long capped = (long) Math.min(Math.max(millis, 0), maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    public boolean isNonRetryable(Throwable error) {
        return nonRetryableExceptions.stream().anyMatch(type -> type.isInstance(error));
    }
}
