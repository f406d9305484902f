package com.purchasingpower.testgen.config;

import com.purchasingpower.testgen.service.resilience.BackoffStrategy;
import com.purchasingpower.testgen.service.resilience.RetryPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Retry and circuit-breaker settings for calls to the generation backend.
 *
 * <p>Properties are loaded from the {@code app.retry} namespace in application.yml.
 * Example configuration:
 * <pre>
 * app:
 *   retry:
 *     max-attempts: 3
 *     base-delay-ms: 1000
 *     max-delay-ms: 60000
 *     multiplier: 2.0
 *     backoff-strategy: exponential_with_jitter
 *     circuit-breaker:
 *       failure-threshold: 5
 *       recovery-timeout-ms: 60000
 * </pre>
 *
 * <p><b>Backoff Calculation:</b>
 * For attempt N (starting at 1), the exponential delay is:
 * <pre>
 *   delay = min(base-delay-ms * (multiplier ^ (N - 1)), max-delay-ms)
 * </pre>
 * The jitter variant adds a random offset of up to 25% in either direction.
 *
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "app.retry")
@Data
public class GlobalRetryConfig {

    /**
     * Total number of attempts per backend call, including the first one.
     * Default: 3
     */
    private int maxAttempts = 3;

    /**
     * Delay before the first retry, in milliseconds.
     * Default: 1000 (1 second)
     */
    private long baseDelayMs = 1000;

    /**
     * Upper bound for any single backoff delay, in milliseconds.
     * Default: 60000 (60 seconds)
     */
    private long maxDelayMs = 60_000;

    /**
     * Growth factor for the exponential strategies.
     * Default: 2.0
     */
    private double multiplier = 2.0;

    private BackoffStrategy backoffStrategy = BackoffStrategy.EXPONENTIAL_WITH_JITTER;

    private CircuitBreakerConfig circuitBreaker = new CircuitBreakerConfig();

    public RetryPolicy toRetryPolicy() {
        return RetryPolicy.builder()
                .maxAttempts(maxAttempts)
                .baseDelay(Duration.ofMillis(baseDelayMs))
                .maxDelay(Duration.ofMillis(maxDelayMs))
                .multiplier(multiplier)
                .backoffStrategy(backoffStrategy)
                .build();
    }

    /**
     * Circuit breaker thresholds for the backend call site.
     */
    @Data
    public static class CircuitBreakerConfig {

        /**
         * Consecutive failed calls that open the circuit.
         * Default: 5
         */
        private int failureThreshold = 5;

        /**
         * Time the circuit stays OPEN before a trial call is allowed, in milliseconds.
         * Default: 60000
         */
        private long recoveryTimeoutMs = 60_000;
    }
}
