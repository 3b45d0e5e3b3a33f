package com.gitpr.manager.behavior;

import com.gitpr.manager.config.BehaviorConfig;

import java.time.Duration;

/**
 * Exponential backoff policy. The delay after failed attempt {@code n} (1-based) is
 * {@code min(backoff * 2^(n-1), maxBackoff)}; jitter, when enabled, adds up to 10%
 * on top of that delay and never shortens it.
 */
public record RetryPolicy(
        int maxAttempts,
        Duration backoff,
        Duration maxBackoff,
        boolean jitter
) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (backoff.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("backoff durations must not be negative");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(BehaviorConfig.RetryConfig.DEFAULT_MAX_ATTEMPTS,
                BehaviorConfig.RetryConfig.DEFAULT_BACKOFF,
                BehaviorConfig.RetryConfig.DEFAULT_MAX_BACKOFF, true);
    }

    public static RetryPolicy from(BehaviorConfig.RetryConfig config) {
        return new RetryPolicy(config.effectiveMaxAttempts(), config.effectiveBackoff(),
                config.effectiveMaxBackoff(), true);
    }

    /**
     * Base delay after the given failed attempt, before jitter.
     */
    public Duration delayFor(int attempt) {
        int exponent = Math.min(Math.max(attempt - 1, 0), 30);
        long millis = backoff.toMillis() * (1L << exponent);
        if (millis < 0 || millis > maxBackoff.toMillis()) {
            return maxBackoff;
        }
        return Duration.ofMillis(millis);
    }
}
