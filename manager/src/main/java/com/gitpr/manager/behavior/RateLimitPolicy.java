package com.gitpr.manager.behavior;

import com.gitpr.manager.config.BehaviorConfig;

import java.time.Duration;

/**
 * Token bucket parameters shared by every provider bucket. A non-positive rate
 * disables limiting.
 */
public record RateLimitPolicy(
        double requestsPerSecond,
        int burst,
        Duration timeout
) {

    public static RateLimitPolicy unlimited() {
        return new RateLimitPolicy(0, 0, Duration.ZERO);
    }

    public static RateLimitPolicy from(BehaviorConfig.RateLimitConfig config) {
        return new RateLimitPolicy(config.effectiveRequestsPerSecond(), config.effectiveBurst(),
                config.effectiveTimeout());
    }

    public boolean enabled() {
        return requestsPerSecond > 0;
    }

    /**
     * Time to regenerate one token.
     */
    public Duration refillPeriod() {
        return Duration.ofNanos(Math.max(1L, Math.round(1_000_000_000d / requestsPerSecond)));
    }

    public int effectiveBurst() {
        return Math.max(burst, 1);
    }
}
