package com.gitpr.manager.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * The {@code behavior} section: concurrency ceiling, rate limit and retry policy.
 * Unset (zero or blank) values fall back to the defaults exposed by the
 * {@code effective*} accessors.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BehaviorConfig(
        @JsonProperty("concurrency") int concurrency,
        @JsonProperty("rate_limit") RateLimitConfig rateLimit,
        @JsonProperty("retry") RetryConfig retry
) {

    public static final int DEFAULT_CONCURRENCY = 5;
    public static final int MAX_CONCURRENCY = 50;

    public BehaviorConfig {
        rateLimit = rateLimit == null ? new RateLimitConfig(0, 0, null) : rateLimit;
        retry = retry == null ? new RetryConfig(0, null, null) : retry;
    }

    public int effectiveConcurrency() {
        return concurrency > 0 ? concurrency : DEFAULT_CONCURRENCY;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RateLimitConfig(
            @JsonProperty("requests_per_second") double requestsPerSecond,
            @JsonProperty("burst") int burst,
            @JsonProperty("timeout") String timeout
    ) {

        public static final double DEFAULT_REQUESTS_PER_SECOND = 5.0;
        public static final int DEFAULT_BURST = 10;
        public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

        public double effectiveRequestsPerSecond() {
            return requestsPerSecond > 0 ? requestsPerSecond : DEFAULT_REQUESTS_PER_SECOND;
        }

        public int effectiveBurst() {
            return burst > 0 ? burst : DEFAULT_BURST;
        }

        public Duration effectiveTimeout() {
            return DurationParser.parseOrDefault(timeout, DEFAULT_TIMEOUT);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record RetryConfig(
            @JsonProperty("max_attempts") int maxAttempts,
            @JsonProperty("backoff") String backoff,
            @JsonProperty("max_backoff") String maxBackoff
    ) {

        public static final int DEFAULT_MAX_ATTEMPTS = 3;
        public static final Duration DEFAULT_BACKOFF = Duration.ofSeconds(1);
        public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(30);

        public int effectiveMaxAttempts() {
            return maxAttempts > 0 ? maxAttempts : DEFAULT_MAX_ATTEMPTS;
        }

        public Duration effectiveBackoff() {
            return DurationParser.parseOrDefault(backoff, DEFAULT_BACKOFF);
        }

        public Duration effectiveMaxBackoff() {
            return DurationParser.parseOrDefault(maxBackoff, DEFAULT_MAX_BACKOFF);
        }
    }
}
