package com.gitpr.manager.model;

import java.time.Instant;

public record RateLimit(
        int limit,
        int remaining,
        Instant resetAt
) {

    public boolean isExhausted(Instant now) {
        return remaining == 0 && resetAt != null && now.isBefore(resetAt);
    }
}
