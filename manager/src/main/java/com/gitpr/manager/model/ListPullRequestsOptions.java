package com.gitpr.manager.model;

import java.time.Instant;

/**
 * Filters for listing pull requests. {@code since}, when set, drops PRs
 * created before that instant.
 */
public record ListPullRequestsOptions(
        PrState state,
        int perPage,
        Instant since
) {

    public static ListPullRequestsOptions openSince(Instant since) {
        return new ListPullRequestsOptions(PrState.OPEN, 100, since);
    }
}
