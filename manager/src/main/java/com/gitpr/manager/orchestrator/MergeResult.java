package com.gitpr.manager.orchestrator;

import com.gitpr.manager.model.MergeMethod;

import java.time.Instant;

/**
 * Outcome of merging, or deciding not to merge, one pull request.
 * A skipped result never carries an error.
 */
public record MergeResult(
        String provider,
        String repository,
        int prNumber,
        String title,
        String author,
        MergeMethod method,
        boolean success,
        Throwable error,
        boolean skipped,
        String reason,
        Instant mergedAt
) {

    public MergeResult {
        if (skipped && error != null) {
            throw new IllegalArgumentException("a skipped merge result cannot carry an error");
        }
    }

    public static MergeResult skipped(String provider, String repository, int prNumber, String title,
                                      String author, String reason) {
        return new MergeResult(provider, repository, prNumber, title, author, null,
                false, null, true, reason, null);
    }

    public static MergeResult succeeded(String provider, String repository, int prNumber, String title,
                                        String author, MergeMethod method, String reason, Instant mergedAt) {
        return new MergeResult(provider, repository, prNumber, title, author, method,
                true, null, false, reason, mergedAt);
    }

    public static MergeResult failed(String provider, String repository, int prNumber, String title,
                                     String author, MergeMethod method, String reason, Throwable error) {
        return new MergeResult(provider, repository, prNumber, title, author, method,
                false, error, false, reason, null);
    }

    public boolean failed() {
        return !success && !skipped;
    }
}
