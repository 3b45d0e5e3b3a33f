package com.gitpr.manager.model;

/**
 * Provider-level merge parameters. {@code sha}, when set, guards against
 * merging a head that moved after evaluation.
 */
public record MergeRequest(
        MergeMethod method,
        String commitTitle,
        String commitMessage,
        String sha,
        boolean deleteBranch
) {
}
