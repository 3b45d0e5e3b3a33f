package com.gitpr.manager.model;

/**
 * Immutable snapshot of a hosted repository, normalized across providers.
 * Fetched once per orchestration pass.
 */
public record Repository(
        String id,
        String name,
        String fullName,
        String provider,
        String owner,
        String defaultBranch,
        Visibility visibility,
        boolean archived,
        String webUrl
) {
}
