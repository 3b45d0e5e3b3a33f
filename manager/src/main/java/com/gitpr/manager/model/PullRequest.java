package com.gitpr.manager.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Provider-neutral pull request. Read-only to the orchestration core.
 *
 * <p>{@code mergeable} is tri-state: {@code null} means the provider has not
 * computed mergeability yet.</p>
 */
public record PullRequest(
        String id,
        int number,
        String title,
        String body,
        PrState state,
        User author,
        List<String> labels,
        String baseBranch,
        String headBranch,
        String headSha,
        String url,
        boolean draft,
        boolean locked,
        Boolean mergeable,
        Instant createdAt,
        Instant updatedAt
) {

    public PullRequest {
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    public boolean isOpen() {
        return state == PrState.OPEN;
    }

    public boolean isDraft() {
        return draft;
    }

    public boolean hasConflicts() {
        return Boolean.FALSE.equals(mergeable);
    }

    public String authorLogin() {
        return author != null ? author.login() : null;
    }

    public boolean hasLabel(String labelName) {
        return labels.stream().anyMatch(l -> l.equalsIgnoreCase(labelName));
    }

    public boolean hasAnyLabel(Collection<String> labelNames) {
        return labelNames.stream().anyMatch(this::hasLabel);
    }

    public List<String> matchingLabels(Collection<String> labelNames) {
        return labels.stream()
                .filter(l -> labelNames.stream().anyMatch(l::equalsIgnoreCase))
                .toList();
    }

    public Duration age(Instant now) {
        return createdAt == null ? Duration.ZERO : Duration.between(createdAt, now);
    }

    public boolean isOlderThan(Duration maxAge, Instant now) {
        return age(now).compareTo(maxAge) > 0;
    }
}
