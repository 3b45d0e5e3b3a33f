package com.gitpr.manager.model;

import java.util.Set;

/**
 * A single named CI check on a pull request.
 */
public record Check(
        String id,
        String name,
        CheckStatus status,
        String conclusion,
        String detailsUrl
) {

    private static final Set<String> SUCCESS_CONCLUSIONS = Set.of("success", "neutral", "skipped");
    private static final Set<String> FAILURE_CONCLUSIONS =
            Set.of("failure", "cancelled", "timed_out", "action_required");

    public boolean isCompleted() {
        return status == CheckStatus.COMPLETED;
    }

    public boolean isSuccessful() {
        return isCompleted() && conclusion != null && SUCCESS_CONCLUSIONS.contains(conclusion);
    }

    public boolean isFailed() {
        return isCompleted() && conclusion != null && FAILURE_CONCLUSIONS.contains(conclusion);
    }
}
