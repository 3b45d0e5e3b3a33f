package com.gitpr.manager.evaluation;

import com.gitpr.manager.model.Check;
import com.gitpr.manager.model.PrStatus;
import com.gitpr.manager.model.PullRequest;

import java.util.List;
import java.util.Objects;

/**
 * A pull request together with its readiness decision.
 *
 * <p>Exactly one outcome is active. {@code reason} is always non-empty and
 * {@code error} is set only for {@link Readiness#ERRORED}. {@code status} and
 * {@code checks} are present only when they were fetched.</p>
 */
public record EvaluatedPR(
        PullRequest pullRequest,
        Readiness outcome,
        String reason,
        Throwable error,
        PrStatus status,
        List<Check> checks
) {

    public EvaluatedPR {
        Objects.requireNonNull(pullRequest, "pullRequest");
        Objects.requireNonNull(outcome, "outcome");
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason must not be empty");
        }
        if ((outcome == Readiness.ERRORED) != (error != null)) {
            throw new IllegalArgumentException("error must be set exactly when the outcome is ERRORED");
        }
        checks = checks == null ? List.of() : List.copyOf(checks);
    }

    public static EvaluatedPR ready(PullRequest pr, PrStatus status, List<Check> checks) {
        return new EvaluatedPR(pr, Readiness.READY, "ready to merge", null, status, checks);
    }

    public static EvaluatedPR skipped(PullRequest pr, String reason) {
        return new EvaluatedPR(pr, Readiness.SKIPPED, reason, null, null, null);
    }

    public static EvaluatedPR blocked(PullRequest pr, String reason) {
        return blocked(pr, reason, null, null);
    }

    public static EvaluatedPR blocked(PullRequest pr, String reason, PrStatus status, List<Check> checks) {
        return new EvaluatedPR(pr, Readiness.BLOCKED, reason, null, status, checks);
    }

    public static EvaluatedPR errored(PullRequest pr, String reason, Throwable error) {
        return new EvaluatedPR(pr, Readiness.ERRORED, reason, error, null, null);
    }

    public boolean ready() {
        return outcome == Readiness.READY;
    }

    public boolean skipped() {
        return outcome == Readiness.SKIPPED;
    }

    public boolean blocked() {
        return outcome == Readiness.BLOCKED;
    }

    public boolean errored() {
        return outcome == Readiness.ERRORED;
    }
}
