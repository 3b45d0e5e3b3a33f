package com.gitpr.manager.orchestrator;

import com.gitpr.manager.evaluation.Readiness;

import java.util.List;

/**
 * Aggregated counts over the results of one processing pass.
 */
public record ProcessSummary(
        List<ProcessResult> results,
        long totalDurationMs
) {

    public int repositoryCount() {
        return results.size();
    }

    public int failedRepositoryCount() {
        return (int) results.stream().filter(ProcessResult::hasError).count();
    }

    public int pullRequestCount() {
        return results.stream().mapToInt(r -> r.pullRequests().size()).sum();
    }

    public int countOf(Readiness outcome) {
        return results.stream().mapToInt(r -> r.countOf(outcome)).sum();
    }

    /**
     * True when any repository failed or any pull request could not be evaluated.
     */
    public boolean hasFailures() {
        return results.stream().anyMatch(r -> r.hasError() || r.hasErroredPullRequests());
    }
}
