package com.gitpr.manager.orchestrator;

import com.gitpr.manager.evaluation.EvaluatedPR;
import com.gitpr.manager.evaluation.Readiness;
import com.gitpr.manager.model.Repository;

import java.util.List;

/**
 * Outcome of processing one configured repository. When {@code error} is set the
 * repository could not be processed and {@code pullRequests} is empty.
 *
 * @param repository the fetched repository, or {@code null} if it could not be resolved
 */
public record ProcessResult(
        String provider,
        String repositoryName,
        Repository repository,
        List<EvaluatedPR> pullRequests,
        Throwable error,
        long durationMs
) {

    public ProcessResult {
        pullRequests = error != null || pullRequests == null ? List.of() : List.copyOf(pullRequests);
    }

    public static ProcessResult success(String provider, String repositoryName, Repository repository,
                                        List<EvaluatedPR> pullRequests, long durationMs) {
        return new ProcessResult(provider, repositoryName, repository, pullRequests, null, durationMs);
    }

    public static ProcessResult failure(String provider, String repositoryName, Repository repository,
                                        Throwable error, long durationMs) {
        return new ProcessResult(provider, repositoryName, repository, List.of(), error, durationMs);
    }

    public boolean hasError() {
        return error != null;
    }

    public String errorMessage() {
        return error != null ? error.getMessage() : null;
    }

    public int countOf(Readiness outcome) {
        return (int) pullRequests.stream().filter(pr -> pr.outcome() == outcome).count();
    }

    public boolean hasErroredPullRequests() {
        return pullRequests.stream().anyMatch(EvaluatedPR::errored);
    }
}
