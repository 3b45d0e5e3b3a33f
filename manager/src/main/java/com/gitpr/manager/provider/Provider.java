package com.gitpr.manager.provider;

import com.gitpr.manager.model.Check;
import com.gitpr.manager.model.ListPullRequestsOptions;
import com.gitpr.manager.model.MergeRequest;
import com.gitpr.manager.model.PrStatus;
import com.gitpr.manager.model.PullRequest;
import com.gitpr.manager.model.RateLimit;
import com.gitpr.manager.model.Repository;

import java.util.List;

/**
 * Capability set every Git-hosting service client implements. The orchestration
 * core only ever talks to providers through this interface and never branches on
 * the concrete service.
 *
 * <p>Implementations translate service responses into the common model and
 * classify failures as {@link ProviderException}. They do not retry; retry and
 * rate limiting are applied by the caller. Thread interruption cancels a call in
 * flight.</p>
 */
public interface Provider {

    String getProviderName();

    /**
     * Verifies the configured credentials.
     */
    void authenticate() throws ProviderException, InterruptedException;

    List<Repository> listRepositories() throws ProviderException, InterruptedException;

    Repository getRepository(String owner, String name) throws ProviderException, InterruptedException;

    List<PullRequest> listPullRequests(Repository repository, ListPullRequestsOptions options)
            throws ProviderException, InterruptedException;

    PullRequest getPullRequest(Repository repository, int number) throws ProviderException, InterruptedException;

    void mergePullRequest(Repository repository, PullRequest pullRequest, MergeRequest request)
            throws ProviderException, InterruptedException;

    /**
     * Combined status of the pull request's head commit.
     */
    PrStatus getPrStatus(Repository repository, PullRequest pullRequest)
            throws ProviderException, InterruptedException;

    List<Check> getChecks(Repository repository, PullRequest pullRequest)
            throws ProviderException, InterruptedException;

    RateLimit getRateLimit() throws ProviderException, InterruptedException;
}
