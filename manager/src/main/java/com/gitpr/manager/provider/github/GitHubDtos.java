package com.gitpr.manager.provider.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Wire shapes of the GitHub REST v3 responses the provider reads. Timestamps stay
 * ISO-8601 strings here and are parsed by {@link GitHubConverters}.
 */
final class GitHubDtos {

    private GitHubDtos() {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record User(
            @JsonProperty("login") String login,
            @JsonProperty("id") long id,
            @JsonProperty("type") String type
    ) {}

    /**
     * Maps from: /user/repos, /repos/{owner}/{repo}
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Repository(
            @JsonProperty("id") long id,
            @JsonProperty("name") String name,
            @JsonProperty("full_name") String fullName,
            @JsonProperty("owner") User owner,
            @JsonProperty("default_branch") String defaultBranch,
            @JsonProperty("visibility") String visibility,
            @JsonProperty("private") boolean isPrivate,
            @JsonProperty("archived") boolean archived,
            @JsonProperty("html_url") String htmlUrl
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Label(
            @JsonProperty("name") String name
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Ref(
            @JsonProperty("ref") String ref,
            @JsonProperty("sha") String sha
    ) {}

    /**
     * Maps from: /repos/{owner}/{repo}/pulls, /repos/{owner}/{repo}/pulls/{number}.
     * {@code mergeable} is only populated by the single-PR endpoint.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record PullRequest(
            @JsonProperty("id") long id,
            @JsonProperty("number") int number,
            @JsonProperty("title") String title,
            @JsonProperty("body") String body,
            @JsonProperty("state") String state,
            @JsonProperty("user") User user,
            @JsonProperty("labels") List<Label> labels,
            @JsonProperty("base") Ref base,
            @JsonProperty("head") Ref head,
            @JsonProperty("html_url") String htmlUrl,
            @JsonProperty("draft") boolean draft,
            @JsonProperty("locked") boolean locked,
            @JsonProperty("mergeable") Boolean mergeable,
            @JsonProperty("merged_at") String mergedAt,
            @JsonProperty("created_at") String createdAt,
            @JsonProperty("updated_at") String updatedAt
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Status(
            @JsonProperty("context") String context,
            @JsonProperty("state") String state,
            @JsonProperty("description") String description
    ) {}

    /**
     * Maps from: /repos/{owner}/{repo}/commits/{ref}/status
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record CombinedStatus(
            @JsonProperty("state") String state,
            @JsonProperty("total_count") int totalCount,
            @JsonProperty("statuses") List<Status> statuses
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record CheckRun(
            @JsonProperty("id") long id,
            @JsonProperty("name") String name,
            @JsonProperty("status") String status,
            @JsonProperty("conclusion") String conclusion,
            @JsonProperty("details_url") String detailsUrl
    ) {}

    /**
     * Maps from: /repos/{owner}/{repo}/commits/{ref}/check-runs
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record CheckRuns(
            @JsonProperty("total_count") int totalCount,
            @JsonProperty("check_runs") List<CheckRun> checkRuns
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Rate(
            @JsonProperty("limit") int limit,
            @JsonProperty("remaining") int remaining,
            @JsonProperty("reset") long reset
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RateResources(
            @JsonProperty("core") Rate core
    ) {}

    /**
     * Maps from: /rate_limit
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record RateLimitResponse(
            @JsonProperty("resources") RateResources resources
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ErrorBody(
            @JsonProperty("message") String message
    ) {}

    /**
     * Request body for PUT /repos/{owner}/{repo}/pulls/{number}/merge
     */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    record MergeBody(
            @JsonProperty("commit_title") String commitTitle,
            @JsonProperty("commit_message") String commitMessage,
            @JsonProperty("sha") String sha,
            @JsonProperty("merge_method") String mergeMethod
    ) {}
}
