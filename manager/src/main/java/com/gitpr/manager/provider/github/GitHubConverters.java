package com.gitpr.manager.provider.github;

import com.gitpr.manager.model.Check;
import com.gitpr.manager.model.CheckStatus;
import com.gitpr.manager.model.PrState;
import com.gitpr.manager.model.PrStatus;
import com.gitpr.manager.model.PullRequest;
import com.gitpr.manager.model.RateLimit;
import com.gitpr.manager.model.Repository;
import com.gitpr.manager.model.StatusState;
import com.gitpr.manager.model.User;
import com.gitpr.manager.model.Visibility;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Translates GitHub wire records into the provider-neutral model.
 */
final class GitHubConverters {

    private GitHubConverters() {
    }

    static Repository toRepository(GitHubDtos.Repository repo) {
        return new Repository(
                String.valueOf(repo.id()),
                repo.name(),
                repo.fullName(),
                GitHubProvider.NAME,
                repo.owner() != null ? repo.owner().login() : null,
                repo.defaultBranch(),
                Visibility.fromValue(repo.visibility(), repo.isPrivate()),
                repo.archived(),
                repo.htmlUrl());
    }

    static PullRequest toPullRequest(GitHubDtos.PullRequest pr) {
        List<String> labels = pr.labels() == null ? List.of()
                : pr.labels().stream().map(GitHubDtos.Label::name).toList();
        return new PullRequest(
                String.valueOf(pr.id()),
                pr.number(),
                pr.title(),
                pr.body() != null ? pr.body() : "",
                toState(pr),
                toUser(pr.user()),
                labels,
                pr.base() != null ? pr.base().ref() : null,
                pr.head() != null ? pr.head().ref() : null,
                pr.head() != null ? pr.head().sha() : null,
                pr.htmlUrl(),
                pr.draft(),
                pr.locked(),
                pr.mergeable(),
                parseInstant(pr.createdAt()),
                parseInstant(pr.updatedAt()));
    }

    /**
     * GitHub reports merged PRs as {@code closed} with a merge timestamp.
     */
    static PrState toState(GitHubDtos.PullRequest pr) {
        if ("closed".equalsIgnoreCase(pr.state())) {
            return pr.mergedAt() != null ? PrState.MERGED : PrState.CLOSED;
        }
        return PrState.OPEN;
    }

    static User toUser(GitHubDtos.User user) {
        if (user == null) {
            return new User(null, null, null);
        }
        return new User(String.valueOf(user.id()), user.login(), user.type());
    }

    /**
     * A ref without any commit statuses reports {@code pending}; that is treated as
     * success so repositories that rely only on check runs are not blocked forever.
     */
    static PrStatus toStatus(GitHubDtos.CombinedStatus status) {
        if (status.totalCount() == 0) {
            return new PrStatus(StatusState.SUCCESS, "no commit statuses", "github/combined-status");
        }
        StatusState state = StatusState.fromValue(status.state());
        String description = null;
        if (state != StatusState.SUCCESS && status.statuses() != null) {
            description = status.statuses().stream()
                    .filter(s -> !"success".equalsIgnoreCase(s.state()))
                    .map(s -> s.context() + ": " + (s.description() != null ? s.description() : s.state()))
                    .findFirst()
                    .orElse(null);
        }
        return new PrStatus(state, description, "github/combined-status");
    }

    static Check toCheck(GitHubDtos.CheckRun run) {
        return new Check(
                String.valueOf(run.id()),
                run.name(),
                CheckStatus.fromValue(run.status()),
                run.conclusion(),
                run.detailsUrl());
    }

    static RateLimit toRateLimit(GitHubDtos.RateLimitResponse response) {
        GitHubDtos.Rate core = response.resources() != null ? response.resources().core() : null;
        if (core == null) {
            return new RateLimit(0, 0, null);
        }
        return new RateLimit(core.limit(), core.remaining(), Instant.ofEpochSecond(core.reset()));
    }

    static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
