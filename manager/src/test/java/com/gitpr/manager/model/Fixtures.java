package com.gitpr.manager.model;

import java.time.Instant;
import java.util.List;

/**
 * Shared model instances for tests.
 */
public final class Fixtures {

    public static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private Fixtures() {
    }

    public static Repository repository(String fullName) {
        RepositoryName name = RepositoryName.parse(fullName);
        return new Repository("1", name.name(), fullName, "github", name.owner(), "main",
                Visibility.PUBLIC, false, "https://github.com/" + fullName);
    }

    public static PullRequest pullRequest(int number, String author) {
        return pullRequest(number, author, List.of());
    }

    public static PullRequest pullRequest(int number, String author, List<String> labels) {
        return new PullRequest(String.valueOf(1000 + number), number, "Bump library to 1." + number,
                "Bumps the library.", PrState.OPEN, User.of(author), labels, "main",
                "dependabot/maven/lib-1." + number, "sha" + number,
                "https://github.com/acme/app/pull/" + number, false, false, true,
                NOW.minusSeconds(3600), NOW.minusSeconds(60));
    }

    public static PullRequest withState(PullRequest pr, PrState state, boolean draft, boolean locked,
                                        Boolean mergeable) {
        return new PullRequest(pr.id(), pr.number(), pr.title(), pr.body(), state, pr.author(), pr.labels(),
                pr.baseBranch(), pr.headBranch(), pr.headSha(), pr.url(), draft, locked, mergeable,
                pr.createdAt(), pr.updatedAt());
    }

    public static PullRequest createdAt(PullRequest pr, Instant createdAt) {
        return new PullRequest(pr.id(), pr.number(), pr.title(), pr.body(), pr.state(), pr.author(), pr.labels(),
                pr.baseBranch(), pr.headBranch(), pr.headSha(), pr.url(), pr.draft(), pr.locked(),
                pr.mergeable(), createdAt, pr.updatedAt());
    }

    public static PullRequest withText(PullRequest pr, String title, String body) {
        return new PullRequest(pr.id(), pr.number(), title, body, pr.state(), pr.author(), pr.labels(),
                pr.baseBranch(), pr.headBranch(), pr.headSha(), pr.url(), pr.draft(), pr.locked(),
                pr.mergeable(), pr.createdAt(), pr.updatedAt());
    }
}
