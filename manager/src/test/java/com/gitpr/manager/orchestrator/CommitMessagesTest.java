package com.gitpr.manager.orchestrator;

import com.gitpr.manager.model.Fixtures;
import com.gitpr.manager.model.MergeMethod;
import com.gitpr.manager.model.PullRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CommitMessagesTest {

    private final PullRequest pr = Fixtures.withText(Fixtures.pullRequest(12, "dependabot[bot]"),
            "Bump okhttp from 4.11 to 4.12", "Release notes...");

    @Test
    @DisplayName("Squash appends the PR number and forwards a short body")
    void squash() {
        CommitMessages.CommitMessage message = CommitMessages.build(pr, MergeMethod.SQUASH, null);

        assertEquals("Bump okhttp from 4.11 to 4.12 (#12)", message.title());
        assertEquals("Release notes...", message.message());
    }

    @Test
    @DisplayName("Squash keeps a title that already references the PR and drops a long body")
    void squash_existingReferenceAndLongBody() {
        PullRequest referenced = Fixtures.withText(pr, "Fix #12: bump okhttp", "x".repeat(500));

        CommitMessages.CommitMessage message = CommitMessages.build(referenced, MergeMethod.SQUASH, null);

        assertEquals("Fix #12: bump okhttp", message.title());
        assertNull(message.message());
    }

    @Test
    @DisplayName("A longer issue number with the same prefix does not count as the PR reference")
    void squash_referencePrefixOfAnotherNumber() {
        PullRequest one = Fixtures.withText(Fixtures.pullRequest(1, "dependabot[bot]"), "Fix #12", "");

        assertEquals("Fix #12 (#1)", CommitMessages.build(one, MergeMethod.SQUASH, null).title());
        assertEquals("Fix #12 (#12)",
                CommitMessages.build(Fixtures.withText(pr, "Fix #123", ""), MergeMethod.SQUASH, null).title());
    }

    @Test
    @DisplayName("Merge uses the conventional merge commit title")
    void merge() {
        CommitMessages.CommitMessage message = CommitMessages.build(pr, MergeMethod.MERGE, null);

        assertEquals("Merge pull request #12 from dependabot/maven/lib-1.12", message.title());
        assertEquals("Bump okhttp from 4.11 to 4.12", message.message());
    }

    @Test
    @DisplayName("Rebase keeps the title and sends no message")
    void rebase() {
        CommitMessages.CommitMessage message = CommitMessages.build(pr, MergeMethod.REBASE, null);

        assertEquals("Bump okhttp from 4.11 to 4.12", message.title());
        assertNull(message.message());
    }

    @Test
    @DisplayName("A custom message replaces the generated title")
    void customMessage() {
        CommitMessages.CommitMessage message = CommitMessages.build(pr, MergeMethod.SQUASH, "chore: deps");

        assertEquals("chore: deps", message.title());
        assertNull(message.message());
    }
}
