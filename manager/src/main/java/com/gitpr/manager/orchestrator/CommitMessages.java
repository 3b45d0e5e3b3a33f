package com.gitpr.manager.orchestrator;

import com.gitpr.manager.model.MergeMethod;
import com.gitpr.manager.model.PullRequest;

import java.util.regex.Pattern;

/**
 * Builds the commit title and message sent with a merge.
 */
final class CommitMessages {

    static final int MAX_BODY_LENGTH = 500;

    private CommitMessages() {
    }

    record CommitMessage(String title, String message) {}

    /**
     * A non-blank {@code customMessage} becomes the commit title and no message is sent.
     */
    static CommitMessage build(PullRequest pr, MergeMethod method, String customMessage) {
        if (customMessage != null && !customMessage.isBlank()) {
            return new CommitMessage(customMessage, null);
        }
        return switch (method) {
            case MERGE -> new CommitMessage(
                    "Merge pull request #" + pr.number() + " from " + pr.headBranch(),
                    pr.title());
            case REBASE -> new CommitMessage(pr.title(), null);
            case SQUASH -> squash(pr);
        };
    }

    private static CommitMessage squash(PullRequest pr) {
        String reference = "#" + pr.number();
        Pattern referenced = Pattern.compile("#" + pr.number() + "(?!\\d)");
        String title = pr.title() != null && referenced.matcher(pr.title()).find()
                ? pr.title()
                : pr.title() + " (" + reference + ")";
        String body = pr.body();
        String message = body != null && !body.isBlank() && body.length() < MAX_BODY_LENGTH ? body : null;
        return new CommitMessage(title, message);
    }
}
