package com.gitpr.manager.model;

import java.util.List;
import java.util.Locale;

/**
 * Provider-neutral account identity attached to pull requests and repositories.
 */
public record User(
        String id,
        String login,
        String type
) {

    private static final List<String> BOT_PATTERNS = List.of(
            "[bot]", "dependabot", "renovate", "greenkeeper", "snyk", "github-actions", "codecov");

    public static User of(String login) {
        return new User(null, login, null);
    }

    /**
     * Heuristic bot detection: an explicit {@code Bot} account type or a login
     * matching one of the well-known automation accounts.
     */
    public boolean isBot() {
        if ("bot".equalsIgnoreCase(type)) {
            return true;
        }
        if (login == null) {
            return false;
        }
        String lower = login.toLowerCase(Locale.ROOT);
        return BOT_PATTERNS.stream().anyMatch(lower::contains);
    }
}
