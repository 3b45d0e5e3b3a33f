package com.gitpr.manager.orchestrator;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Per-run narrowing and overrides for {@link PullRequestProcessor#processAll}.
 *
 * @param providers     provider keys to process; empty means all
 * @param repositories  case-insensitive substrings a repository name must contain; empty means all
 * @param skipLabels    labels skipped in addition to the configured ones
 * @param requireChecks forces status and check verification for every repository
 * @param maxAge        replaces the configured max age when set
 */
public record ProcessOptions(
        List<String> providers,
        List<String> repositories,
        List<String> skipLabels,
        boolean requireChecks,
        Duration maxAge
) {

    public ProcessOptions {
        providers = providers == null ? List.of() : List.copyOf(providers);
        repositories = repositories == null ? List.of() : List.copyOf(repositories);
        skipLabels = skipLabels == null ? List.of() : List.copyOf(skipLabels);
    }

    public static ProcessOptions defaults() {
        return new ProcessOptions(List.of(), List.of(), List.of(), false, null);
    }

    boolean includesProvider(String provider) {
        return providers.isEmpty() || providers.stream().anyMatch(provider::equalsIgnoreCase);
    }

    boolean includesRepository(String name) {
        if (repositories.isEmpty()) {
            return true;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        return repositories.stream().anyMatch(f -> lower.contains(f.toLowerCase(Locale.ROOT)));
    }
}
