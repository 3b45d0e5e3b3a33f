package com.gitpr.manager.config;

import com.gitpr.manager.model.MergeMethod;
import com.gitpr.manager.model.RepositoryName;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks a parsed {@link ManagerConfig} and reports every problem at once.
 */
class ConfigValidator {

    static final Set<String> KNOWN_PROVIDERS = Set.of("github", "gitlab", "bitbucket");

    void validate(ManagerConfig config) {
        List<String> problems = new ArrayList<>();
        validateFilters(config.prFilters(), problems);
        validateRepositories(config.repositories(), problems);
        validateAuth(config, problems);
        validateBehavior(config.behavior(), problems);

        if (!problems.isEmpty()) {
            throw new ConfigException(problems);
        }
    }

    private void validateFilters(PrFilters filters, List<String> problems) {
        if (filters.allowedActors().isEmpty()) {
            problems.add("pr_filters: at least one allowed actor must be specified");
        }
        for (int i = 0; i < filters.allowedActors().size(); i++) {
            if (isBlank(filters.allowedActors().get(i))) {
                problems.add("pr_filters: allowed actor at index " + i + " is empty");
            }
        }
        for (int i = 0; i < filters.skipLabels().size(); i++) {
            if (isBlank(filters.skipLabels().get(i))) {
                problems.add("pr_filters: skip label at index " + i + " is empty");
            }
        }
        if (!isBlank(filters.maxAge())) {
            checkDuration("pr_filters: max_age", filters.maxAge(), problems);
        }
    }

    private void validateRepositories(Map<String, List<RepositoryConfig>> repositories, List<String> problems) {
        if (repositories.isEmpty()) {
            problems.add("repositories: at least one provider must be configured");
            return;
        }
        repositories.forEach((provider, repos) -> {
            if (!KNOWN_PROVIDERS.contains(provider)) {
                problems.add("repositories: unknown provider '" + provider + "'");
            }
            for (int i = 0; i < repos.size(); i++) {
                RepositoryConfig repo = repos.get(i);
                try {
                    RepositoryName.parse(repo.name());
                } catch (IllegalArgumentException e) {
                    problems.add("repositories: provider '" + provider + "', repository " + i
                            + ": invalid name format '" + repo.name() + "' (expected 'owner/name')");
                }
                if (!isBlank(repo.mergeStrategy()) && !MergeMethod.isValidStrategy(repo.mergeStrategy())) {
                    problems.add("repositories: provider '" + provider + "', repository '" + repo.name()
                            + "': invalid merge strategy '" + repo.mergeStrategy()
                            + "' (must be one of: merge, squash, rebase)");
                }
            }
        });
    }

    private void validateAuth(ManagerConfig config, List<String> problems) {
        List<RepositoryConfig> github = config.repositories().getOrDefault("github", List.of());
        if (!github.isEmpty() && !config.auth().github().hasToken()) {
            problems.add("auth: GitHub token is required when GitHub repositories are configured");
        }
        String baseUrl = config.auth().github().baseUrl();
        if (!isBlank(baseUrl) && !baseUrl.startsWith("http://") && !baseUrl.startsWith("https://")) {
            problems.add("auth: GitHub base_url must start with http:// or https://");
        }
    }

    private void validateBehavior(BehaviorConfig behavior, List<String> problems) {
        if (behavior.concurrency() < 0) {
            problems.add("behavior: concurrency must be greater than 0");
        }
        if (behavior.concurrency() > BehaviorConfig.MAX_CONCURRENCY) {
            problems.add("behavior: concurrency should not exceed " + BehaviorConfig.MAX_CONCURRENCY);
        }

        BehaviorConfig.RateLimitConfig rateLimit = behavior.rateLimit();
        if (rateLimit.requestsPerSecond() < 0) {
            problems.add("behavior: rate limit requests per second cannot be negative");
        }
        if (rateLimit.burst() < 0) {
            problems.add("behavior: rate limit burst cannot be negative");
        }
        if (!isBlank(rateLimit.timeout())) {
            checkDuration("behavior: rate limit timeout", rateLimit.timeout(), problems);
        }

        BehaviorConfig.RetryConfig retry = behavior.retry();
        if (retry.maxAttempts() < 0) {
            problems.add("behavior: retry max_attempts cannot be negative");
        }
        Duration backoff = isBlank(retry.backoff())
                ? BehaviorConfig.RetryConfig.DEFAULT_BACKOFF
                : checkDuration("behavior: retry backoff", retry.backoff(), problems);
        Duration maxBackoff = isBlank(retry.maxBackoff())
                ? BehaviorConfig.RetryConfig.DEFAULT_MAX_BACKOFF
                : checkDuration("behavior: retry max_backoff", retry.maxBackoff(), problems);
        if (backoff != null && maxBackoff != null && backoff.compareTo(maxBackoff) > 0) {
            problems.add("behavior: retry backoff cannot be greater than max_backoff");
        }
    }

    private static Duration checkDuration(String field, String value, List<String> problems) {
        try {
            return DurationParser.parse(value);
        } catch (IllegalArgumentException e) {
            problems.add(field + ": invalid duration '" + value + "'");
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
