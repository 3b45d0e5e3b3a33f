package com.gitpr.manager.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Root of the YAML configuration. Repository order is preserved as written so that
 * processing results come back in configuration order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ManagerConfig(
        @JsonProperty("pr_filters") PrFilters prFilters,
        @JsonProperty("repositories") Map<String, List<RepositoryConfig>> repositories,
        @JsonProperty("auth") AuthConfig auth,
        @JsonProperty("behavior") BehaviorConfig behavior
) {

    public ManagerConfig {
        prFilters = prFilters == null ? new PrFilters(null, null, null) : prFilters;
        repositories = repositories == null ? Map.of() : copyOrdered(repositories);
        auth = auth == null ? new AuthConfig(null) : auth;
        behavior = behavior == null ? new BehaviorConfig(0, null, null) : behavior;
    }

    /**
     * Looks up the configuration of {@code fullName} under {@code provider}.
     */
    public Optional<RepositoryConfig> findRepository(String provider, String fullName) {
        return repositories.getOrDefault(provider, List.of()).stream()
                .filter(r -> r.name() != null && r.name().equalsIgnoreCase(fullName))
                .findFirst();
    }

    /**
     * Configured maximum PR age, or empty when no limit is set.
     */
    public Optional<Duration> maxAge() {
        String value = prFilters.maxAge();
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(DurationParser.parse(value));
    }

    public int repositoryCount() {
        return repositories.values().stream().mapToInt(List::size).sum();
    }

    private static Map<String, List<RepositoryConfig>> copyOrdered(Map<String, List<RepositoryConfig>> source) {
        Map<String, List<RepositoryConfig>> copy = new LinkedHashMap<>();
        source.forEach((provider, repos) -> copy.put(provider, repos == null ? List.of() : List.copyOf(repos)));
        return Collections.unmodifiableMap(copy);
    }
}
