package com.gitpr.manager.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Global pull request filters from the {@code pr_filters} section.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PrFilters(
        @JsonProperty("allowed_actors") List<String> allowedActors,
        @JsonProperty("skip_labels") List<String> skipLabels,
        @JsonProperty("max_age") String maxAge
) {

    public PrFilters {
        allowedActors = allowedActors == null ? List.of() : List.copyOf(allowedActors);
        skipLabels = skipLabels == null ? List.of() : List.copyOf(skipLabels);
    }
}
