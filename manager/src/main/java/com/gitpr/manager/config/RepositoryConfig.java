package com.gitpr.manager.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gitpr.manager.model.MergeMethod;

import java.util.List;

/**
 * One entry under {@code repositories.<provider>}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RepositoryConfig(
        @JsonProperty("name") String name,
        @JsonProperty("merge_strategy") String mergeStrategy,
        @JsonProperty("require_checks") boolean requireChecks,
        @JsonProperty("skip_labels") List<String> skipLabels,
        @JsonProperty("delete_branches") boolean deleteBranches
) {

    public RepositoryConfig {
        skipLabels = skipLabels == null ? List.of() : List.copyOf(skipLabels);
    }

    public MergeMethod mergeMethod() {
        return MergeMethod.fromStrategy(mergeStrategy);
    }
}
