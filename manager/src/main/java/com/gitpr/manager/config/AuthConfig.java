package com.gitpr.manager.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AuthConfig(
        @JsonProperty("github") GitHubAuth github
) {

    public AuthConfig {
        github = github == null ? new GitHubAuth(null, null) : github;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GitHubAuth(
            @JsonProperty("token") String token,
            @JsonProperty("base_url") String baseUrl
    ) {

        public boolean hasToken() {
            return token != null && !token.isBlank();
        }
    }
}
