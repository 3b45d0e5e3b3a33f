package com.gitpr.manager.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link AppConfig} variable resolution.
 */
class AppConfigTest {

    @Test
    @DisplayName("Resolves values from the supplied environment")
    void resolvesFromEnvironment() {
        AppConfig config = new AppConfig(Map.of("GITHUB_TOKEN", "ghp_test_token", "OTHER", "x"));

        assertEquals("ghp_test_token", config.getGithubToken());
        assertEquals("x", config.resolve("OTHER"));
    }

    @Test
    @DisplayName("Blank and missing values resolve to null")
    void blankIsMissing() {
        AppConfig config = new AppConfig(Map.of("GITHUB_TOKEN", "  "));

        assertNull(config.getGithubToken());
        assertNull(config.resolve("NOT_DEFINED"));
    }

    @Test
    @DisplayName("Config path defaults to config.yaml and honours GITPR_CONFIG")
    void configPath() {
        assertEquals("config.yaml", new AppConfig(Map.of()).getConfigPath());
        assertEquals("/etc/gitpr.yaml", new AppConfig(Map.of("GITPR_CONFIG", "/etc/gitpr.yaml")).getConfigPath());
    }
}
