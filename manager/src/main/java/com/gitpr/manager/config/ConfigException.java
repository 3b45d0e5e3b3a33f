package com.gitpr.manager.config;

import java.util.List;

/**
 * Raised when the configuration cannot be read or fails validation. Carries every
 * problem found, not just the first.
 */
public class ConfigException extends IllegalStateException {

    private final List<String> problems;

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    public ConfigException(List<String> problems) {
        super("Invalid configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
