package com.gitpr.manager.model;

/**
 * An {@code owner/name} repository identifier.
 */
public record RepositoryName(String owner, String name) {

    /**
     * Parses {@code owner/name}.
     *
     * @throws IllegalArgumentException if the value does not have exactly two non-empty parts
     */
    public static RepositoryName parse(String fullName) {
        if (fullName == null) {
            throw new IllegalArgumentException("invalid repository format, expected 'owner/name', got: null");
        }
        String[] parts = fullName.split("/", -1);
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new IllegalArgumentException(
                    "invalid repository format, expected 'owner/name', got: " + fullName);
        }
        return new RepositoryName(parts[0], parts[1]);
    }

    public String fullName() {
        return owner + "/" + name;
    }
}
