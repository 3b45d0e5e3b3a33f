package com.gitpr.manager.model;

/**
 * Aggregate CI state of a pull request's head commit.
 */
public enum StatusState {
    SUCCESS,
    FAILURE,
    PENDING,
    ERROR;

    public static StatusState fromValue(String value) {
        if (value == null) {
            return PENDING;
        }
        return switch (value.toLowerCase()) {
            case "success" -> SUCCESS;
            case "failure", "failed" -> FAILURE;
            case "error" -> ERROR;
            default -> PENDING;
        };
    }

    public String value() {
        return name().toLowerCase();
    }
}
