package com.gitpr.manager.model;

public enum CheckStatus {
    QUEUED,
    IN_PROGRESS,
    COMPLETED;

    public static CheckStatus fromValue(String value) {
        if (value == null) {
            return QUEUED;
        }
        return switch (value.toLowerCase()) {
            case "completed" -> COMPLETED;
            case "in_progress" -> IN_PROGRESS;
            default -> QUEUED;
        };
    }
}
