package com.gitpr.manager.model;

public enum Visibility {
    PUBLIC,
    PRIVATE,
    INTERNAL;

    public static Visibility fromValue(String value, boolean isPrivate) {
        if (value == null || value.isBlank()) {
            return isPrivate ? PRIVATE : PUBLIC;
        }
        return switch (value.toLowerCase()) {
            case "private" -> PRIVATE;
            case "internal" -> INTERNAL;
            default -> PUBLIC;
        };
    }
}
