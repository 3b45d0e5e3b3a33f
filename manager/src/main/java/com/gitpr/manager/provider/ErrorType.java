package com.gitpr.manager.provider;

/**
 * Classification of provider failures. Only {@link #RATE_LIMIT} and
 * {@link #NETWORK} are transient; every other type is terminal for the
 * operation that produced it.
 */
public enum ErrorType {
    AUTH("auth"),
    PERMISSION("permission"),
    NOT_FOUND("not-found"),
    CONFLICT("conflict"),
    VALIDATION("validation"),
    RATE_LIMIT("rate-limit"),
    NETWORK("network"),
    UNKNOWN("unknown");

    private final String label;

    ErrorType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isRetryable() {
        return this == RATE_LIMIT || this == NETWORK;
    }

    /**
     * Maps an HTTP status code to an error type.
     */
    public static ErrorType fromHttpStatus(int statusCode) {
        return switch (statusCode) {
            case 401 -> AUTH;
            case 403 -> PERMISSION;
            case 404 -> NOT_FOUND;
            case 405, 409 -> CONFLICT;
            case 422 -> VALIDATION;
            case 429 -> RATE_LIMIT;
            case 500, 502, 503, 504 -> NETWORK;
            default -> UNKNOWN;
        };
    }
}
