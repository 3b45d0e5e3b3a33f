package com.gitpr.manager.provider;

import java.time.Duration;

/**
 * A classified failure raised by a {@link Provider} or by the behavior manager
 * around it.
 */
public class ProviderException extends Exception {

    private final String provider;
    private final ErrorType type;
    private final int statusCode;
    private final Duration retryAfter;

    public ProviderException(String provider, ErrorType type, String message) {
        this(provider, type, message, 0, null, null);
    }

    public ProviderException(String provider, ErrorType type, String message, Throwable cause) {
        this(provider, type, message, 0, null, cause);
    }

    public ProviderException(String provider, ErrorType type, String message, int statusCode,
                             Duration retryAfter, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.type = type;
        this.statusCode = statusCode;
        this.retryAfter = retryAfter;
    }

    public String getProvider() {
        return provider;
    }

    public ErrorType getType() {
        return type;
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Server-requested wait before retrying, or {@code null} when none was sent.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }

    public boolean isRetryable() {
        return type.isRetryable();
    }

    @Override
    public String toString() {
        return provider + " provider error (" + type.label() + "): " + getMessage();
    }
}
