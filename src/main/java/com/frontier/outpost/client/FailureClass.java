package com.frontier.outpost.client;

/**
 * Closed classification of a failed outpost call. Only {@link #TRANSIENT} is retried.
 */
public enum FailureClass {
    TRANSIENT(true),
    AUTHENTICATION(false),
    NOT_FOUND(false),
    VALIDATION(false),
    CONFLICT(false);

    private final boolean retryable;

    FailureClass(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
