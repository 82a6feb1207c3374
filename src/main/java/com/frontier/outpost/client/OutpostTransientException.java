package com.frontier.outpost.client;

/**
 * Network, timeout or 5xx failure that persisted through the retry budget.
 */
public class OutpostTransientException extends OutpostException {

    public OutpostTransientException(String node, int attempts, String message, Throwable cause) {
        super(node, FailureClass.TRANSIENT, attempts, message, cause);
    }

    public OutpostTransientException(String node, String message) {
        this(node, 0, message, null);
    }
}
