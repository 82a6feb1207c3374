package com.frontier.outpost.client;

/**
 * Rejected or missing credentials (401/403, expired token after one re-authentication).
 */
public class OutpostAuthenticationException extends OutpostException {

    public OutpostAuthenticationException(String node, int attempts, String message, Throwable cause) {
        super(node, FailureClass.AUTHENTICATION, attempts, message, cause);
    }

    public OutpostAuthenticationException(String node, String message) {
        this(node, 0, message, null);
    }
}
