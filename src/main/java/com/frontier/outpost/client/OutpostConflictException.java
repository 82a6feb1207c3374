package com.frontier.outpost.client;

/**
 * The node refused the write because of its own state (409).
 */
public class OutpostConflictException extends OutpostException {

    public OutpostConflictException(String node, int attempts, String message, Throwable cause) {
        super(node, FailureClass.CONFLICT, attempts, message, cause);
    }

    public OutpostConflictException(String node, String message) {
        this(node, 0, message, null);
    }
}
