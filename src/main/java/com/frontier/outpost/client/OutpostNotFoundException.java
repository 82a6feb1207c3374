package com.frontier.outpost.client;

/**
 * The addressed resource does not exist on the node (404).
 */
public class OutpostNotFoundException extends OutpostException {

    public OutpostNotFoundException(String node, int attempts, String message, Throwable cause) {
        super(node, FailureClass.NOT_FOUND, attempts, message, cause);
    }

    public OutpostNotFoundException(String node, String message) {
        this(node, 0, message, null);
    }
}
