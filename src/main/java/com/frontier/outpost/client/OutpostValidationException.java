package com.frontier.outpost.client;

import lombok.Getter;

/**
 * Malformed request or response; never retried.
 */
@Getter
public class OutpostValidationException extends OutpostException {

    /**
     * Offending field, or null when the node did not report one.
     */
    private final String field;

    public OutpostValidationException(String node, int attempts, String field, String message, Throwable cause) {
        super(node, FailureClass.VALIDATION, attempts, message, cause);
        this.field = field;
    }
}
