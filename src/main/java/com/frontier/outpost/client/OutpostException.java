package com.frontier.outpost.client;

import lombok.Getter;

/**
 * Base of every failure surfaced by an outpost client.
 */
@Getter
public abstract class OutpostException extends RuntimeException {

    private final String node;
    private final FailureClass failureClass;
    private final int attempts;

    protected OutpostException(String node, FailureClass failureClass, int attempts, String message, Throwable cause) {
        super(message, cause);
        this.node = node;
        this.failureClass = failureClass;
        this.attempts = attempts;
    }
}
