package com.frontier.outpost.client;

/**
 * Thrown when the calling thread is interrupted while backing off between attempts
 * or between items of a sync. No write is in flight when this is raised.
 */
public class OperationCancelledException extends RuntimeException {

    public OperationCancelledException(String message) {
        super(message);
    }

    public OperationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
