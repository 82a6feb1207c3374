package com.frontier.outpost.model;

/**
 * Lifecycle of one sync run.
 */
public enum SyncState {
    IDLE,
    EXPORTING,
    IMPORTING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
