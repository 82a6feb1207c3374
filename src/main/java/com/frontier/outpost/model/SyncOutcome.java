package com.frontier.outpost.model;

/**
 * Result code reported to whoever asked for a sync.
 */
public enum SyncOutcome {
    SUCCESS,
    COMPLETED_WITH_ERRORS,
    AUTH_FAILURE,
    UNREACHABLE_SOURCE,
    UNREACHABLE_TARGET,
    MALFORMED_ENVELOPE,
    CANCELLED
}
