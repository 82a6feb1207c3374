package com.frontier.outpost.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Final report of one sync run, as returned to callers and kept in the audit log.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncResult(
    String syncId,
    String source,
    String target,
    MergeStrategy strategy,
    SyncState state,
    SyncOutcome outcome,
    SyncStatistics statistics,
    String message
) {

    @JsonIgnore
    public boolean isCompleted() {
        return state == SyncState.COMPLETED;
    }

    /**
     * Human readable status; a run with failed items is never reported as plain success.
     */
    @JsonProperty("status")
    public String statusLabel() {
        return switch (outcome) {
            case SUCCESS -> "completed";
            case COMPLETED_WITH_ERRORS -> "completed with errors";
            case AUTH_FAILURE -> "failed: authentication";
            case UNREACHABLE_SOURCE -> "failed: source unreachable";
            case UNREACHABLE_TARGET -> "failed: target unreachable";
            case MALFORMED_ENVELOPE -> "failed: malformed envelope";
            case CANCELLED -> "cancelled";
        };
    }
}
