package com.frontier.outpost.model;

import java.util.List;

/**
 * Response of GET /sync/status.
 */
public record SyncCapabilities(
    String fortName,
    boolean syncEnabled,
    List<String> supportedOperations
) {

    public boolean supports(String operation) {
        return syncEnabled && supportedOperations != null && supportedOperations.contains(operation);
    }
}
