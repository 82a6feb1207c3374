package com.frontier.outpost.client;

/**
 * Whether syncs into a node use its POST /sync/import-inventory endpoint.
 * AUTO asks the node's /sync/status once.
 */
public enum BulkImportMode {
    AUTO,
    ENABLED,
    DISABLED
}
