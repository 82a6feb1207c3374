package com.frontier.outpost.model;

/**
 * Response of POST /sync/import-inventory.
 */
public record ImportResponse(
    String status,
    SyncStatistics statistics
) {}
