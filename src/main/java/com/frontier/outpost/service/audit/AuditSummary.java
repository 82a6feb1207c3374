package com.frontier.outpost.service.audit;

/**
 * Totals over the runs currently retained by the audit log.
 */
public record AuditSummary(
    int totalRuns,
    int successful,
    int completedWithErrors,
    int failed,
    long itemsAdded,
    long itemsUpdated,
    long itemsSkipped,
    long itemsFailed
) {}
