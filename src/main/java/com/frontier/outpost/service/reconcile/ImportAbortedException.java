package com.frontier.outpost.service.reconcile;

import com.frontier.outpost.model.SyncStatistics;
import lombok.Getter;

/**
 * Reconciliation stopped before every envelope item was attempted.
 * Carries the statistics of the items processed so far.
 */
@Getter
public class ImportAbortedException extends RuntimeException {

    private final SyncStatistics statistics;

    public ImportAbortedException(String message, SyncStatistics statistics, RuntimeException cause) {
        super(message, cause);
        this.statistics = statistics;
    }

    /**
     * True when the target could not be read or written at all, so no item was attempted.
     */
    public boolean beforeAnyItem() {
        return statistics.itemsAttempted() == 0;
    }
}
