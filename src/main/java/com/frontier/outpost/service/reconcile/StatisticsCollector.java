package com.frontier.outpost.service.reconcile;

import com.frontier.outpost.model.ItemKey;
import com.frontier.outpost.model.MergeStrategy;
import com.frontier.outpost.model.SyncStatistics;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Running counters of one reconciliation. Confined to the thread driving the run.
 */
class StatisticsCollector {

    private final MergeStrategy strategy;
    private final Instant startedAt;
    private final List<String> errors = new ArrayList<>();
    private int added;
    private int updated;
    private int skipped;
    private int failed;

    StatisticsCollector(MergeStrategy strategy, Instant startedAt) {
        this.strategy = strategy;
        this.startedAt = startedAt;
    }

    void added() {
        added++;
    }

    void updated() {
        updated++;
    }

    void skipped() {
        skipped++;
    }

    void failed(ItemKey key, String reason) {
        failed++;
        errors.add(key + ": " + reason);
    }

    /**
     * A failure that belongs to the target as a whole rather than to one item.
     */
    void failed(String reason) {
        failed++;
        errors.add(reason);
    }

    int attempted() {
        return added + updated + skipped + failed;
    }

    SyncStatistics build(Instant completedAt) {
        return new SyncStatistics(added, updated, skipped, failed, strategy, startedAt, completedAt, errors);
    }
}
