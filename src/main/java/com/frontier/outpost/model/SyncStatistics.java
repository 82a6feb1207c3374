package com.frontier.outpost.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;

/**
 * Outcome counters of one sync attempt.
 */
public record SyncStatistics(
    int itemsAdded,
    int itemsUpdated,
    int itemsSkipped,
    int itemsFailed,
    MergeStrategy strategyUsed,
    Instant startedAt,
    Instant completedAt,
    List<String> errors
) {

    public SyncStatistics {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static SyncStatistics empty(MergeStrategy strategy, Instant at) {
        return new SyncStatistics(0, 0, 0, 0, strategy, at, at, List.of());
    }

    @JsonIgnore
    public boolean hasFailures() {
        return itemsFailed > 0;
    }

    @JsonIgnore
    public int itemsAttempted() {
        return itemsAdded + itemsUpdated + itemsSkipped + itemsFailed;
    }

    /**
     * Fills in fields a remote bulk import may leave out.
     */
    public SyncStatistics withDefaults(MergeStrategy strategy, Instant started, Instant completed) {
        return new SyncStatistics(itemsAdded, itemsUpdated, itemsSkipped, itemsFailed,
                strategyUsed != null ? strategyUsed : strategy,
                startedAt != null ? startedAt : started,
                completedAt != null ? completedAt : completed,
                errors);
    }
}
