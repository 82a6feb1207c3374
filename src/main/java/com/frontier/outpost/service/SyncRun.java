package com.frontier.outpost.service;

import com.frontier.outpost.model.MergeStrategy;
import com.frontier.outpost.model.SyncOutcome;
import com.frontier.outpost.model.SyncResult;
import com.frontier.outpost.model.SyncState;
import com.frontier.outpost.model.SyncStatistics;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.UUID;

/**
 * State of one sync run: IDLE → EXPORTING → IMPORTING → COMPLETED | FAILED.
 * EXPORTING and IMPORTING may go straight to FAILED. Not thread-safe.
 */
@Slf4j
@Getter
public class SyncRun {

    private final String syncId;
    private final String source;
    private final String target;
    private final MergeStrategy strategy;
    private final Instant startedAt;
    private SyncState state = SyncState.IDLE;

    public SyncRun(String source, String target, MergeStrategy strategy, Instant startedAt) {
        this.syncId = UUID.randomUUID().toString().substring(0, 8);
        this.source = source;
        this.target = target;
        this.strategy = strategy;
        this.startedAt = startedAt;
    }

    public void transition(SyncState next) {
        if (!allowed(state, next)) {
            throw new IllegalStateException("Sync " + syncId + " cannot move from " + state + " to " + next);
        }
        log.info("Sync {} [{} -> {}] {} -> {}", syncId, source, target, state, next);
        state = next;
    }

    public SyncResult complete(SyncStatistics statistics) {
        transition(SyncState.COMPLETED);
        SyncOutcome outcome = statistics.hasFailures() ? SyncOutcome.COMPLETED_WITH_ERRORS : SyncOutcome.SUCCESS;
        String message = statistics.hasFailures()
                ? statistics.itemsFailed() + " of " + statistics.itemsAttempted() + " item(s) failed"
                : null;
        return new SyncResult(syncId, source, target, strategy, state, outcome, statistics, message);
    }

    public SyncResult fail(SyncOutcome outcome, SyncStatistics statistics, String message) {
        transition(SyncState.FAILED);
        return new SyncResult(syncId, source, target, strategy, state, outcome, statistics, message);
    }

    private static boolean allowed(SyncState from, SyncState to) {
        return switch (from) {
            case IDLE -> to == SyncState.EXPORTING || to == SyncState.IMPORTING || to == SyncState.FAILED;
            case EXPORTING -> to == SyncState.IMPORTING || to == SyncState.FAILED;
            case IMPORTING -> to == SyncState.COMPLETED || to == SyncState.FAILED;
            case COMPLETED, FAILED -> false;
        };
    }
}
