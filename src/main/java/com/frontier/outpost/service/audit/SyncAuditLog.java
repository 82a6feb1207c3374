package com.frontier.outpost.service.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.frontier.outpost.model.SyncOutcome;
import com.frontier.outpost.model.SyncResult;
import com.frontier.outpost.model.SyncState;
import com.frontier.outpost.model.SyncStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;

/**
 * Append-only record of sync runs.
 *
 * Keeps the most recent {@code app.audit.max-entries} results in memory, oldest
 * evicted first. When {@code app.audit.file} is set every result is also
 * appended to that file as one JSON line; that file is never truncated.
 * A failed file write is logged and does not affect the in-memory log.
 */
@Service
@Slf4j
public class SyncAuditLog {

    private final int maxEntries;
    private final Path file;
    private final ObjectMapper objectMapper;
    private final Deque<SyncResult> entries = new ArrayDeque<>();

    public SyncAuditLog(@Value("${app.audit.max-entries:500}") int maxEntries,
                        @Value("${app.audit.file:}") String file,
                        ObjectMapper objectMapper) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("app.audit.max-entries must be >= 1, was " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.file = file == null || file.isBlank() ? null : Path.of(file);
        this.objectMapper = objectMapper;
        if (this.file != null) {
            log.info("Sync audit mirrored to {}", this.file.toAbsolutePath());
        }
    }

    public void append(SyncResult result) {
        synchronized (entries) {
            entries.addLast(result);
            while (entries.size() > maxEntries) {
                entries.removeFirst();
            }
        }
        if (file != null) {
            writeLine(result);
        }
    }

    /**
     * Most recent runs, newest first.
     */
    public List<SyncResult> recent(int limit) {
        return newestFirst(limit, result -> true);
    }

    /**
     * Most recent runs that failed or completed with item failures, newest first.
     */
    public List<SyncResult> recentFailures(int limit) {
        return newestFirst(limit, SyncAuditLog::isFailure);
    }

    public AuditSummary summary() {
        List<SyncResult> snapshot;
        synchronized (entries) {
            snapshot = new ArrayList<>(entries);
        }
        int successful = 0;
        int withErrors = 0;
        int failed = 0;
        long added = 0;
        long updated = 0;
        long skipped = 0;
        long itemsFailed = 0;
        for (SyncResult result : snapshot) {
            if (result.state() == SyncState.FAILED) {
                failed++;
            } else if (result.outcome() == SyncOutcome.COMPLETED_WITH_ERRORS) {
                withErrors++;
            } else {
                successful++;
            }
            SyncStatistics stats = result.statistics();
            if (stats != null) {
                added += stats.itemsAdded();
                updated += stats.itemsUpdated();
                skipped += stats.itemsSkipped();
                itemsFailed += stats.itemsFailed();
            }
        }
        return new AuditSummary(snapshot.size(), successful, withErrors, failed, added, updated, skipped, itemsFailed);
    }

    public int size() {
        synchronized (entries) {
            return entries.size();
        }
    }

    private List<SyncResult> newestFirst(int limit, Predicate<SyncResult> filter) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, was " + limit);
        }
        List<SyncResult> out = new ArrayList<>();
        synchronized (entries) {
            Iterator<SyncResult> it = entries.descendingIterator();
            while (it.hasNext() && out.size() < limit) {
                SyncResult result = it.next();
                if (filter.test(result)) {
                    out.add(result);
                }
            }
        }
        return out;
    }

    private static boolean isFailure(SyncResult result) {
        return result.state() == SyncState.FAILED || result.outcome() == SyncOutcome.COMPLETED_WITH_ERRORS;
    }

    private void writeLine(SyncResult result) {
        try {
            String line = objectMapper.writeValueAsString(result) + System.lineSeparator();
            synchronized (file) {
                Files.writeString(file, line, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            }
        } catch (IOException e) {
            // the in-memory entry is kept; only the file mirror is behind
            log.error("Could not append sync {} to audit file {}: {}", result.syncId(), file, e.getMessage(), e);
        }
    }
}
