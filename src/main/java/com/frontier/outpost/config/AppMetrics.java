package com.frontier.outpost.config;

import com.frontier.outpost.model.SyncResult;
import com.frontier.outpost.model.SyncStatistics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Application metrics for outpost traffic and sync runs.
 *
 * View at: http://localhost:8080/actuator/metrics
 *
 * Key metrics:
 * - outpost.http.attempts → HTTP attempts per node (every try counts)
 * - outpost.http.retries  → Attempts that were retried after a transient failure
 * - outpost.reauth        → Transparent re-authentications per node
 * - sync.runs             → Completed sync runs, tagged by outcome
 * - sync.items            → Items processed, tagged by result (added/updated/skipped/failed)
 * - sync.duration         → Wall time of a sync run (use MEAN for avg)
 */
@Component
@Getter
public class AppMetrics {

    private final MeterRegistry registry;

    // Timers (track count, total time, max, mean)
    private final Timer syncTimer;

    // Counters
    private final Counter itemsAddedCounter;
    private final Counter itemsUpdatedCounter;
    private final Counter itemsSkippedCounter;
    private final Counter itemsFailedCounter;
    private final Counter fleetRunsCounter;

    public AppMetrics(MeterRegistry registry) {
        this.registry = registry;

        // ═══════════════════════════════════════════════════════════════
        // TIMERS - Track latency (count, total, max, mean)
        // ═══════════════════════════════════════════════════════════════

        this.syncTimer = Timer.builder("sync.duration")
                .description("Wall time of a sync run from export to last import")
                .register(registry);

        // ═══════════════════════════════════════════════════════════════
        // COUNTERS - Track counts
        // ═══════════════════════════════════════════════════════════════

        this.itemsAddedCounter = itemCounter("added");
        this.itemsUpdatedCounter = itemCounter("updated");
        this.itemsSkippedCounter = itemCounter("skipped");
        this.itemsFailedCounter = itemCounter("failed");

        this.fleetRunsCounter = Counter.builder("sync.fleet.runs")
                .description("Fleet-wide sync requests")
                .register(registry);
    }

    private Counter itemCounter(String result) {
        return Counter.builder("sync.items")
                .description("Items processed by sync runs")
                .tag("result", result)
                .register(registry);
    }

    // ═══════════════════════════════════════════════════════════════
    // PER-NODE COUNTERS
    // ═══════════════════════════════════════════════════════════════

    public void incrementHttpAttempts(String node) {
        Counter.builder("outpost.http.attempts")
                .description("HTTP attempts sent to an outpost")
                .tag("node", node)
                .register(registry)
                .increment();
    }

    public void incrementHttpRetries(String node) {
        Counter.builder("outpost.http.retries")
                .description("HTTP attempts retried after a transient failure")
                .tag("node", node)
                .register(registry)
                .increment();
    }

    public void incrementReauth(String node) {
        Counter.builder("outpost.reauth")
                .description("Transparent re-authentications")
                .tag("node", node)
                .register(registry)
                .increment();
    }

    // ═══════════════════════════════════════════════════════════════
    // SYNC RUNS
    // ═══════════════════════════════════════════════════════════════

    public void recordSync(SyncResult result, Duration elapsed) {
        syncTimer.record(elapsed);
        Counter.builder("sync.runs")
                .description("Sync runs by outcome")
                .tag("outcome", result.outcome().name())
                .tag("strategy", result.strategy().wireName())
                .register(registry)
                .increment();

        SyncStatistics stats = result.statistics();
        if (stats != null) {
            itemsAddedCounter.increment(stats.itemsAdded());
            itemsUpdatedCounter.increment(stats.itemsUpdated());
            itemsSkippedCounter.increment(stats.itemsSkipped());
            itemsFailedCounter.increment(stats.itemsFailed());
        }
    }

    public void incrementFleetRuns() {
        fleetRunsCounter.increment();
    }

    public double countOf(String name) {
        return registry.find(name).counters().stream()
                .mapToDouble(Counter::count)
                .sum();
    }
}
