package com.frontier.outpost.controller;

import com.frontier.outpost.config.AppMetrics;
import com.frontier.outpost.model.SyncOutcome;
import com.frontier.outpost.service.fleet.FleetInventoryService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * REST endpoint for an application metrics summary.
 *
 * GET /api/metrics/summary
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
public class MetricsController {

    private final AppMetrics appMetrics;
    private final FleetInventoryService fleetInventory;

    @GetMapping("/summary")
    public Map<String, Object> getMetricsSummary() {
        Map<String, Object> response = new LinkedHashMap<>();

        response.put("timestamp", Instant.now().toString());
        response.put("syncs", getSyncMetrics());
        response.put("items", getItemMetrics());
        response.put("http", getHttpMetrics());
        response.put("inventoryCache", fleetInventory.cacheStats());

        return response;
    }

    private Map<String, Object> getSyncMetrics() {
        Map<String, Object> syncs = new LinkedHashMap<>();

        Map<String, Long> byOutcome = new LinkedHashMap<>();
        for (SyncOutcome outcome : SyncOutcome.values()) {
            double count = appMetrics.getRegistry().find("sync.runs").tag("outcome", outcome.name()).counters()
                    .stream().mapToDouble(Counter::count).sum();
            byOutcome.put(outcome.name(), (long) count);
        }
        long total = byOutcome.values().stream().mapToLong(Long::longValue).sum();
        long success = byOutcome.get(SyncOutcome.SUCCESS.name());

        syncs.put("total", total);
        syncs.put("byOutcome", byOutcome);
        syncs.put("fleetRuns", (long) appMetrics.getFleetRunsCounter().count());
        if (total > 0) {
            syncs.put("successRate", String.format("%.2f%%", ((double) success / total) * 100));
        } else {
            syncs.put("successRate", "N/A");
        }
        syncs.put("duration", getTimerStats(appMetrics.getSyncTimer()));

        return syncs;
    }

    private Map<String, Object> getItemMetrics() {
        Map<String, Object> items = new LinkedHashMap<>();
        items.put("added", (long) appMetrics.getItemsAddedCounter().count());
        items.put("updated", (long) appMetrics.getItemsUpdatedCounter().count());
        items.put("skipped", (long) appMetrics.getItemsSkippedCounter().count());
        items.put("failed", (long) appMetrics.getItemsFailedCounter().count());
        return items;
    }

    private Map<String, Object> getHttpMetrics() {
        Map<String, Object> http = new LinkedHashMap<>();
        http.put("attempts", (long) appMetrics.countOf("outpost.http.attempts"));
        http.put("retries", (long) appMetrics.countOf("outpost.http.retries"));
        http.put("reauthentications", (long) appMetrics.countOf("outpost.reauth"));
        return http;
    }

    private Map<String, Object> getTimerStats(Timer timer) {
        Map<String, Object> stats = new LinkedHashMap<>();

        long count = timer.count();
        stats.put("count", count);

        if (count > 0) {
            stats.put("totalTimeMs", String.format("%.2f", timer.totalTime(TimeUnit.MILLISECONDS)));
            stats.put("avgTimeMs", String.format("%.2f", timer.mean(TimeUnit.MILLISECONDS)));
            stats.put("maxTimeMs", String.format("%.2f", timer.max(TimeUnit.MILLISECONDS)));
        } else {
            stats.put("totalTimeMs", "0.00");
            stats.put("avgTimeMs", "N/A");
            stats.put("maxTimeMs", "N/A");
        }

        return stats;
    }
}
