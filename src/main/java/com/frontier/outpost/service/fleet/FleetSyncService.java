package com.frontier.outpost.service.fleet;

import com.frontier.outpost.client.UnknownOutpostException;
import com.frontier.outpost.config.AppMetrics;
import com.frontier.outpost.config.TraceContextManager;
import com.frontier.outpost.model.SyncRequest;
import com.frontier.outpost.model.SyncResult;
import com.frontier.outpost.service.OutpostClientRegistry;
import com.frontier.outpost.service.SyncOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Runs several independent pairwise syncs in parallel on the sync executor.
 *
 * Each pair is a separate {@link SyncOrchestrator} run; runs share nothing but
 * the per-node auth sessions. Ordering between pairs is not defined, so a
 * caller that needs A → B before B → C must submit them separately.
 */
@Service
@Slf4j
public class FleetSyncService {

    private final SyncOrchestrator orchestrator;
    private final OutpostClientRegistry registry;
    private final AppMetrics metrics;
    private final ExecutorService executor;

    public FleetSyncService(SyncOrchestrator orchestrator,
                            OutpostClientRegistry registry,
                            AppMetrics metrics,
                            @Qualifier("syncExecutor") ExecutorService executor) {
        this.orchestrator = orchestrator;
        this.registry = registry;
        this.metrics = metrics;
        this.executor = executor;
    }

    /**
     * @return one result per request, in request order
     * @throws UnknownOutpostException   a request names an outpost that is not configured; nothing is run
     * @throws IllegalArgumentException a request is incomplete or syncs a node into itself; nothing is run
     */
    public List<SyncResult> syncAll(List<SyncRequest> requests) {
        for (SyncRequest request : requests) {
            if (request == null || request.source() == null || request.target() == null || request.strategy() == null) {
                throw new IllegalArgumentException("Every fleet sync entry needs source, target and strategy: " + request);
            }
            registry.get(request.source());
            registry.get(request.target());
            if (request.source().equals(request.target())) {
                throw new IllegalArgumentException("Source and target must differ, both are " + request.source());
            }
        }

        // every pair runs under the caller's trace, or under one started here
        boolean startedTrace = TraceContextManager.currentTraceId() == null;
        TraceContextManager.ensure();
        try {
            metrics.incrementFleetRuns();
            log.info("Fleet sync: {} pair(s)", requests.size());

            List<CompletableFuture<SyncResult>> futures = requests.stream()
                    .map(request -> CompletableFuture.supplyAsync(
                            () -> orchestrator.sync(request.source(), request.target(), request.strategy()), executor))
                    .toList();

            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            List<SyncResult> results = futures.stream().map(CompletableFuture::join).toList();
            long completed = results.stream().filter(SyncResult::isCompleted).count();
            log.info("Fleet sync finished: {}/{} pair(s) completed", completed, results.size());
            return results;
        } finally {
            if (startedTrace) {
                TraceContextManager.clear();
            }
        }
    }
}
