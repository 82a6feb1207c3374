package com.frontier.outpost.service;

import com.frontier.outpost.client.OperationCancelledException;
import com.frontier.outpost.client.OutpostAuthenticationException;
import com.frontier.outpost.client.OutpostClient;
import com.frontier.outpost.client.OutpostException;
import com.frontier.outpost.client.OutpostValidationException;
import com.frontier.outpost.config.AppMetrics;
import com.frontier.outpost.model.ExportEnvelope;
import com.frontier.outpost.model.MergeStrategy;
import com.frontier.outpost.model.SyncOutcome;
import com.frontier.outpost.model.SyncResult;
import com.frontier.outpost.model.SyncState;
import com.frontier.outpost.model.SyncStatistics;
import com.frontier.outpost.service.audit.SyncAuditLog;
import com.frontier.outpost.service.fleet.FleetInventoryService;
import com.frontier.outpost.service.reconcile.EnvelopeFormatException;
import com.frontier.outpost.service.reconcile.EnvelopeValidator;
import com.frontier.outpost.service.reconcile.ImportAbortedException;
import com.frontier.outpost.service.reconcile.InventoryReconciler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Drives one source → target reconciliation.
 *
 * Pipeline:
 * 1. EXPORTING - source export (any failure ends the run as FAILED with zero statistics)
 * 2. IMPORTING - envelope validation, then {@link InventoryReconciler} against the live target
 * 3. COMPLETED once every item was attempted, even when some failed
 *
 * Every run, whatever its outcome, is returned as a {@link SyncResult}, appended
 * to the {@link SyncAuditLog} and recorded in metrics. Only an unknown outpost
 * name or a sync of a node into itself throws.
 *
 * Merge is not replay-safe: importing the same envelope twice adds its
 * quantities twice.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SyncOrchestrator {

    private final OutpostClientRegistry registry;
    private final EnvelopeValidator validator;
    private final InventoryReconciler reconciler;
    private final SyncAuditLog auditLog;
    private final FleetInventoryService fleetInventory;
    private final AppMetrics metrics;
    private final Clock clock;

    public SyncResult sync(String source, String target, MergeStrategy strategy) {
        if (source.equals(target)) {
            throw new IllegalArgumentException("Source and target must differ, both are " + source);
        }
        return sync(registry.get(source), registry.get(target), strategy);
    }

    public SyncResult sync(OutpostClient source, OutpostClient target, MergeStrategy strategy) {
        SyncRun run = new SyncRun(source.name(), target.name(), strategy, clock.instant());
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("SYNC {} START: {} -> {} | strategy: {}", run.getSyncId(), source.name(), target.name(), strategy);
        log.info("═══════════════════════════════════════════════════════════════");

        run.transition(SyncState.EXPORTING);
        ExportEnvelope envelope;
        try {
            envelope = source.exportInventory();
        } catch (OutpostAuthenticationException e) {
            return finish(run, run.fail(SyncOutcome.AUTH_FAILURE, emptyStats(run), e.getMessage()));
        } catch (OutpostValidationException e) {
            return finish(run, run.fail(SyncOutcome.MALFORMED_ENVELOPE, emptyStats(run), e.getMessage()));
        } catch (OutpostException e) {
            return finish(run, run.fail(SyncOutcome.UNREACHABLE_SOURCE, emptyStats(run), e.getMessage()));
        } catch (OperationCancelledException e) {
            return finish(run, run.fail(SyncOutcome.CANCELLED, emptyStats(run), e.getMessage()));
        }

        return importInto(run, envelope, target);
    }

    /**
     * Imports an envelope obtained elsewhere (a saved export, another process) into the target.
     */
    public SyncResult importEnvelope(ExportEnvelope envelope, String target, MergeStrategy strategy) {
        OutpostClient client = registry.get(target);
        String source = envelope != null && envelope.sourceNode() != null ? envelope.sourceNode() : "unknown";
        SyncRun run = new SyncRun(source, client.name(), strategy, clock.instant());
        log.info("SYNC {} START: import of {} item(s) from {} into {} | strategy: {}",
                run.getSyncId(), envelope != null ? envelope.itemCount() : 0, source, client.name(), strategy);
        return importInto(run, envelope, client);
    }

    private SyncResult importInto(SyncRun run, ExportEnvelope envelope, OutpostClient target) {
        try {
            validator.validate(envelope);
        } catch (EnvelopeFormatException e) {
            log.error("Sync {}: envelope rejected before import: {}", run.getSyncId(), e.getMessage());
            return finish(run, run.fail(SyncOutcome.MALFORMED_ENVELOPE, emptyStats(run), e.getMessage()));
        }

        run.transition(SyncState.IMPORTING);
        log.info("Sync {}: importing {} item(s) from {} into {}",
                run.getSyncId(), envelope.itemCount(), run.getSource(), target.name());
        try {
            SyncStatistics statistics = reconciler.reconcile(envelope, target, run.getStrategy());
            return finish(run, run.complete(statistics));
        } catch (ImportAbortedException e) {
            return finish(run, run.fail(outcomeOf(e), e.getStatistics(), e.getCause().getMessage()));
        } finally {
            fleetInventory.invalidate(target.name());
        }
    }

    private static SyncOutcome outcomeOf(ImportAbortedException e) {
        Throwable cause = e.getCause();
        if (cause instanceof OperationCancelledException) {
            return SyncOutcome.CANCELLED;
        }
        if (cause instanceof OutpostAuthenticationException) {
            return SyncOutcome.AUTH_FAILURE;
        }
        if (cause instanceof OutpostValidationException) {
            return SyncOutcome.MALFORMED_ENVELOPE;
        }
        return SyncOutcome.UNREACHABLE_TARGET;
    }

    private SyncResult finish(SyncRun run, SyncResult result) {
        Duration elapsed = Duration.between(run.getStartedAt(), clock.instant());
        metrics.recordSync(result, elapsed);
        auditLog.append(result);

        SyncStatistics stats = result.statistics();
        if (result.state() == SyncState.FAILED) {
            log.error("SYNC {} FAILED ({}) after {}ms: {}",
                    run.getSyncId(), result.outcome(), elapsed.toMillis(), result.message());
        } else {
            log.info("═══════════════════════════════════════════════════════════════");
            log.info("SYNC {} {} | Total: {}ms", run.getSyncId(), result.statusLabel().toUpperCase(), elapsed.toMillis());
            log.info("  Added: {} | Updated: {} | Skipped: {} | Failed: {}",
                    stats.itemsAdded(), stats.itemsUpdated(), stats.itemsSkipped(), stats.itemsFailed());
            log.info("═══════════════════════════════════════════════════════════════");
        }
        return result;
    }

    private SyncStatistics emptyStats(SyncRun run) {
        return new SyncStatistics(0, 0, 0, 0, run.getStrategy(), run.getStartedAt(), clock.instant(), List.of());
    }
}
