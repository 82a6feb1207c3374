package com.frontier.outpost.controller;

import com.frontier.outpost.client.UnknownOutpostException;
import com.frontier.outpost.model.ExportEnvelope;
import com.frontier.outpost.model.MergeStrategy;
import com.frontier.outpost.model.SyncOutcome;
import com.frontier.outpost.model.SyncRequest;
import com.frontier.outpost.model.SyncResult;
import com.frontier.outpost.service.SyncOrchestrator;
import com.frontier.outpost.service.audit.AuditSummary;
import com.frontier.outpost.service.audit.SyncAuditLog;
import com.frontier.outpost.service.fleet.FleetSyncService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for running syncs and reading the sync audit log.
 *
 * POST /api/sync          → one source → target run
 * POST /api/sync/import   → import a supplied envelope into a target
 * POST /api/sync/fleet    → several independent runs in parallel
 * GET  /api/sync/history  → recent runs, newest first
 * GET  /api/sync/summary  → totals over the retained runs
 * GET  /api/sync/errors   → recent failed or partially failed runs
 */
@RestController
@RequestMapping("/api/sync")
@RequiredArgsConstructor
@Slf4j
public class SyncController {

    private final SyncOrchestrator orchestrator;
    private final FleetSyncService fleetSyncService;
    private final SyncAuditLog auditLog;

    @PostMapping
    public ResponseEntity<SyncResult> sync(@Valid @RequestBody SyncRequest request) {
        SyncResult result = orchestrator.sync(request.source(), request.target(), request.strategy());
        return ResponseEntity.status(statusOf(result.outcome())).body(result);
    }

    @PostMapping("/import")
    public ResponseEntity<SyncResult> importEnvelope(@RequestParam String target,
                                                     @RequestParam(defaultValue = "merge") String strategy,
                                                     @RequestBody ExportEnvelope envelope) {
        SyncResult result = orchestrator.importEnvelope(envelope, target, MergeStrategy.fromWireName(strategy));
        return ResponseEntity.status(statusOf(result.outcome())).body(result);
    }

    /**
     * Always 200 when the runs were started; each result carries its own outcome.
     */
    @PostMapping("/fleet")
    public ResponseEntity<List<SyncResult>> syncFleet(@RequestBody List<SyncRequest> requests) {
        return ResponseEntity.ok(fleetSyncService.syncAll(requests));
    }

    @GetMapping("/history")
    public List<SyncResult> history(@RequestParam(defaultValue = "20") int limit) {
        return auditLog.recent(limit);
    }

    @GetMapping("/summary")
    public AuditSummary summary() {
        return auditLog.summary();
    }

    @GetMapping("/errors")
    public List<SyncResult> errors(@RequestParam(defaultValue = "20") int limit) {
        return auditLog.recentFailures(limit);
    }

    static HttpStatus statusOf(SyncOutcome outcome) {
        return switch (outcome) {
            case SUCCESS -> HttpStatus.OK;
            case COMPLETED_WITH_ERRORS -> HttpStatus.MULTI_STATUS;
            case AUTH_FAILURE -> HttpStatus.UNAUTHORIZED;
            case UNREACHABLE_SOURCE, UNREACHABLE_TARGET -> HttpStatus.BAD_GATEWAY;
            case MALFORMED_ENVELOPE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case CANCELLED -> HttpStatus.CONFLICT;
        };
    }

    @ExceptionHandler(UnknownOutpostException.class)
    public ResponseEntity<Map<String, String>> unknownOutpost(UnknownOutpostException e) {
        log.warn("Sync request rejected: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        log.warn("Sync request rejected: {}", e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }
}
