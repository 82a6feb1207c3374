package com.frontier.outpost.service.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.frontier.outpost.config.JacksonConfig;
import com.frontier.outpost.model.MergeStrategy;
import com.frontier.outpost.model.SyncOutcome;
import com.frontier.outpost.model.SyncResult;
import com.frontier.outpost.model.SyncState;
import com.frontier.outpost.model.SyncStatistics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyncAuditLogTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();

    private static SyncResult completed(String id, int added, int failed) {
        SyncStatistics stats = new SyncStatistics(added, 0, 0, failed, MergeStrategy.ADD, NOW, NOW,
                failed > 0 ? List.of("Rope (tools): conflict") : List.of());
        return new SyncResult(id, "fishing-fort", "hunting-fort", MergeStrategy.ADD, SyncState.COMPLETED,
                failed > 0 ? SyncOutcome.COMPLETED_WITH_ERRORS : SyncOutcome.SUCCESS, stats, null);
    }

    private static SyncResult failed(String id) {
        return new SyncResult(id, "fishing-fort", "hunting-fort", MergeStrategy.ADD, SyncState.FAILED,
                SyncOutcome.UNREACHABLE_SOURCE, SyncStatistics.empty(MergeStrategy.ADD, NOW), "timed out");
    }

    @Test
    @DisplayName("Should return recent runs newest first, up to the limit")
    void shouldReturnNewestFirst() {
        // Given
        SyncAuditLog auditLog = new SyncAuditLog(10, "", objectMapper);
        auditLog.append(completed("a", 1, 0));
        auditLog.append(failed("b"));
        auditLog.append(completed("c", 2, 0));

        // When
        List<SyncResult> recent = auditLog.recent(2);

        // Then
        assertThat(recent).extracting(SyncResult::syncId).containsExactly("c", "b");
    }

    @Test
    @DisplayName("Should evict the oldest entries beyond capacity")
    void shouldEvictOldest() {
        // Given
        SyncAuditLog auditLog = new SyncAuditLog(2, "", objectMapper);

        // When
        auditLog.append(completed("a", 1, 0));
        auditLog.append(completed("b", 1, 0));
        auditLog.append(completed("c", 1, 0));

        // Then
        assertThat(auditLog.size()).isEqualTo(2);
        assertThat(auditLog.recent(10)).extracting(SyncResult::syncId).containsExactly("c", "b");
    }

    @Test
    @DisplayName("Should list failed runs and runs with failed items as failures")
    void shouldFilterFailures() {
        // Given
        SyncAuditLog auditLog = new SyncAuditLog(10, "", objectMapper);
        auditLog.append(completed("ok", 3, 0));
        auditLog.append(completed("partial", 1, 1));
        auditLog.append(failed("down"));

        // When
        List<SyncResult> failures = auditLog.recentFailures(10);

        // Then
        assertThat(failures).extracting(SyncResult::syncId).containsExactly("down", "partial");
    }

    @Test
    @DisplayName("Should summarize outcomes and item counts")
    void shouldSummarize() {
        // Given
        SyncAuditLog auditLog = new SyncAuditLog(10, "", objectMapper);
        auditLog.append(completed("ok", 3, 0));
        auditLog.append(completed("partial", 1, 1));
        auditLog.append(failed("down"));

        // When
        AuditSummary summary = auditLog.summary();

        // Then
        assertThat(summary.totalRuns()).isEqualTo(3);
        assertThat(summary.successful()).isEqualTo(1);
        assertThat(summary.completedWithErrors()).isEqualTo(1);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.itemsAdded()).isEqualTo(4);
        assertThat(summary.itemsFailed()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reject a non-positive limit or capacity")
    void shouldRejectBadLimits() {
        SyncAuditLog auditLog = new SyncAuditLog(10, "", objectMapper);

        assertThatThrownBy(() -> auditLog.recent(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SyncAuditLog(0, "", objectMapper)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should mirror every run to the audit file as one JSON line")
    void shouldMirrorToFile(@TempDir Path dir) throws IOException {
        // Given
        Path file = dir.resolve("sync-audit.jsonl");
        SyncAuditLog auditLog = new SyncAuditLog(1, file.toString(), objectMapper);

        // When
        auditLog.append(completed("a", 1, 0));
        auditLog.append(failed("b"));

        // Then - the file keeps what memory evicted
        List<String> lines = Files.readAllLines(file);
        assertThat(lines).hasSize(2);
        JsonNode first = objectMapper.readTree(lines.get(0));
        assertThat(first.path("sync_id").asText()).isEqualTo("a");
        assertThat(first.path("status").asText()).isEqualTo("completed");
        assertThat(first.path("statistics").path("items_added").asInt()).isEqualTo(1);
        assertThat(objectMapper.readTree(lines.get(1)).path("outcome").asText()).isEqualTo("UNREACHABLE_SOURCE");
        assertThat(auditLog.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep the in-memory entry when the audit file cannot be written")
    void shouldSurviveFileFailure(@TempDir Path dir) {
        // Given - the configured path is a directory
        SyncAuditLog auditLog = new SyncAuditLog(10, dir.toString(), objectMapper);

        // When
        auditLog.append(completed("a", 1, 0));

        // Then
        assertThat(auditLog.recent(1)).extracting(SyncResult::syncId).containsExactly("a");
    }
}
