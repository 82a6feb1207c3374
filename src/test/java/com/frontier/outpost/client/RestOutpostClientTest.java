package com.frontier.outpost.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.frontier.outpost.config.AppMetrics;
import com.frontier.outpost.config.JacksonConfig;
import com.frontier.outpost.config.TraceContextManager;
import com.frontier.outpost.model.ExportEnvelope;
import com.frontier.outpost.model.InventoryFilter;
import com.frontier.outpost.model.InventoryItem;
import com.frontier.outpost.model.InventoryItemUpdate;
import com.frontier.outpost.model.MergeStrategy;
import com.frontier.outpost.model.SyncStatistics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

/**
 * RestOutpostClient against a mocked fort: token handling, error surfacing and wire shapes.
 */
class RestOutpostClientTest {

    private static final String BASE_URL = "http://fort.test";
    private static final String LOGIN_URL = BASE_URL + "/auth/login";
    private static final String EXPORT_URL = BASE_URL + "/sync/export-inventory";

    private static final String ENVELOPE = """
            {"source": "fishing-fort", "exported_at": "2024-05-01T10:00:00", "exported_by": "admin",
             "items": [{"item_id": 7, "name": "Salted Fish", "category": "food", "quantity": 150, "unit": "kg", "value": 2.5}]}
            """;

    private MockRestServiceServer server;
    private RecordingSleeper sleeper;
    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private AuthSession session;
    private RestOutpostClient client;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = JacksonConfig.createObjectMapper();
        RestTemplate restTemplate = new RestTemplate(List.of(new MappingJackson2HttpMessageConverter(objectMapper)));
        server = MockRestServiceServer.bindTo(restTemplate).build();
        sleeper = new RecordingSleeper();
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        registry = new SimpleMeterRegistry();
        AppMetrics metrics = new AppMetrics(registry);
        ResilientRequestExecutor executor = new ResilientRequestExecutor(restTemplate,
                new FailureClassifier(objectMapper), sleeper, metrics);
        RetryPolicy readPolicy = new RetryPolicy(3, Duration.ofSeconds(1), 2.0);
        session = new AuthSession("fishing-fort", BASE_URL, executor, readPolicy, clock, metrics);
        client = createClient(BulkImportMode.AUTO, executor, readPolicy, objectMapper);
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    private RestOutpostClient createClient(BulkImportMode mode, ResilientRequestExecutor executor,
                                           RetryPolicy readPolicy, ObjectMapper objectMapper) {
        return new RestOutpostClient("fishing-fort", BASE_URL + "/", mode, session, executor,
                readPolicy, readPolicy.withMaxRetries(0), objectMapper);
    }

    private void expectLogin(String token, long expiresIn) {
        server.expect(requestTo(LOGIN_URL))
                .andExpect(method(HttpMethod.POST))
                .andRespond(withSuccess(AuthSessionTest.loginResponse(token, expiresIn), MediaType.APPLICATION_JSON));
    }

    // ═══════════════════════════════════════════════════════════════
    // RE-AUTHENTICATION
    // ═══════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Expired token triggers exactly one transparent re-authentication")
    void expiredTokenReauthenticatesOnce() {
        expectLogin("tok-1", 60);
        expectLogin("tok-2", 3600);
        server.expect(ExpectedCount.once(), requestTo(EXPORT_URL))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer tok-2"))
                .andRespond(withSuccess(ENVELOPE, MediaType.APPLICATION_JSON));

        assertThat(client.login("admin", "secret")).isTrue();
        clock.advance(Duration.ofMinutes(2));

        ExportEnvelope envelope = client.exportInventory();

        server.verify();
        assertThat(envelope.itemCount()).isEqualTo(1);
        assertThat(registry.get("outpost.reauth").tag("node", "fishing-fort").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Failed re-authentication surfaces an authentication error, not a transient one")
    void failedReauthenticationIsAuthenticationError() {
        expectLogin("tok-1", 60);
        server.expect(ExpectedCount.once(), requestTo(LOGIN_URL)).andRespond(withUnauthorizedRequest());

        client.login("admin", "secret");
        clock.advance(Duration.ofMinutes(2));

        assertThatThrownBy(() -> client.exportInventory())
                .isInstanceOf(OutpostAuthenticationException.class)
                .isNotInstanceOf(OutpostTransientException.class);

        // the export endpoint was never called
        server.verify();
        assertThat(client.isAuthenticated()).isFalse();
    }

    @Test
    @DisplayName("A 401 on a held token is followed by one re-login and one replay")
    void rejectedTokenIsRefreshedOnce() {
        expectLogin("tok-1", 3600);
        server.expect(requestTo(EXPORT_URL))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer tok-1"))
                .andRespond(withUnauthorizedRequest());
        expectLogin("tok-2", 3600);
        server.expect(requestTo(EXPORT_URL))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer tok-2"))
                .andRespond(withSuccess(ENVELOPE, MediaType.APPLICATION_JSON));

        client.login("admin", "secret");
        ExportEnvelope envelope = client.exportInventory();

        server.verify();
        assertThat(envelope.sourceNode()).isEqualTo("fishing-fort");
    }

    @Test
    @DisplayName("A second 401 after re-login is surfaced without another login")
    void secondRejectionIsSurfaced() {
        expectLogin("tok-1", 3600);
        server.expect(requestTo(EXPORT_URL)).andRespond(withUnauthorizedRequest());
        expectLogin("tok-2", 3600);
        server.expect(requestTo(EXPORT_URL)).andRespond(withStatus(HttpStatus.FORBIDDEN));

        client.login("admin", "secret");

        assertThatThrownBy(() -> client.exportInventory()).isInstanceOf(OutpostAuthenticationException.class);
        server.verify();
    }

    @Test
    @DisplayName("Protected call without token or credentials fails before reaching the node")
    void protectedCallWithoutCredentials() {
        assertThatThrownBy(() -> client.exportInventory())
                .isInstanceOf(OutpostAuthenticationException.class)
                .hasMessageContaining("requires authentication");

        server.verify();
    }

    // ═══════════════════════════════════════════════════════════════
    // INVENTORY
    // ═══════════════════════════════════════════════════════════════

    @Test
    @DisplayName("List sends filters as query parameters and no Authorization header")
    void listInventoryWithFilters() {
        server.expect(requestTo(BASE_URL + "/inventory?category=food&min_quantity=5&limit=10"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(headerDoesNotExist(HttpHeaders.AUTHORIZATION))
                .andRespond(withSuccess("""
                        [{"item_id": 1, "name": "Salted Fish", "category": "food", "quantity": 150,
                          "unit": "kg", "value": 2.5, "last_updated": "2024-05-01 09:00:00"}]
                        """, MediaType.APPLICATION_JSON));

        List<InventoryItem> items = client.listInventory(new InventoryFilter("food", 5, 10));

        server.verify();
        assertThat(items).hasSize(1);
        InventoryItem item = items.get(0);
        assertThat(item.itemId()).isEqualTo("1");
        assertThat(item.value()).isEqualByComparingTo(new BigDecimal("2.5"));
        assertThat(item.lastUpdated()).isEqualTo("2024-05-01 09:00:00");
    }

    @Test
    @DisplayName("Held token is attached to reads as well")
    void tokenAttachedWhenPresent() {
        expectLogin("tok-1", 3600);
        server.expect(requestTo(BASE_URL + "/inventory"))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer tok-1"))
                .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        client.login("admin", "secret");

        assertThat(client.listInventory(null)).isEmpty();
        server.verify();
    }

    @Test
    @DisplayName("404 is a not-found error, distinct from auth and transient errors")
    void notFoundIsDistinct() {
        server.expect(ExpectedCount.once(), requestTo(BASE_URL + "/inventory/99"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"detail\":\"Item 99 not found\"}"));

        assertThatThrownBy(() -> client.getInventoryItem("99"))
                .isInstanceOf(OutpostNotFoundException.class)
                .hasMessageContaining("Item 99 not found");
        server.verify();
    }

    @Test
    @DisplayName("Create is not retried on a transient failure")
    void createIsNotRetried() {
        expectLogin("tok-1", 3600);
        server.expect(ExpectedCount.once(), requestTo(BASE_URL + "/inventory"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.name").value("Rope"))
                .andExpect(jsonPath("$.item_id").doesNotExist())
                .andRespond(withServiceUnavailable());

        client.login("admin", "secret");
        InventoryItem rope = new InventoryItem("12", "Rope", "tools", 3, "coil", BigDecimal.ONE, null, "2024-01-01");

        assertThatThrownBy(() -> client.createInventoryItem(rope))
                .isInstanceOfSatisfying(OutpostTransientException.class, e -> assertThat(e.getAttempts()).isEqualTo(1));
        server.verify();
        assertThat(sleeper.delays()).isEmpty();
    }

    @Test
    @DisplayName("Update is idempotent and retried on a transient failure")
    void updateIsRetried() {
        expectLogin("tok-1", 3600);
        server.expect(requestTo(BASE_URL + "/inventory/7")).andRespond(withServerError());
        server.expect(requestTo(BASE_URL + "/inventory/7"))
                .andExpect(method(HttpMethod.PUT))
                .andExpect(jsonPath("$.quantity").value(200))
                .andExpect(jsonPath("$.name").doesNotExist())
                .andRespond(withSuccess("{\"item_id\": 7, \"name\": \"Salted Fish\", \"category\": \"food\", \"quantity\": 200}",
                        MediaType.APPLICATION_JSON));

        client.login("admin", "secret");
        InventoryItem updated = client.updateInventoryItem("7", InventoryItemUpdate.quantity(200));

        server.verify();
        assertThat(updated.quantity()).isEqualTo(200);
        assertThat(sleeper.delays()).containsExactly(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("Delete sends DELETE to the item path")
    void deleteItem() {
        expectLogin("tok-1", 3600);
        server.expect(requestTo(BASE_URL + "/inventory/7"))
                .andExpect(method(HttpMethod.DELETE))
                .andRespond(withSuccess());

        client.login("admin", "secret");
        client.deleteInventoryItem("7");

        server.verify();
    }

    // ═══════════════════════════════════════════════════════════════
    // SYNC
    // ═══════════════════════════════════════════════════════════════

    @Test
    @DisplayName("Export accepts the fort services' field names")
    void exportAcceptsFortFieldNames() {
        expectLogin("tok-1", 3600);
        server.expect(requestTo(EXPORT_URL)).andRespond(withSuccess("""
                {"source_fort": "fishing_fort", "export_timestamp": "2024-05-01T10:00:00",
                 "sync_format_version": "1.0",
                 "inventory": [{"item_id": 1, "name": "Salted Fish", "category": "food", "quantity": 150}]}
                """, MediaType.APPLICATION_JSON));

        client.login("admin", "secret");
        ExportEnvelope envelope = client.exportInventory();

        assertThat(envelope.sourceNode()).isEqualTo("fishing_fort");
        assertThat(envelope.exportedAt()).isEqualTo("2024-05-01T10:00:00");
        assertThat(envelope.syncFormatVersion()).isEqualTo("1.0");
        assertThat(envelope.items()).extracting(InventoryItem::name).containsExactly("Salted Fish");
    }

    @Test
    @DisplayName("Bulk import posts the envelope with merge_strategy and reads back statistics")
    void importInventory() {
        expectLogin("tok-1", 3600);
        server.expect(ExpectedCount.once(), requestTo(BASE_URL + "/sync/import-inventory"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.merge_strategy").value("merge"))
                .andExpect(jsonPath("$.source").value("hunting-fort"))
                .andExpect(jsonPath("$.items[0].name").value("Venison"))
                .andRespond(withSuccess("""
                        {"status": "success", "statistics": {"items_added": 1, "items_updated": 0,
                         "items_skipped": 0, "items_failed": 0}}
                        """, MediaType.APPLICATION_JSON));

        client.login("admin", "secret");
        ExportEnvelope envelope = new ExportEnvelope("hunting-fort", "2024-05-01T10:00:00", null,
                List.of(new InventoryItem(null, "Venison", "food", 20, "kg", null, null, null)), null);

        SyncStatistics stats = client.importInventory(envelope, MergeStrategy.MERGE);

        server.verify();
        assertThat(stats.itemsAdded()).isEqualTo(1);
        assertThat(stats.errors()).isEmpty();
    }

    @Test
    @DisplayName("AUTO bulk-import mode probes sync capabilities once")
    void autoModeProbesCapabilitiesOnce() {
        server.expect(ExpectedCount.once(), requestTo(BASE_URL + "/sync/status"))
                .andRespond(withSuccess("""
                        {"fort_name": "fishing_fort", "sync_enabled": true,
                         "supported_operations": ["export-inventory", "import-inventory"]}
                        """, MediaType.APPLICATION_JSON));

        assertThat(client.supportsBulkImport()).isTrue();
        assertThat(client.supportsBulkImport()).isTrue();
        server.verify();
    }

    @Test
    @DisplayName("AUTO mode falls back to item-by-item when the probe fails")
    void autoModeProbeFailure() {
        server.expect(ExpectedCount.once(), requestTo(BASE_URL + "/sync/status"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(client.supportsBulkImport()).isFalse();
        server.verify();
    }

    @Test
    @DisplayName("Current trace id is forwarded to the node")
    void forwardsTraceId() {
        MDC.put(TraceContextManager.TRACE_ID, "trace-42");
        server.expect(requestTo(BASE_URL + "/health"))
                .andExpect(header(TraceContextManager.TRACE_HEADER, "trace-42"))
                .andRespond(withSuccess("{\"status\": \"healthy\"}", MediaType.APPLICATION_JSON));

        assertThat(client.healthCheck()).containsEntry("status", "healthy");
        server.verify();
    }
}
