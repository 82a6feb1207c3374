package com.frontier.outpost.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.frontier.outpost.config.TraceContextManager;
import com.frontier.outpost.model.AuthToken;
import com.frontier.outpost.model.ExportEnvelope;
import com.frontier.outpost.model.ImportResponse;
import com.frontier.outpost.model.InventoryFilter;
import com.frontier.outpost.model.InventoryItem;
import com.frontier.outpost.model.InventoryItemUpdate;
import com.frontier.outpost.model.MergeStrategy;
import com.frontier.outpost.model.SyncCapabilities;
import com.frontier.outpost.model.SyncStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link OutpostClient} over an outpost's REST surface.
 *
 * Every call goes through the {@link ResilientRequestExecutor}. Protected calls
 * need a token from the shared {@link AuthSession}; when it is missing, expired
 * or rejected by the node the client re-authenticates with cached credentials
 * exactly once per call before giving up with {@link OutpostAuthenticationException}.
 */
@Slf4j
public class RestOutpostClient implements OutpostClient {

    static final String INVENTORY_PATH = "/inventory";
    static final String EXPORT_PATH = "/sync/export-inventory";
    static final String IMPORT_PATH = "/sync/import-inventory";
    static final String SYNC_STATUS_PATH = "/sync/status";
    static final String HEALTH_PATH = "/health";
    static final String IMPORT_OPERATION = "import-inventory";

    private final String name;
    private final String baseUrl;
    private final BulkImportMode bulkImportMode;
    private final AuthSession session;
    private final ResilientRequestExecutor executor;
    private final RetryPolicy readPolicy;
    private final RetryPolicy writePolicy;
    private final ObjectMapper objectMapper;

    private volatile Boolean bulkImportProbe;

    public RestOutpostClient(String name, String baseUrl, BulkImportMode bulkImportMode, AuthSession session,
                             ResilientRequestExecutor executor, RetryPolicy readPolicy, RetryPolicy writePolicy,
                             ObjectMapper objectMapper) {
        this.name = name;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.bulkImportMode = bulkImportMode;
        this.session = session;
        this.executor = executor;
        this.readPolicy = readPolicy;
        this.writePolicy = writePolicy;
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String baseUrl() {
        return baseUrl;
    }

    public AuthSession session() {
        return session;
    }

    // ═══════════════════════════════════════════════════════════════
    // AUTHENTICATION
    // ═══════════════════════════════════════════════════════════════

    @Override
    public boolean login(String username, String password) {
        return session.authenticate(username, password);
    }

    @Override
    public boolean loginWithStoredCredentials() {
        return session.reauthenticate(null);
    }

    @Override
    public void logout() {
        session.clear();
    }

    @Override
    public boolean isAuthenticated() {
        return session.currentToken().isPresent();
    }

    // ═══════════════════════════════════════════════════════════════
    // INVENTORY
    // ═══════════════════════════════════════════════════════════════

    @Override
    public List<InventoryItem> listInventory(InventoryFilter filter) {
        InventoryFilter effective = filter != null ? filter : InventoryFilter.none();
        List<InventoryItem> items = call(
                OutpostRequest.read("list-inventory", INVENTORY_PATH, effective.toQueryParams(), false),
                new ParameterizedTypeReference<List<InventoryItem>>() {});
        return items != null ? items : List.of();
    }

    @Override
    public InventoryItem getInventoryItem(String itemId) {
        return call(OutpostRequest.read("get-inventory-item", itemPath(itemId)),
                new ParameterizedTypeReference<InventoryItem>() {});
    }

    /**
     * Not retried on transient failure: a lost response would otherwise insert the item twice.
     */
    @Override
    public InventoryItem createInventoryItem(InventoryItem item) {
        return call(OutpostRequest.write("create-inventory-item", HttpMethod.POST, INVENTORY_PATH,
                        item.forTransfer(), false),
                new ParameterizedTypeReference<InventoryItem>() {});
    }

    @Override
    public InventoryItem updateInventoryItem(String itemId, InventoryItemUpdate update) {
        return call(OutpostRequest.write("update-inventory-item", HttpMethod.PUT, itemPath(itemId), update, true),
                new ParameterizedTypeReference<InventoryItem>() {});
    }

    @Override
    public void deleteInventoryItem(String itemId) {
        call(OutpostRequest.write("delete-inventory-item", HttpMethod.DELETE, itemPath(itemId), null, true),
                new ParameterizedTypeReference<Void>() {});
    }

    // ═══════════════════════════════════════════════════════════════
    // SYNC
    // ═══════════════════════════════════════════════════════════════

    @Override
    public ExportEnvelope exportInventory() {
        ExportEnvelope envelope = call(
                OutpostRequest.write("export-inventory", HttpMethod.POST, EXPORT_PATH, null, true),
                new ParameterizedTypeReference<ExportEnvelope>() {});
        if (envelope == null) {
            throw new OutpostValidationException(name, 1, null, "export-inventory on " + name + " returned an empty body", null);
        }
        log.info("Exported {} items from {}", envelope.itemCount(), name);
        return envelope;
    }

    @Override
    public SyncStatistics importInventory(ExportEnvelope envelope, MergeStrategy strategy) {
        Map<String, Object> body = objectMapper.convertValue(envelope, new TypeReference<Map<String, Object>>() {});
        body.put("merge_strategy", strategy.wireName());

        ImportResponse response = call(
                OutpostRequest.write("import-inventory", HttpMethod.POST, IMPORT_PATH, body, false),
                new ParameterizedTypeReference<ImportResponse>() {});
        if (response == null || response.statistics() == null) {
            throw new OutpostValidationException(name, 1, "statistics",
                    "import-inventory on " + name + " returned no statistics", null);
        }
        return response.statistics();
    }

    @Override
    public boolean supportsBulkImport() {
        return switch (bulkImportMode) {
            case ENABLED -> true;
            case DISABLED -> false;
            case AUTO -> probeBulkImport();
        };
    }

    private boolean probeBulkImport() {
        Boolean probe = bulkImportProbe;
        if (probe != null) {
            return probe;
        }
        try {
            probe = syncCapabilities().supports(IMPORT_OPERATION);
            bulkImportProbe = probe;
            log.info("{} bulk import support: {}", name, probe);
            return probe;
        } catch (OutpostException e) {
            log.warn("Could not read sync capabilities of {}, importing item by item: {}", name, e.getMessage());
            return false;
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // STATUS
    // ═══════════════════════════════════════════════════════════════

    @Override
    public Map<String, Object> healthCheck() {
        Map<String, Object> health = call(OutpostRequest.read("health", HEALTH_PATH),
                new ParameterizedTypeReference<Map<String, Object>>() {});
        return health != null ? health : Map.of();
    }

    @Override
    public SyncCapabilities syncCapabilities() {
        SyncCapabilities capabilities = call(OutpostRequest.read("sync-status", SYNC_STATUS_PATH),
                new ParameterizedTypeReference<SyncCapabilities>() {});
        return capabilities != null ? capabilities : new SyncCapabilities(name, false, List.of());
    }

    // ═══════════════════════════════════════════════════════════════
    // CALL PIPELINE
    // ═══════════════════════════════════════════════════════════════

    private <T> T call(OutpostRequest request, ParameterizedTypeReference<T> responseType) {
        boolean reauthenticated = false;
        Optional<AuthToken> token = session.currentToken();

        if (request.authenticated() && token.isEmpty()) {
            token = reauthenticateOnce(null, request);
            reauthenticated = true;
        }

        try {
            return send(request, token, responseType);
        } catch (OutpostAuthenticationException e) {
            if (reauthenticated || !session.hasCredentials()) {
                throw e;
            }
            log.warn("{} on {} was rejected with the current token, re-authenticating once", request.operation(), name);
            session.clear();
            Optional<AuthToken> refreshed = reauthenticateOnce(token.orElse(null), request);
            return send(request, refreshed, responseType);
        }
    }

    private Optional<AuthToken> reauthenticateOnce(AuthToken stale, OutpostRequest request) {
        if (!session.reauthenticate(stale)) {
            throw new OutpostAuthenticationException(name,
                    request.operation() + " on " + name + " requires authentication and re-authentication failed");
        }
        return session.currentToken();
    }

    private <T> T send(OutpostRequest request, Optional<AuthToken> token, ParameterizedTypeReference<T> responseType) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (request.body() != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        token.ifPresent(t -> headers.setBearerAuth(t.value()));
        String traceId = TraceContextManager.currentTraceId();
        if (traceId != null) {
            headers.set(TraceContextManager.TRACE_HEADER, traceId);
        }

        RetryPolicy policy = request.idempotent() ? readPolicy : writePolicy;
        return executor.execute(name, request.operation(), request.method(), uriFor(request),
                new HttpEntity<>(request.body(), headers), responseType, policy).getBody();
    }

    private URI uriFor(OutpostRequest request) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl).path(request.path());
        request.queryParams().forEach((key, value) -> builder.queryParam(key, value));
        return builder.encode().build().toUri();
    }

    private static String itemPath(String itemId) {
        if (itemId == null || itemId.isBlank()) {
            throw new IllegalArgumentException("itemId is required");
        }
        return INVENTORY_PATH + "/" + itemId;
    }
}
