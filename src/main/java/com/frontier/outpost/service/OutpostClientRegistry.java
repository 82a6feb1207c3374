package com.frontier.outpost.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.frontier.outpost.client.AuthSession;
import com.frontier.outpost.client.OutpostClient;
import com.frontier.outpost.client.ResilientRequestExecutor;
import com.frontier.outpost.client.RestOutpostClient;
import com.frontier.outpost.client.RetryPolicy;
import com.frontier.outpost.client.UnknownOutpostException;
import com.frontier.outpost.config.AppMetrics;
import com.frontier.outpost.config.OutpostProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One client, and one shared {@link AuthSession}, per configured outpost.
 *
 * Every sync addressing a node goes through the same client instance so that
 * concurrent runs share its token instead of logging in independently.
 */
@Component
@Slf4j
public class OutpostClientRegistry {

    private final Map<String, OutpostClient> clients;

    @Autowired
    public OutpostClientRegistry(OutpostProperties properties,
                                 ResilientRequestExecutor executor,
                                 @Qualifier("readRetryPolicy") RetryPolicy readPolicy,
                                 @Qualifier("writeRetryPolicy") RetryPolicy writePolicy,
                                 Clock clock,
                                 AppMetrics metrics,
                                 ObjectMapper objectMapper) {
        Map<String, OutpostClient> built = new LinkedHashMap<>();
        for (OutpostProperties.Node node : properties.getNodes()) {
            if (node.getName() == null || node.getName().isBlank()) {
                throw new IllegalArgumentException("Outpost without a name: " + node);
            }
            if (node.getBaseUrl() == null || node.getBaseUrl().isBlank()) {
                throw new IllegalArgumentException("Outpost " + node.getName() + " has no base-url");
            }
            if (built.containsKey(node.getName())) {
                throw new IllegalArgumentException("Outpost " + node.getName() + " is configured twice");
            }

            // login is idempotent, so it uses the read policy; 401/403 are terminal anyway
            AuthSession session = new AuthSession(node.getName(), node.getBaseUrl(), executor, readPolicy, clock, metrics);
            if (node.hasCredentials()) {
                session.rememberCredentials(node.getUsername(), node.getPassword());
            }
            built.put(node.getName(), new RestOutpostClient(node.getName(), node.getBaseUrl(), node.getBulkImport(),
                    session, executor, readPolicy, writePolicy, objectMapper));
            log.info("Registered outpost {} at {} (bulk import: {}, credentials: {})",
                    node.getName(), node.getBaseUrl(), node.getBulkImport(), node.hasCredentials() ? "yes" : "no");
        }
        this.clients = Collections.unmodifiableMap(built);
    }

    OutpostClientRegistry(List<OutpostClient> clients) {
        Map<String, OutpostClient> byName = new LinkedHashMap<>();
        clients.forEach(client -> byName.put(client.name(), client));
        this.clients = Collections.unmodifiableMap(byName);
    }

    public static OutpostClientRegistry of(OutpostClient... clients) {
        return new OutpostClientRegistry(List.of(clients));
    }

    /**
     * @throws UnknownOutpostException no outpost with that name is configured
     */
    public OutpostClient get(String name) {
        OutpostClient client = clients.get(name);
        if (client == null) {
            throw new UnknownOutpostException(name);
        }
        return client;
    }

    public boolean contains(String name) {
        return clients.containsKey(name);
    }

    public Collection<OutpostClient> all() {
        return clients.values();
    }
}
