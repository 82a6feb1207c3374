package com.frontier.outpost.controller;

import com.frontier.outpost.client.OutpostClient;
import com.frontier.outpost.client.OutpostException;
import com.frontier.outpost.client.UnknownOutpostException;
import com.frontier.outpost.model.InventoryFilter;
import com.frontier.outpost.model.InventoryItem;
import com.frontier.outpost.model.LoginRequest;
import com.frontier.outpost.service.OutpostClientRegistry;
import com.frontier.outpost.service.fleet.FleetInventoryService;
import com.frontier.outpost.service.fleet.NodeInventory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for the configured outposts: sessions, health and inventory views.
 */
@RestController
@RequestMapping("/api/outposts")
@RequiredArgsConstructor
@Slf4j
public class OutpostController {

    private final OutpostClientRegistry registry;
    private final FleetInventoryService fleetInventory;

    /**
     * Configured outposts with their session state.
     */
    @GetMapping
    public List<Map<String, Object>> list() {
        return registry.all().stream()
                .map(client -> {
                    Map<String, Object> map = new LinkedHashMap<>();
                    map.put("name", client.name());
                    map.put("url", client.baseUrl());
                    map.put("authenticated", client.isAuthenticated());
                    return map;
                })
                .toList();
    }

    /**
     * Logs in with the supplied credentials, or with the configured ones when the body is empty.
     */
    @PostMapping("/{name}/login")
    public ResponseEntity<Map<String, Object>> login(@PathVariable String name,
                                                     @RequestBody(required = false) LoginRequest credentials) {
        OutpostClient client = registry.get(name);
        boolean authenticated = credentials != null
                ? client.login(credentials.username(), credentials.password())
                : client.loginWithStoredCredentials();
        if (!authenticated) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of(
                    "outpost", name,
                    "authenticated", false,
                    "error", "Login rejected"
            ));
        }
        return ResponseEntity.ok(Map.of("outpost", name, "authenticated", true));
    }

    @PostMapping("/{name}/logout")
    public Map<String, Object> logout(@PathVariable String name) {
        registry.get(name).logout();
        return Map.of("outpost", name, "authenticated", false);
    }

    @GetMapping("/{name}/health")
    public Map<String, Object> health(@PathVariable String name) {
        return registry.get(name).healthCheck();
    }

    /**
     * Cached inventory of every outpost.
     */
    @GetMapping("/inventory")
    public Map<String, NodeInventory> fleetInventory() {
        return fleetInventory.fleetInventory();
    }

    @GetMapping("/inventory/cache")
    public Map<String, Object> cacheStats() {
        return fleetInventory.cacheStats();
    }

    @GetMapping("/{name}/inventory")
    public List<InventoryItem> inventory(@PathVariable String name,
                                         @RequestParam(required = false) String category,
                                         @RequestParam(name = "min_quantity", required = false) Integer minQuantity,
                                         @RequestParam(required = false) Integer limit) {
        return fleetInventory.inventoryOf(name, new InventoryFilter(category, minQuantity, limit));
    }

    @ExceptionHandler(UnknownOutpostException.class)
    public ResponseEntity<Map<String, String>> unknownOutpost(UnknownOutpostException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    /**
     * The outpost itself failed; reported as a bad gateway with its failure class.
     */
    @ExceptionHandler(OutpostException.class)
    public ResponseEntity<Map<String, Object>> outpostFailure(OutpostException e) {
        log.error("Outpost {} call failed ({}): {}", e.getNode(), e.getFailureClass(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(Map.of(
                "outpost", e.getNode(),
                "failureClass", e.getFailureClass().name(),
                "attempts", e.getAttempts(),
                "error", e.getMessage()
        ));
    }
}
