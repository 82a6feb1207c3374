package com.frontier.outpost.service.fleet;

import com.frontier.outpost.client.OutpostClient;
import com.frontier.outpost.client.OutpostException;
import com.frontier.outpost.model.InventoryFilter;
import com.frontier.outpost.model.InventoryItem;
import com.frontier.outpost.service.OutpostClientRegistry;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Read-through view of every outpost's inventory.
 *
 * Strategy: "Cache-aside"
 * - Read: check cache → if miss, list from the node → populate cache
 * - Write: a sync that imported into a node invalidates all of that node's entries
 *
 * Keys carry a per-node generation. Invalidation bumps it, so a listing that was
 * still loading when the node changed lands under a key no reader asks for.
 *
 * Sync runs never read from here; they always list the live target.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FleetInventoryService {

    private final OutpostClientRegistry registry;
    private final Cache<String, List<InventoryItem>> inventoryCache;
    private final Map<String, AtomicLong> generations = new ConcurrentHashMap<>();

    /**
     * Inventory of one node, from cache when fresh.
     *
     * @throws OutpostException the node could not be read
     */
    public List<InventoryItem> inventoryOf(String node, InventoryFilter filter) {
        InventoryFilter effective = filter != null ? filter : InventoryFilter.none();
        OutpostClient client = registry.get(node);
        String key = cacheKey(node, generation(node).get(), effective);

        return inventoryCache.get(key, k -> {
            List<InventoryItem> items = List.copyOf(client.listInventory(effective));
            log.debug("Inventory cache miss for {}, loaded {} items", k, items.size());
            return items;
        });
    }

    /**
     * Every configured node's inventory keyed by node name, in configuration order.
     * A node that cannot be read is reported with its error instead of failing the whole view.
     */
    public Map<String, NodeInventory> fleetInventory() {
        Map<String, NodeInventory> fleet = new LinkedHashMap<>();
        for (OutpostClient client : registry.all()) {
            try {
                fleet.put(client.name(), NodeInventory.of(client.name(), inventoryOf(client.name(), null)));
            } catch (OutpostException e) {
                log.warn("Inventory of {} unavailable ({}): {}", client.name(), e.getFailureClass(), e.getMessage());
                fleet.put(client.name(), NodeInventory.unavailable(client.name(), e.getMessage()));
            }
        }
        return fleet;
    }

    /**
     * Drops every cached listing of the node, whatever the filter.
     */
    public void invalidate(String node) {
        long current = generation(node).incrementAndGet();
        String prefix = node + "|";
        String live = prefix + current + "|";
        inventoryCache.asMap().keySet().removeIf(key -> key.startsWith(prefix) && !key.startsWith(live));
        log.debug("Invalidated cached inventory of {} (generation {})", node, current);
    }

    public Map<String, Object> cacheStats() {
        CacheStats stats = inventoryCache.stats();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("size", inventoryCache.estimatedSize());
        out.put("hitCount", stats.hitCount());
        out.put("missCount", stats.missCount());
        out.put("hitRate", String.format("%.2f%%", stats.hitRate() * 100));
        out.put("evictionCount", stats.evictionCount());
        return out;
    }

    private AtomicLong generation(String node) {
        return generations.computeIfAbsent(node, n -> new AtomicLong());
    }

    static String cacheKey(String node, long generation, InventoryFilter filter) {
        return node + "|" + generation + "|" + filter.category() + "|" + filter.minQuantity() + "|" + filter.limit();
    }
}
