package com.frontier.outpost.service.fleet;

import com.frontier.outpost.client.OutpostTransientException;
import com.frontier.outpost.client.UnknownOutpostException;
import com.frontier.outpost.model.InventoryFilter;
import com.frontier.outpost.model.InventoryItem;
import com.frontier.outpost.service.InMemoryOutpostClient;
import com.frontier.outpost.service.OutpostClientRegistry;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.frontier.outpost.service.InMemoryOutpostClient.item;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FleetInventoryServiceTest {

    private InMemoryOutpostClient fishing;
    private InMemoryOutpostClient hunting;
    private FleetInventoryService service;

    @BeforeEach
    void setUp() {
        fishing = new InMemoryOutpostClient("fishing-fort").seed(item("Salted Fish", "food", 150), item("Net", "tools", 2));
        hunting = new InMemoryOutpostClient("hunting-fort").seed(item("Beaver Pelt", "furs", 12));
        Cache<String, List<InventoryItem>> cache = Caffeine.newBuilder().maximumSize(100).recordStats().build();
        service = new FleetInventoryService(OutpostClientRegistry.of(fishing, hunting), cache);
    }

    @Test
    @DisplayName("Should serve the second read from cache")
    void shouldCacheReads() {
        // When
        List<InventoryItem> first = service.inventoryOf("fishing-fort", null);
        List<InventoryItem> second = service.inventoryOf("fishing-fort", null);

        // Then
        assertThat(second).isEqualTo(first).hasSize(2);
        assertThat(fishing.callCount("list")).isEqualTo(1);
        Map<String, Object> stats = service.cacheStats();
        assertThat(stats).containsEntry("hitCount", 1L).containsEntry("missCount", 1L);
    }

    @Test
    @DisplayName("Should cache each filter separately")
    void shouldKeyByFilter() {
        // When
        List<InventoryItem> food = service.inventoryOf("fishing-fort", new InventoryFilter("food", null, null));
        List<InventoryItem> all = service.inventoryOf("fishing-fort", InventoryFilter.none());

        // Then
        assertThat(food).extracting(InventoryItem::name).containsExactly("Salted Fish");
        assertThat(all).hasSize(2);
        assertThat(fishing.callCount("list")).isEqualTo(2);
    }

    @Test
    @DisplayName("Should reload a node after invalidation, leaving other nodes cached")
    void shouldInvalidateOneNode() {
        // Given
        service.inventoryOf("fishing-fort", null);
        service.inventoryOf("fishing-fort", new InventoryFilter("food", 1, 10));
        service.inventoryOf("hunting-fort", null);

        // When
        service.invalidate("fishing-fort");
        service.inventoryOf("fishing-fort", null);
        service.inventoryOf("hunting-fort", null);

        // Then
        assertThat(fishing.callCount("list")).isEqualTo(3);
        assertThat(hunting.callCount("list")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should not keep a listing that was loading when the node was invalidated")
    void shouldDropListingLoadedAcrossInvalidation() throws Exception {
        // Given
        CountDownLatch loading = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        fishing.beforeList(() -> {
            loading.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        CompletableFuture<List<InventoryItem>> inFlight =
                CompletableFuture.supplyAsync(() -> service.inventoryOf("fishing-fort", null));
        assertThat(loading.await(5, TimeUnit.SECONDS)).isTrue();

        // When
        service.invalidate("fishing-fort");
        release.countDown();
        inFlight.get(5, TimeUnit.SECONDS);
        fishing.beforeList(() -> { });
        service.inventoryOf("fishing-fort", null);

        // Then
        assertThat(fishing.callCount("list")).isEqualTo(2);
    }

    @Test
    @DisplayName("Should report an unreadable node in the fleet view without failing the others")
    void shouldReportUnavailableNode() {
        // Given
        hunting.failOn("list", new OutpostTransientException("hunting-fort", "list-inventory timed out"));

        // When
        Map<String, NodeInventory> fleet = service.fleetInventory();

        // Then
        assertThat(fleet).containsOnlyKeys("fishing-fort", "hunting-fort");
        assertThat(fleet.get("fishing-fort").items()).hasSize(2);
        assertThat(fleet.get("fishing-fort").error()).isNull();
        assertThat(fleet.get("hunting-fort").items()).isNull();
        assertThat(fleet.get("hunting-fort").error()).contains("timed out");
    }

    @Test
    @DisplayName("Should not cache a failed read")
    void shouldNotCacheFailures() {
        // Given
        hunting.failOn("list", new OutpostTransientException("hunting-fort", "list-inventory timed out"));
        service.fleetInventory();

        // When
        service.fleetInventory();

        // Then
        assertThat(hunting.callCount("list")).isEqualTo(2);
    }

    @Test
    @DisplayName("Should reject an unknown node")
    void shouldRejectUnknownNode() {
        assertThatThrownBy(() -> service.inventoryOf("trading-fort", null))
                .isInstanceOf(UnknownOutpostException.class);
    }
}
