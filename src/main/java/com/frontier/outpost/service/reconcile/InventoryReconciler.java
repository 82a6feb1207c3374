package com.frontier.outpost.service.reconcile;

import com.frontier.outpost.client.OperationCancelledException;
import com.frontier.outpost.client.OutpostAuthenticationException;
import com.frontier.outpost.client.OutpostClient;
import com.frontier.outpost.client.OutpostConflictException;
import com.frontier.outpost.client.OutpostException;
import com.frontier.outpost.client.OutpostNotFoundException;
import com.frontier.outpost.model.ExportEnvelope;
import com.frontier.outpost.model.InventoryFilter;
import com.frontier.outpost.model.InventoryItem;
import com.frontier.outpost.model.InventoryItemUpdate;
import com.frontier.outpost.model.ItemKey;
import com.frontier.outpost.model.MergeStrategy;
import com.frontier.outpost.model.SyncStatistics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies a validated envelope to a target outpost under one {@link MergeStrategy}.
 *
 * Items are matched by name and category, never by id. The target is read once
 * up front and the local view is kept current as items are written, so an
 * envelope listing the same item twice is handled as two consecutive imports.
 * When that listing hits the limit, an item missing from it is looked up in a
 * listing of its category; if that one is full too the item fails rather than
 * risk a duplicate.
 *
 * A failure on one item is recorded and the next item is attempted. The run
 * is aborted with {@link ImportAbortedException} only when the target cannot be
 * read at all, when it rejects our credentials, or when the thread is interrupted.
 */
@Component
@Slf4j
public class InventoryReconciler {

    private final Clock clock;
    private final int listLimit;

    public InventoryReconciler(Clock clock, @Value("${app.sync.list-limit:1000}") int listLimit) {
        this.clock = clock;
        this.listLimit = listLimit;
    }

    public SyncStatistics reconcile(ExportEnvelope envelope, OutpostClient target, MergeStrategy strategy) {
        Instant startedAt = clock.instant();
        if (target.supportsBulkImport()) {
            return bulkImport(envelope, target, strategy, startedAt);
        }
        return importItemByItem(envelope, target, strategy, startedAt);
    }

    // ═══════════════════════════════════════════════════════════════
    // BULK IMPORT
    // ═══════════════════════════════════════════════════════════════

    private SyncStatistics bulkImport(ExportEnvelope envelope, OutpostClient target, MergeStrategy strategy,
                                      Instant startedAt) {
        log.info("Bulk importing {} items into {} with strategy {}", envelope.itemCount(), target.name(), strategy);
        try {
            SyncStatistics remote = target.importInventory(envelope, strategy);
            return remote.withDefaults(strategy, startedAt, clock.instant());
        } catch (OutpostConflictException e) {
            log.warn("Bulk import into {} rejected with a conflict: {}", target.name(), e.getMessage());
            return new SyncStatistics(0, 0, 0, envelope.itemCount(), strategy, startedAt, clock.instant(),
                    List.of(e.getMessage()));
        } catch (OutpostException | OperationCancelledException e) {
            throw new ImportAbortedException("Bulk import into " + target.name() + " failed",
                    SyncStatistics.empty(strategy, startedAt), e);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // ITEM BY ITEM
    // ═══════════════════════════════════════════════════════════════

    private SyncStatistics importItemByItem(ExportEnvelope envelope, OutpostClient target, MergeStrategy strategy,
                                            Instant startedAt) {
        StatisticsCollector stats = new StatisticsCollector(strategy, startedAt);

        TargetView current = new TargetView(target);
        try {
            current.load();
        } catch (OutpostException | OperationCancelledException e) {
            throw abort("Could not read inventory of " + target.name(), stats, e);
        }

        if (strategy == MergeStrategy.REPLACE) {
            clearTarget(target, current, stats);
            current.clear();
        }

        for (InventoryItem item : envelope.items()) {
            if (Thread.currentThread().isInterrupted()) {
                throw abort("Import into " + target.name() + " interrupted", stats,
                        new OperationCancelledException("import into " + target.name() + " cancelled after "
                                + stats.attempted() + " item(s)"));
            }
            try {
                apply(item, strategy, current, target, stats);
            } catch (OutpostAuthenticationException | OperationCancelledException e) {
                throw abort("Import into " + target.name() + " stopped at " + item.key(), stats, e);
            } catch (OutpostException e) {
                log.warn("Import of {} into {} failed ({}): {}", item.key(), target.name(),
                        e.getFailureClass(), e.getMessage());
                stats.failed(item.key(), e.getMessage());
            } catch (IncompleteInventoryException e) {
                log.warn("Import of {} into {} skipped: {}", item.key(), target.name(), e.getMessage());
                stats.failed(item.key(), e.getMessage());
            }
        }
        return stats.build(clock.instant());
    }

    private void apply(InventoryItem item, MergeStrategy strategy, TargetView current,
                       OutpostClient target, StatisticsCollector stats) {
        ItemKey key = item.key();

        switch (strategy) {
            case ADD -> {
                if (current.find(key) != null) {
                    log.debug("{} already on {}, skipping", key, target.name());
                    stats.skipped();
                } else {
                    create(item, current, target, stats);
                }
            }
            case MERGE -> {
                InventoryItem existing = current.find(key);
                if (existing != null) {
                    merge(item, existing, current, target, stats);
                } else {
                    create(item, current, target, stats);
                }
            }
            case REPLACE -> create(item, current, target, stats);
        }
    }

    private void create(InventoryItem item, TargetView current, OutpostClient target, StatisticsCollector stats) {
        InventoryItem created = target.createInventoryItem(item);
        current.put(item.key(), created != null ? created : item.forTransfer());
        stats.added();
    }

    private void merge(InventoryItem item, InventoryItem existing, TargetView current,
                       OutpostClient target, StatisticsCollector stats) {
        ItemKey key = item.key();
        int held = existing.quantityOrZero();
        int merged;
        try {
            merged = Math.addExact(held, item.quantityOrZero());
        } catch (ArithmeticException e) {
            stats.failed(key, "quantity overflow merging " + item.quantityOrZero() + " into " + held);
            return;
        }
        if (merged < 0) {
            stats.failed(key, "merged quantity would be negative (" + held + " + " + item.quantityOrZero() + ")");
            return;
        }
        if (existing.itemId() == null) {
            stats.failed(key, "target item has no id");
            return;
        }

        InventoryItem updated = target.updateInventoryItem(existing.itemId(), InventoryItemUpdate.quantity(merged));
        current.put(key, updated != null ? updated : existing.withQuantity(merged));
        stats.updated();
    }

    /**
     * Deletes every item the target holds. A 404 means it is already gone.
     *
     * A listing that hits the limit is deleted and the target listed again until
     * a listing comes back under the limit. If a full listing holds only items
     * whose delete already failed, the remainder is recorded as a failure.
     */
    private void clearTarget(OutpostClient target, TargetView view, StatisticsCollector stats) {
        Set<String> attempted = new HashSet<>();
        List<InventoryItem> listing = view.listed();
        boolean truncated = view.isTruncated();

        while (true) {
            List<InventoryItem> fresh = listing.stream()
                    .filter(item -> !attempted.contains(deleteKey(item)))
                    .toList();
            if (fresh.isEmpty()) {
                if (truncated) {
                    log.warn("Replace: {} still lists {} items that could not be deleted", target.name(), listing.size());
                    stats.failed("could not clear " + target.name() + ": at least " + listing.size()
                            + " undeletable items fill the listing limit, items beyond it were not deleted");
                }
                return;
            }

            log.info("Replace: deleting {} existing items from {}", fresh.size(), target.name());
            for (InventoryItem existing : fresh) {
                attempted.add(deleteKey(existing));
                try {
                    target.deleteInventoryItem(existing.itemId());
                } catch (OutpostNotFoundException e) {
                    log.debug("{} already deleted from {}", existing.key(), target.name());
                } catch (OutpostAuthenticationException | OperationCancelledException e) {
                    throw abort("Replace on " + target.name() + " stopped while deleting " + existing.key(), stats, e);
                } catch (OutpostException | IllegalArgumentException e) {
                    log.warn("Could not delete {} from {}: {}", existing.key(), target.name(), e.getMessage());
                    stats.failed(existing.key(), "delete failed: " + e.getMessage());
                }
            }
            if (!truncated) {
                return;
            }

            try {
                listing = target.listInventory(InventoryFilter.limit(listLimit));
            } catch (OutpostException | OperationCancelledException e) {
                throw abort("Replace on " + target.name() + " could not list the remaining items", stats, e);
            }
            truncated = listing.size() >= listLimit;
        }
    }

    private static String deleteKey(InventoryItem item) {
        return item.itemId() != null ? item.itemId() : "no-id:" + item.key();
    }

    private ImportAbortedException abort(String message, StatisticsCollector stats, RuntimeException cause) {
        log.warn("{}: {}", message, cause.getMessage());
        return new ImportAbortedException(message, stats.build(clock.instant()), cause);
    }

    /**
     * What this run knows of the target's inventory, keyed by name and category.
     */
    private final class TargetView {

        private final OutpostClient target;
        private final List<InventoryItem> listed = new ArrayList<>();
        private final Map<ItemKey, InventoryItem> byKey = new LinkedHashMap<>();
        private final Set<String> completeCategories = new HashSet<>();
        private boolean truncated;

        TargetView(OutpostClient target) {
            this.target = target;
        }

        void load() {
            List<InventoryItem> items = target.listInventory(InventoryFilter.limit(listLimit));
            truncated = items.size() >= listLimit;
            if (truncated) {
                log.info("Inventory of {} reached the listing limit of {}; unmatched items are looked up by category",
                        target.name(), listLimit);
            }
            listed.addAll(items);
            items.forEach(item -> byKey.putIfAbsent(item.key(), item));
        }

        /**
         * The target's item with this key, or null when the target does not hold it.
         *
         * @throws IncompleteInventoryException neither the full nor the category listing is complete
         */
        InventoryItem find(ItemKey key) {
            InventoryItem held = byKey.get(key);
            if (held != null || !truncated || completeCategories.contains(key.category())) {
                return held;
            }
            List<InventoryItem> sameCategory = target.listInventory(new InventoryFilter(key.category(), null, listLimit));
            sameCategory.forEach(item -> byKey.putIfAbsent(item.key(), item));
            if (sameCategory.size() >= listLimit) {
                held = byKey.get(key);
                if (held == null) {
                    throw new IncompleteInventoryException(target.name(), key, listLimit);
                }
                return held;
            }
            completeCategories.add(key.category());
            return byKey.get(key);
        }

        void put(ItemKey key, InventoryItem item) {
            byKey.put(key, item);
        }

        List<InventoryItem> listed() {
            return List.copyOf(listed);
        }

        boolean isTruncated() {
            return truncated;
        }

        /**
         * After a replace the target holds nothing this run still has to match.
         */
        void clear() {
            listed.clear();
            byKey.clear();
            truncated = false;
        }
    }
}
