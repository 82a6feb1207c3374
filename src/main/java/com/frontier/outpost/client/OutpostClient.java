package com.frontier.outpost.client;

import com.frontier.outpost.model.ExportEnvelope;
import com.frontier.outpost.model.InventoryFilter;
import com.frontier.outpost.model.InventoryItem;
import com.frontier.outpost.model.InventoryItemUpdate;
import com.frontier.outpost.model.MergeStrategy;
import com.frontier.outpost.model.SyncCapabilities;
import com.frontier.outpost.model.SyncStatistics;

import java.util.List;
import java.util.Map;

/**
 * Typed operations against one outpost.
 *
 * Failures surface as {@link OutpostException} subclasses so callers can tell
 * a missing item from a rejected token from an unreachable node.
 */
public interface OutpostClient {

    String name();

    String baseUrl();

    boolean login(String username, String password);

    /**
     * Logs in with the credentials cached from configuration or an earlier login.
     * True without a new login when a valid token is already held.
     */
    boolean loginWithStoredCredentials();

    void logout();

    boolean isAuthenticated();

    List<InventoryItem> listInventory(InventoryFilter filter);

    InventoryItem getInventoryItem(String itemId);

    InventoryItem createInventoryItem(InventoryItem item);

    InventoryItem updateInventoryItem(String itemId, InventoryItemUpdate update);

    void deleteInventoryItem(String itemId);

    ExportEnvelope exportInventory();

    /**
     * Single remote bulk import. Only meaningful when {@link #supportsBulkImport()} is true.
     */
    SyncStatistics importInventory(ExportEnvelope envelope, MergeStrategy strategy);

    boolean supportsBulkImport();

    Map<String, Object> healthCheck();

    SyncCapabilities syncCapabilities();
}
