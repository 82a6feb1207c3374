package com.frontier.outpost.service.fleet;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.frontier.outpost.model.InventoryItem;

import java.util.List;

/**
 * One outpost's inventory in the fleet view; {@code error} is set instead of items when it could not be read.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeInventory(
    String node,
    List<InventoryItem> items,
    String error
) {

    public static NodeInventory of(String node, List<InventoryItem> items) {
        return new NodeInventory(node, List.copyOf(items), null);
    }

    public static NodeInventory unavailable(String node, String error) {
        return new NodeInventory(node, null, error);
    }
}
