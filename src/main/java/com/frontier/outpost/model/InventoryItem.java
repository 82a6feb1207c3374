package com.frontier.outpost.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;

/**
 * Inventory item as held by one outpost.
 *
 * The item id is node-local; two outposts agree that they hold "the same" item
 * only through {@link #key()}, i.e. equal name and category.
 * Timestamps are node-set and carried as opaque strings.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InventoryItem(
    String itemId,
    String name,
    String category,
    Integer quantity,
    String unit,
    BigDecimal value,
    String description,
    String lastUpdated
) {

    /**
     * Cross-node identity of this item. The category is compared in its normalized form.
     */
    @JsonIgnore
    public ItemKey key() {
        return new ItemKey(name, ItemCategory.normalize(category));
    }

    /**
     * Copy suitable for creating the item on another node: node-local identity
     * and node-set timestamp are dropped.
     */
    public InventoryItem forTransfer() {
        return new InventoryItem(null, name, category, quantity, unit, value, description, null);
    }

    public InventoryItem withQuantity(int newQuantity) {
        return new InventoryItem(itemId, name, category, newQuantity, unit, value, description, lastUpdated);
    }

    @JsonIgnore
    public int quantityOrZero() {
        return quantity != null ? quantity : 0;
    }
}
