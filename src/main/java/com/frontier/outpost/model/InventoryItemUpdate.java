package com.frontier.outpost.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.math.BigDecimal;

/**
 * Partial update body for PUT /inventory/{id}. Null fields are left untouched by the node.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InventoryItemUpdate(
    String name,
    String category,
    Integer quantity,
    String unit,
    BigDecimal value,
    String description
) {

    public static InventoryItemUpdate quantity(int quantity) {
        return new InventoryItemUpdate(null, null, quantity, null, null, null);
    }
}
