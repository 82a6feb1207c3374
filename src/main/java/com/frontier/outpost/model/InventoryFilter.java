package com.frontier.outpost.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Query filters accepted by GET /inventory.
 */
public record InventoryFilter(
    String category,
    Integer minQuantity,
    Integer limit
) {

    public static final int MAX_LIMIT = 1000;

    public InventoryFilter {
        if (minQuantity != null && minQuantity < 0) {
            throw new IllegalArgumentException("minQuantity must be >= 0, was " + minQuantity);
        }
        if (limit != null && (limit < 1 || limit > MAX_LIMIT)) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT + ", was " + limit);
        }
    }

    public static InventoryFilter none() {
        return new InventoryFilter(null, null, null);
    }

    public static InventoryFilter limit(int limit) {
        return new InventoryFilter(null, null, limit);
    }

    /**
     * Query parameters in wire form; absent filters are omitted.
     */
    public Map<String, Object> toQueryParams() {
        Map<String, Object> params = new LinkedHashMap<>();
        if (category != null && !category.isBlank()) {
            params.put("category", category);
        }
        if (minQuantity != null) {
            params.put("min_quantity", minQuantity);
        }
        if (limit != null) {
            params.put("limit", limit);
        }
        return params;
    }
}
