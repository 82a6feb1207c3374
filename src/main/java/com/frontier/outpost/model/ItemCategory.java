package com.frontier.outpost.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Category vocabulary shared by the outposts.
 */
public enum ItemCategory {
    FOOD("food"),
    TOOLS("tools"),
    SUPPLIES("supplies"),
    PROVISIONS("provisions"),
    FURS("furs"),
    TRADE_GOODS("trade_goods");

    private final String wireName;

    ItemCategory(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static boolean isKnown(String category) {
        String normalized = normalize(category);
        return normalized != null && Arrays.stream(values()).anyMatch(c -> c.wireName.equals(normalized));
    }

    /**
     * Trimmed, lower-case form used when comparing categories; null stays null.
     */
    public static String normalize(String category) {
        return category != null ? category.trim().toLowerCase(Locale.ROOT) : null;
    }
}
