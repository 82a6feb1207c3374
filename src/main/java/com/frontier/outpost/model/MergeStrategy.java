package com.frontier.outpost.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How an envelope's items are reconciled into the target inventory.
 *
 * <ul>
 *   <li>ADD: insert unmatched items, skip matched ones.</li>
 *   <li>MERGE: add the envelope quantity to matched items, insert unmatched ones.
 *       Replaying the same envelope increments again.</li>
 *   <li>REPLACE: delete the whole target inventory, then insert every envelope item.</li>
 * </ul>
 */
public enum MergeStrategy {
    ADD,
    MERGE,
    REPLACE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static MergeStrategy fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("merge strategy is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown merge strategy '" + value + "', expected add, merge or replace");
        }
    }
}
