package com.frontier.outpost.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inventory snapshot produced by POST /sync/export-inventory.
 *
 * Accepts both the compact field names and the ones emitted by the fort
 * services (source_fort, export_timestamp, inventory).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExportEnvelope(
    @JsonProperty("source") @JsonAlias({"source_fort", "source_node"}) String sourceNode,
    @JsonProperty("exported_at") @JsonAlias("export_timestamp") String exportedAt,
    @JsonProperty("exported_by") String exportedBy,
    @JsonProperty("items") @JsonAlias("inventory") List<InventoryItem> items,
    @JsonProperty("sync_format_version") String syncFormatVersion
) {

    public ExportEnvelope {
        items = items != null ? List.copyOf(items) : null;
    }

    public int itemCount() {
        return items != null ? items.size() : 0;
    }
}
