package com.frontier.outpost.service.reconcile;

import com.frontier.outpost.model.ExportEnvelope;
import com.frontier.outpost.model.InventoryItem;
import com.frontier.outpost.model.ItemCategory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Shape checks run before any write reaches the target.
 *
 * A single bad item rejects the whole envelope: importing the valid part of a
 * corrupted export would leave the target in a state no strategy describes.
 */
@Component
public class EnvelopeValidator {

    public void validate(ExportEnvelope envelope) {
        if (envelope == null) {
            throw new EnvelopeFormatException(null, "envelope is missing");
        }
        List<InventoryItem> items = envelope.items();
        if (items == null) {
            throw new EnvelopeFormatException("items", "items list is missing");
        }
        for (int i = 0; i < items.size(); i++) {
            validateItem(i, items.get(i));
        }
    }

    private void validateItem(int index, InventoryItem item) {
        String prefix = "items[" + index + "]";
        if (item == null) {
            throw new EnvelopeFormatException(prefix, "item is null");
        }
        if (item.name() == null || item.name().isBlank()) {
            throw new EnvelopeFormatException(prefix + ".name", "name must not be empty");
        }
        if (!ItemCategory.isKnown(item.category())) {
            throw new EnvelopeFormatException(prefix + ".category", "unknown category '" + item.category() + "'");
        }
        if (item.quantity() == null) {
            throw new EnvelopeFormatException(prefix + ".quantity", "quantity is missing");
        }
        if (item.quantity() < 0) {
            throw new EnvelopeFormatException(prefix + ".quantity", "quantity must be >= 0, was " + item.quantity());
        }
        if (item.value() != null && item.value().compareTo(BigDecimal.ZERO) < 0) {
            throw new EnvelopeFormatException(prefix + ".value", "value must be >= 0, was " + item.value());
        }
    }
}
