package com.frontier.outpost.service.reconcile;

import com.frontier.outpost.model.ExportEnvelope;
import com.frontier.outpost.model.InventoryItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvelopeValidatorTest {

    private final EnvelopeValidator validator = new EnvelopeValidator();

    private static ExportEnvelope envelopeOf(InventoryItem... items) {
        return new ExportEnvelope("fishing-fort", "2024-05-01T10:00:00", "admin", List.of(items), "1.0");
    }

    private static InventoryItem item(String name, String category, Integer quantity, BigDecimal value) {
        return new InventoryItem(null, name, category, quantity, "kg", value, null, null);
    }

    @Test
    @DisplayName("Accepts well-formed items, including an empty list")
    void acceptsValidEnvelope() {
        assertThatCode(() -> validator.validate(envelopeOf(
                item("Salted Fish", "food", 150, new BigDecimal("2.50")),
                item("Rope", "tools", 0, null))))
                .doesNotThrowAnyException();
        assertThatCode(() -> validator.validate(envelopeOf())).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Rejects a missing envelope or items list")
    void rejectsMissingParts() {
        assertThatThrownBy(() -> validator.validate(null)).isInstanceOf(EnvelopeFormatException.class);
        assertThatThrownBy(() -> validator.validate(new ExportEnvelope("fishing-fort", null, null, null, null)))
                .isInstanceOf(EnvelopeFormatException.class)
                .hasFieldOrPropertyWithValue("field", "items");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "  "})
    @DisplayName("Rejects a blank item name")
    void rejectsBlankName(String name) {
        assertThatThrownBy(() -> validator.validate(envelopeOf(item(name, "food", 1, null))))
                .isInstanceOf(EnvelopeFormatException.class)
                .hasFieldOrPropertyWithValue("field", "items[0].name");
    }

    @Test
    @DisplayName("Rejects a category outside the shared vocabulary")
    void rejectsUnknownCategory() {
        assertThatThrownBy(() -> validator.validate(envelopeOf(
                item("Salted Fish", "food", 1, null),
                item("Musket", "weapons", 1, null))))
                .isInstanceOf(EnvelopeFormatException.class)
                .hasFieldOrPropertyWithValue("field", "items[1].category")
                .hasMessageContaining("weapons");
    }

    @Test
    @DisplayName("Rejects a missing or negative quantity")
    void rejectsBadQuantity() {
        assertThatThrownBy(() -> validator.validate(envelopeOf(item("Rope", "tools", null, null))))
                .hasFieldOrPropertyWithValue("field", "items[0].quantity");
        assertThatThrownBy(() -> validator.validate(envelopeOf(item("Rope", "tools", -1, null))))
                .hasFieldOrPropertyWithValue("field", "items[0].quantity")
                .hasMessageContaining("-1");
    }

    @Test
    @DisplayName("Rejects a negative value")
    void rejectsNegativeValue() {
        assertThatThrownBy(() -> validator.validate(envelopeOf(item("Rope", "tools", 1, new BigDecimal("-0.01")))))
                .hasFieldOrPropertyWithValue("field", "items[0].value");
    }
}
