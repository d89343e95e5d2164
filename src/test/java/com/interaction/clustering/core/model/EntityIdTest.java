package com.interaction.clustering.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EntityId Tests")
class EntityIdTest {

    @Test
    @DisplayName("Should render the namespace prefix")
    void rendersPrefix() {
        assertEquals("C:1234", EntityId.cardholder("1234").value());
        assertEquals("M:shop", EntityId.merchant("shop").value());
    }

    @Test
    @DisplayName("Should parse a namespaced id")
    void parsesNamespacedId() {
        EntityId id = EntityId.parse("M:42");

        assertEquals(EntityNamespace.MERCHANT, id.namespace());
        assertEquals("42", id.rawId());
    }

    @Test
    @DisplayName("Should reject an id without a known prefix")
    void rejectsUnknownPrefix() {
        assertThrows(IllegalArgumentException.class, () -> EntityId.parse("X:1"));
        assertThrows(IllegalArgumentException.class, () -> EntityId.parse("42"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "a\u0000b", "tab\tid"})
    @DisplayName("Should reject blank ids and ids with control characters")
    void rejectsInvalidRawIds(String raw) {
        assertFalse(EntityId.isValidRawId(raw));
        assertThrows(IllegalArgumentException.class, () -> EntityId.cardholder(raw));
    }

    @Test
    @DisplayName("Cardholders sort before merchants")
    void ordering() {
        assertTrue(EntityId.cardholder("9").compareTo(EntityId.merchant("1")) < 0);
        assertEquals(EntityNamespace.MERCHANT, EntityNamespace.CARDHOLDER.opposite());
    }
}
