package com.interaction.clustering.store;

import com.interaction.clustering.api.CursorPage;
import com.interaction.clustering.core.model.AdjacencyEntry;
import com.interaction.clustering.core.model.EntityNamespace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryAdjacencyStoreTest {

    private InMemoryAdjacencyStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryAdjacencyStore();
        store.mergeWeights(EntityNamespace.CARDHOLDER, Map.of(
                "C:C1", Map.of("M:M1", 1L, "M:M2", 2L),
                "C:C2", Map.of("M:M1", 1L),
                "C:C3", Map.of("M:M3", 4L)));
        store.mergeWeights(EntityNamespace.MERCHANT, Map.of(
                "M:M1", Map.of("C:C1", 1L, "C:C2", 1L),
                "M:M2", Map.of("C:C1", 2L),
                "M:M3", Map.of("C:C3", 4L)));
    }

    @Test
    @DisplayName("Should sum weights merged for the same edge")
    void testMergeSums() {
        store.mergeWeights(EntityNamespace.CARDHOLDER, Map.of("C:C1", Map.of("M:M1", 3L)));

        assertEquals(4, store.get("C:C1").orElseThrow().neighbors().get(0).weight());
    }

    @Test
    @DisplayName("Should clear an unfrozen store and refuse to clear a frozen one")
    void testClear() {
        store.clear();

        assertEquals(new AdjacencySummary(0, 0, 0, 0), store.summary());
        assertTrue(store.get("C:C1").isEmpty());

        store.mergeWeights(EntityNamespace.CARDHOLDER, Map.of("C:C9", Map.of("M:M9", 2L)));
        store.freeze();
        assertThrows(IllegalStateException.class, store::clear);
        assertEquals(2, store.summary().totalEdgeWeight());
    }

    @Test
    @DisplayName("Should reject keys of the other namespace")
    void testNamespaceMismatch() {
        assertThrows(IllegalArgumentException.class,
                () -> store.mergeWeights(EntityNamespace.MERCHANT, Map.of("C:C9", Map.of("M:M1", 1L))));
    }

    @Test
    @DisplayName("Should page through one namespace in id order")
    void testScanPages() {
        CursorPage<AdjacencyEntry> first = store.scan(EntityNamespace.CARDHOLDER, null, 2);
        assertEquals(List.of("C:C1", "C:C2"), first.content().stream().map(AdjacencyEntry::entityId).toList());
        assertTrue(first.hasMore());

        CursorPage<AdjacencyEntry> second = store.scan(EntityNamespace.CARDHOLDER, first.nextCursor(), 2);
        assertEquals(List.of("C:C3"), second.content().stream().map(AdjacencyEntry::entityId).toList());
        assertFalse(second.hasMore());

        List<String> merchants = new ArrayList<>();
        store.forEach(EntityNamespace.MERCHANT, 1, e -> merchants.add(e.entityId()));
        assertEquals(List.of("M:M1", "M:M2", "M:M3"), merchants);
    }

    @Test
    @DisplayName("Should summarize counts from the cardholder side")
    void testSummary() {
        AdjacencySummary summary = store.summary();

        assertEquals(new AdjacencySummary(3, 3, 4, 8), summary);
        assertEquals(6, summary.entityCount());
    }

    @Test
    @DisplayName("Should return empty for unknown entities")
    void testUnknownEntity() {
        assertTrue(store.get("C:nobody").isEmpty());
    }
}
