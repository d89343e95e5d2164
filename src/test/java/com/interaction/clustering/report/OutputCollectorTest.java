package com.interaction.clustering.report;

import com.interaction.clustering.TestGraphs;
import com.interaction.clustering.core.model.ClusterAssignment;
import com.interaction.clustering.core.model.ClusterMembership;
import com.interaction.clustering.core.model.ClusterRole;
import com.interaction.clustering.store.AdjacencyStore;
import com.interaction.clustering.store.AssignmentStore;
import com.interaction.clustering.store.InMemoryAdjacencyStore;
import com.interaction.clustering.store.InMemoryAssignmentStore;
import com.interaction.clustering.store.SnapshotReader;
import com.interaction.clustering.store.SnapshotWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutputCollectorTest {

    private AdjacencyStore adjacency;
    private InMemoryAssignmentStore assignments;
    private final OutputCollector collector = new OutputCollector(2);

    @BeforeEach
    void setUp() {
        adjacency = TestGraphs.build(new InMemoryAdjacencyStore(), TestGraphs.scenarioB());
        assignments = new InMemoryAssignmentStore();
    }

    private SnapshotReader resolved(ClusterAssignment m1) {
        try (SnapshotWriter writer = assignments.beginSnapshot(AssignmentStore.RESOLVED)) {
            writer.write(List.of(
                    ClusterAssignment.primaryOnly("C:C1", "M:M1", 2),
                    ClusterAssignment.primaryOnly("C:C2", "M:M3", 5),
                    ClusterAssignment.primaryOnly("C:C3", "M:M3", 2),
                    m1,
                    ClusterAssignment.primaryOnly("M:M2", "M:M1", 1),
                    ClusterAssignment.primaryOnly("M:M3", "M:M3", 6),
                    ClusterAssignment.primaryOnly("M:M4", "M:M3", 1)));
            writer.commit();
        }
        return assignments.openSnapshot(AssignmentStore.RESOLVED);
    }

    @Test
    @DisplayName("Should count the bridge edge as cross-cluster weight without duplicates")
    void testChattinessWithoutDuplicates() {
        try (SnapshotReader reader = resolved(ClusterAssignment.primaryOnly("M:M1", "M:M1", 1))) {
            CollectedStats stats = collector.collect(adjacency, reader);

            assertEquals(10, stats.totalEdgeWeight());
            assertEquals(1, stats.crossClusterWeight());
            assertEquals(0.1, stats.chattiness(), 1e-9);
        }
    }

    @Test
    @DisplayName("Should absorb the bridge edge once the merchant is duplicated")
    void testChattinessWithDuplicate() {
        ClusterAssignment m1 = new ClusterAssignment("M:M1", ClusterMembership.primary("M:M1", 1),
                List.of(ClusterMembership.duplicate("M:M3", 1)));
        try (SnapshotReader reader = resolved(m1)) {
            CollectedStats stats = collector.collect(adjacency, reader);

            assertEquals(0.0, stats.chattiness());
            assertEquals(List.of(
                    new ClusterStats("M:M1", 3, 0, 2, 1),
                    new ClusterStats("M:M3", 4, 1, 8, 1)), stats.clusters());
            assertEquals(5, stats.clusters().get(1).memberCount());
        }
    }

    @Test
    @DisplayName("Should stream rows in entity order with primaries before duplicates")
    void testRows() {
        ClusterAssignment m1 = new ClusterAssignment("M:M1", ClusterMembership.primary("M:M1", 1),
                List.of(ClusterMembership.duplicate("M:M3", 1)));
        List<AssignmentRow> rows = new ArrayList<>();
        try (SnapshotReader reader = resolved(m1)) {
            collector.forEachRow(reader, rows::add);
        }

        assertEquals(8, rows.size());
        assertEquals(new AssignmentRow("C:C1", "M:M1", ClusterRole.PRIMARY, 2), rows.get(0));
        assertEquals(new AssignmentRow("M:M1", "M:M1", ClusterRole.PRIMARY, 1), rows.get(3));
        assertEquals(new AssignmentRow("M:M1", "M:M3", ClusterRole.DUPLICATE, 1), rows.get(4));
        assertEquals("M:M4", rows.get(7).entityId());
    }

    @Test
    @DisplayName("Should report zero chattiness for an empty graph")
    void testEmptyGraph() {
        InMemoryAdjacencyStore empty = new InMemoryAdjacencyStore();
        empty.freeze();
        try (SnapshotWriter writer = assignments.beginSnapshot(AssignmentStore.RESOLVED)) {
            writer.commit();
        }
        try (SnapshotReader reader = assignments.openSnapshot(AssignmentStore.RESOLVED)) {
            CollectedStats stats = collector.collect(empty, reader);

            assertEquals(0.0, stats.chattiness());
            assertTrue(stats.clusters().isEmpty());
        }
    }
}
