package com.interaction.clustering.seed;

import com.interaction.clustering.TestGraphs;
import com.interaction.clustering.core.model.ClusterAssignment;
import com.interaction.clustering.core.model.InteractionRecord;
import com.interaction.clustering.store.AdjacencyStore;
import com.interaction.clustering.store.InMemoryAdjacencyStore;
import com.interaction.clustering.store.InMemoryAssignmentStore;
import com.interaction.clustering.store.SnapshotReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class SeedStageTest {

    private InMemoryAssignmentStore assignments;

    @BeforeEach
    void setUp() {
        assignments = new InMemoryAssignmentStore();
    }

    private Map<String, String> snapshotZero(List<String> entityIds) {
        Map<String, String> clusters = new TreeMap<>();
        try (SnapshotReader reader = assignments.openSnapshot(0)) {
            for (String id : entityIds) {
                ClusterAssignment a = reader.get(id).orElseThrow();
                assertFalse(a.hasDuplicates());
                assertEquals(0, a.primary().weight());
                clusters.put(id, a.primaryClusterId());
            }
        }
        return clusters;
    }

    private static final List<String> ENTITIES =
            List.of("C:C1", "C:C2", "C:C3", "M:M1", "M:M2", "M:M3", "M:M4");

    @Nested
    @DisplayName("Connected components seed")
    class Components {

        @Test
        @DisplayName("Should label each component with its smallest entity id")
        void testComponents() {
            AdjacencyStore adjacency = TestGraphs.build(new InMemoryAdjacencyStore(), TestGraphs.scenarioA());

            SeedResult result = new ConnectedComponentsSeeder(2).seed(adjacency, assignments);

            assertEquals(new SeedResult(SeedMode.COMPONENTS, 7, 2), result);
            Map<String, String> clusters = snapshotZero(ENTITIES);
            assertEquals("C:C1", clusters.get("C:C1"));
            assertEquals("C:C1", clusters.get("C:C2"));
            assertEquals("C:C1", clusters.get("M:M1"));
            assertEquals("C:C1", clusters.get("M:M2"));
            assertEquals("C:C3", clusters.get("C:C3"));
            assertEquals("C:C3", clusters.get("M:M3"));
            assertEquals("C:C3", clusters.get("M:M4"));
        }

        @Test
        @DisplayName("Should follow long chains without recursion")
        void testLongChain() {
            List<InteractionRecord> chain = new ArrayList<>();
            for (int i = 0; i < 5_000; i++) {
                chain.add(InteractionRecord.of("C" + i, "M" + i));
                chain.add(InteractionRecord.of("C" + (i + 1), "M" + i));
            }
            AdjacencyStore adjacency = TestGraphs.build(new InMemoryAdjacencyStore(), chain);

            SeedResult result = new ConnectedComponentsSeeder(64).seed(adjacency, assignments);

            assertEquals(1, result.clusters());
            assertEquals(10_001, result.entities());
        }
    }

    @Nested
    @DisplayName("Unique seed")
    class Unique {

        @Test
        @DisplayName("Should put every entity in its own cluster")
        void testUnique() {
            AdjacencyStore adjacency = TestGraphs.build(new InMemoryAdjacencyStore(), TestGraphs.scenarioA());

            SeedResult result = new UniqueSeeder(3).seed(adjacency, assignments);

            assertEquals(new SeedResult(SeedMode.UNIQUE, 7, 7), result);
            snapshotZero(ENTITIES).forEach((entity, cluster) -> assertEquals(entity, cluster));
        }
    }

    @Test
    @DisplayName("Should pick components only for graphs within the bound")
    void testSelect() {
        assertEquals(SeedMode.COMPONENTS, SeedStage.select(SeedMode.AUTO, 100, 100));
        assertEquals(SeedMode.UNIQUE, SeedStage.select(SeedMode.AUTO, 101, 100));
        assertEquals(SeedMode.UNIQUE, SeedStage.select(SeedMode.UNIQUE, 1, 100));
        assertEquals(SeedMode.COMPONENTS, SeedStage.select(SeedMode.COMPONENTS, 1_000, 100));
    }

    @Test
    @DisplayName("Should create the seeder of a concrete mode")
    void testForMode() {
        assertEquals(SeedMode.UNIQUE, SeedStage.forMode(SeedMode.UNIQUE, 10).mode());
        assertEquals(SeedMode.COMPONENTS, SeedStage.forMode(SeedMode.COMPONENTS, 10).mode());
        assertThrows(IllegalArgumentException.class, () -> SeedStage.forMode(SeedMode.AUTO, 10));
    }
}
