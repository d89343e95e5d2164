package com.interaction.clustering.duplication;

import com.interaction.clustering.TestGraphs;
import com.interaction.clustering.api.ClusteringOptions;
import com.interaction.clustering.core.model.ClusterAssignment;
import com.interaction.clustering.core.model.ClusterMembership;
import com.interaction.clustering.metrics.MetricsService;
import com.interaction.clustering.propagation.PageDispatcher;
import com.interaction.clustering.propagation.VoteTally;
import com.interaction.clustering.store.AdjacencyStore;
import com.interaction.clustering.store.AssignmentStore;
import com.interaction.clustering.store.InMemoryAdjacencyStore;
import com.interaction.clustering.store.InMemoryAssignmentStore;
import com.interaction.clustering.store.SnapshotReader;
import com.interaction.clustering.store.SnapshotWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DuplicationResolverTest {

    @Mock
    private MetricsService metricsService;

    private PageDispatcher dispatcher;
    private AdjacencyStore adjacency;
    private InMemoryAssignmentStore assignments;

    @BeforeEach
    void setUp() {
        dispatcher = new PageDispatcher(2);
        adjacency = TestGraphs.build(new InMemoryAdjacencyStore(), TestGraphs.scenarioB());
        assignments = new InMemoryAssignmentStore();
        try (SnapshotWriter writer = assignments.beginSnapshot(2)) {
            writer.write(List.of(
                    ClusterAssignment.primaryOnly("C:C1", "M:M1", 2),
                    ClusterAssignment.primaryOnly("C:C2", "M:M3", 5),
                    ClusterAssignment.primaryOnly("C:C3", "M:M3", 2),
                    ClusterAssignment.primaryOnly("M:M1", "M:M1", 1),
                    ClusterAssignment.primaryOnly("M:M2", "M:M1", 1),
                    ClusterAssignment.primaryOnly("M:M3", "M:M3", 6),
                    ClusterAssignment.primaryOnly("M:M4", "M:M3", 1)));
            writer.commit();
        }
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
    }

    private DuplicationResolver resolver(double threshold) {
        ClusteringOptions options = ClusteringOptions.builder()
                .batchSize(3)
                .duplicationThreshold(threshold)
                .build();
        return new DuplicationResolver(options, dispatcher, metricsService);
    }

    @Test
    @DisplayName("Should duplicate the evenly split merchant into the neighbouring cluster")
    void testDuplicatesBridgeMerchant() {
        DuplicationResult result = resolver(0.3).resolve(adjacency, assignments, 2);

        assertEquals(new DuplicationResult(7, 2, 1, 1), result);
        try (SnapshotReader resolved = assignments.openSnapshot(AssignmentStore.RESOLVED)) {
            ClusterAssignment m1 = resolved.get("M:M1").orElseThrow();
            assertEquals("M:M1", m1.primaryClusterId());
            assertEquals(List.of(ClusterMembership.duplicate("M:M3", 1)), m1.duplicates());
            assertFalse(resolved.get("C:C2").orElseThrow().hasDuplicates());
            assertEquals("M:M3", resolved.get("C:C2").orElseThrow().primaryClusterId());
        }
        verify(metricsService).incrementDuplicatesAdded(1);
    }

    @Test
    @DisplayName("Should duplicate the cardholder too when the threshold admits its minority share")
    void testLowThreshold() {
        DuplicationResult result = resolver(0.1).resolve(adjacency, assignments, 2);

        assertEquals(2, result.duplicatedEntities());
        try (SnapshotReader resolved = assignments.openSnapshot(AssignmentStore.RESOLVED)) {
            assertEquals(List.of(ClusterMembership.duplicate("M:M1", 1)),
                    resolved.get("C:C2").orElseThrow().duplicates());
        }
    }

    @Test
    @DisplayName("Should leave the final iteration snapshot untouched")
    void testSourceSnapshotUnchanged() {
        resolver(0.3).resolve(adjacency, assignments, 2);

        try (SnapshotReader source = assignments.openSnapshot(2)) {
            assertFalse(source.get("M:M1").orElseThrow().hasDuplicates());
        }
        assertEquals(List.of(2, AssignmentStore.RESOLVED), assignments.committedSnapshots());
    }

    @Test
    @DisplayName("Should replace a previously resolved snapshot")
    void testResolveTwice() {
        resolver(0.1).resolve(adjacency, assignments, 2);

        DuplicationResult again = resolver(0.3).resolve(adjacency, assignments, 2);

        assertEquals(1, again.duplicatesAdded());
        try (SnapshotReader resolved = assignments.openSnapshot(AssignmentStore.RESOLVED)) {
            assertFalse(resolved.get("C:C2").orElseThrow().hasDuplicates());
        }
    }

    @Test
    @DisplayName("Should never duplicate into the primary cluster")
    void testDuplicatesFor() {
        VoteTally tally = new VoteTally();
        tally.add("M:M1", 4);
        tally.add("M:M3", 3);
        tally.add("M:M5", 1);

        List<ClusterMembership> duplicates = DuplicationResolver.duplicatesFor("M:M1", tally, 0.3);

        assertEquals(List.of(ClusterMembership.duplicate("M:M3", 3)), duplicates);
        assertTrue(DuplicationResolver.duplicatesFor("M:M1", new VoteTally(), 0.3).isEmpty());
        assertEquals(List.of(ClusterMembership.duplicate("M:M1", 4), ClusterMembership.duplicate("M:M5", 1)),
                DuplicationResolver.duplicatesFor("M:M3", tally, 0.125));
    }
}
