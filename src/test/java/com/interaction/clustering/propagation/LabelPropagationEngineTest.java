package com.interaction.clustering.propagation;

import com.interaction.clustering.TestGraphs;
import com.interaction.clustering.api.ClusteringOptions;
import com.interaction.clustering.core.model.AdjacencyEntry;
import com.interaction.clustering.core.model.ClusterAssignment;
import com.interaction.clustering.core.model.ClusterMembership;
import com.interaction.clustering.core.model.InteractionRecord;
import com.interaction.clustering.core.model.Neighbor;
import com.interaction.clustering.metrics.MetricsService;
import com.interaction.clustering.seed.UniqueSeeder;
import com.interaction.clustering.store.AdjacencyStore;
import com.interaction.clustering.store.InMemoryAdjacencyStore;
import com.interaction.clustering.store.InMemoryAssignmentStore;
import com.interaction.clustering.store.SnapshotReader;
import com.interaction.clustering.tracing.NoOpTracingService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LabelPropagationEngineTest {

    @Mock
    private MetricsService metricsService;

    private PageDispatcher dispatcher;
    private InMemoryAssignmentStore assignments;

    @BeforeEach
    void setUp() {
        dispatcher = new PageDispatcher(2);
        assignments = new InMemoryAssignmentStore();
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
    }

    private AdjacencyStore seeded(List<InteractionRecord> records) {
        AdjacencyStore adjacency = TestGraphs.build(new InMemoryAdjacencyStore(), records);
        new UniqueSeeder(2).seed(adjacency, assignments);
        return adjacency;
    }

    private LabelPropagationEngine engine(int maxIterations, Clock clock) {
        ClusteringOptions options = ClusteringOptions.builder()
                .batchSize(2)
                .maxIterations(maxIterations)
                .labelCacheSize(16)
                .build();
        return new LabelPropagationEngine(options, dispatcher, metricsService, new NoOpTracingService(), clock);
    }

    private LabelPropagationEngine engine(int maxIterations) {
        return engine(maxIterations, Clock.systemUTC());
    }

    private Map<String, String> primaries(int snapshotId) {
        try (SnapshotReader reader = assignments.openSnapshot(snapshotId)) {
            return Map.of(
                    "C:C1", reader.primaryClusterOf("C:C1").orElseThrow(),
                    "C:C2", reader.primaryClusterOf("C:C2").orElseThrow(),
                    "C:C3", reader.primaryClusterOf("C:C3").orElseThrow(),
                    "M:M1", reader.primaryClusterOf("M:M1").orElseThrow(),
                    "M:M2", reader.primaryClusterOf("M:M2").orElseThrow(),
                    "M:M3", reader.primaryClusterOf("M:M3").orElseThrow(),
                    "M:M4", reader.primaryClusterOf("M:M4").orElseThrow());
        }
    }

    @Nested
    @DisplayName("Convergence")
    class Convergence {

        @Test
        @DisplayName("Should converge on two components from singleton seeds")
        void testConvergesOnComponents() {
            AdjacencyStore adjacency = seeded(TestGraphs.scenarioA());

            PropagationResult result = engine(10).propagate(adjacency, assignments, "run-a", null);

            assertTrue(result.converged());
            assertEquals(2, result.finalSnapshot());
            assertTrue(result.nonConvergence().isEmpty());
            assertEquals(2, result.iterations().size());
            assertEquals(3, result.iterations().get(0).cardholdersChanged());
            assertEquals(2, result.iterations().get(0).merchantsChanged());
            assertEquals(0.0, result.iterations().get(1).churn());

            Map<String, String> clusters = primaries(2);
            assertEquals(Map.of(
                    "C:C1", "M:M1", "C:C2", "M:M1", "M:M1", "M:M1", "M:M2", "M:M1",
                    "C:C3", "M:M3", "M:M3", "M:M3", "M:M4", "M:M3"), clusters);
            verify(metricsService, times(2)).recordChurn(anyDouble());
            verify(metricsService, never()).incrementNonConverged();
        }

        @Test
        @DisplayName("Should let the heavy bridge pull its cardholder while the tied merchant stays")
        void testHeavyBridge() {
            AdjacencyStore adjacency = seeded(TestGraphs.scenarioB());

            PropagationResult result = engine(10).propagate(adjacency, assignments, "run-b", null);

            assertTrue(result.converged());
            Map<String, String> clusters = primaries(result.finalSnapshot());
            assertEquals("M:M1", clusters.get("C:C1"));
            assertEquals("M:M3", clusters.get("C:C2"));
            assertEquals("M:M3", clusters.get("C:C3"));
            assertEquals("M:M1", clusters.get("M:M1"));
            assertEquals("M:M1", clusters.get("M:M2"));
            assertEquals("M:M3", clusters.get("M:M3"));
            assertEquals("M:M3", clusters.get("M:M4"));
        }

        @Test
        @DisplayName("Should keep only the latest iteration snapshot")
        void testDiscardsOlderSnapshots() {
            AdjacencyStore adjacency = seeded(TestGraphs.scenarioA());

            engine(10).propagate(adjacency, assignments, "run-a", null);

            assertEquals(List.of(2), assignments.committedSnapshots());
        }

        @Test
        @DisplayName("Should produce identical snapshots on identical input")
        void testDeterministic() {
            AdjacencyStore adjacency = seeded(TestGraphs.scenarioB());
            engine(10).propagate(adjacency, assignments, "run-1", null);
            Map<String, String> first = primaries(2);

            InMemoryAssignmentStore other = new InMemoryAssignmentStore();
            new UniqueSeeder(3).seed(adjacency, other);
            new LabelPropagationEngine(ClusteringOptions.builder().batchSize(1).workerThreads(4).build(),
                    dispatcher, metricsService, new NoOpTracingService()).propagate(adjacency, other, "run-2", null);
            assignments = other;

            assertEquals(first, primaries(2));
        }
    }

    @Nested
    @DisplayName("Non-convergence")
    class NonConvergence {

        @Test
        @DisplayName("Should stop at the iteration budget with a warning")
        void testIterationBudget() {
            AdjacencyStore adjacency = seeded(TestGraphs.scenarioA());

            PropagationResult result = engine(1).propagate(adjacency, assignments, "run-c", null);

            assertFalse(result.converged());
            assertEquals(1, result.finalSnapshot());
            NonConvergenceWarning warning = result.nonConvergence().orElseThrow();
            assertEquals(NonConvergenceWarning.Reason.ITERATION_BUDGET, warning.reason());
            assertEquals(5.0 / 7.0, warning.lastChurn(), 1e-9);
            assertEquals(1, warning.iterations());
            assertTrue(warning.message().contains("budget"));
            assertEquals("M:M1", primaries(1).get("C:C2"));
            verify(metricsService).incrementNonConverged();
        }

        @Test
        @DisplayName("Should stop after the committing iteration once the deadline has passed")
        void testDeadline() {
            AdjacencyStore adjacency = seeded(TestGraphs.scenarioA());
            Instant now = Instant.parse("2024-01-01T00:00:00Z");
            Clock fixed = Clock.fixed(now, ZoneOffset.UTC);

            PropagationResult result = engine(10, fixed).propagate(adjacency, assignments, "run-d", now);

            assertFalse(result.converged());
            assertEquals(1, result.finalSnapshot());
            assertEquals(NonConvergenceWarning.Reason.DEADLINE, result.warning().reason());
            assertTrue(assignments.isCommitted(1));
        }

        @Test
        @DisplayName("Should resume from the last committed iteration up to the same budget")
        void testResume() {
            AdjacencyStore adjacency = seeded(TestGraphs.scenarioA());
            engine(1).propagate(adjacency, assignments, "run-c", null);

            PropagationResult resumed = engine(10).propagate(adjacency, assignments, "run-c", null);

            assertTrue(resumed.converged());
            assertEquals(2, resumed.finalSnapshot());
            assertEquals(1, resumed.iterations().size());
            assertEquals(2, resumed.iterations().get(0).iteration());
        }

        @Test
        @DisplayName("Should not iterate past an exhausted budget")
        void testBudgetAlreadyExhausted() {
            AdjacencyStore adjacency = seeded(TestGraphs.scenarioA());
            engine(1).propagate(adjacency, assignments, "run-c", null);

            PropagationResult again = engine(1).propagate(adjacency, assignments, "run-c", null);

            assertFalse(again.converged());
            assertEquals(1, again.finalSnapshot());
            assertTrue(again.iterations().isEmpty());
            assertEquals(5.0 / 7.0, again.warning().lastChurn(), 1e-9);
        }

        @Test
        @DisplayName("Should report a run that converged on its last allowed iteration as converged when resumed")
        void testResumeAfterConvergingOnBudget() {
            AdjacencyStore adjacency = seeded(TestGraphs.scenarioA());
            PropagationResult first = engine(2).propagate(adjacency, assignments, "run-c", null);
            assertTrue(first.converged());
            assertEquals(2, first.finalSnapshot());

            PropagationResult again = engine(2).propagate(adjacency, assignments, "run-c", null);

            assertTrue(again.converged());
            assertEquals(2, again.finalSnapshot());
            assertTrue(again.iterations().isEmpty());
            assertTrue(again.nonConvergence().isEmpty());
            verify(metricsService, never()).incrementNonConverged();
        }

        @Test
        @DisplayName("Should not iterate again after convergence even with budget left")
        void testResumeAfterConvergence() {
            AdjacencyStore adjacency = seeded(TestGraphs.scenarioA());
            engine(10).propagate(adjacency, assignments, "run-c", null);

            PropagationResult again = engine(10).propagate(adjacency, assignments, "run-c", null);

            assertTrue(again.converged());
            assertEquals(2, again.finalSnapshot());
            assertTrue(again.iterations().isEmpty());
            assertFalse(assignments.isCommitted(3));
        }

        @Test
        @DisplayName("Should require a committed snapshot to start from")
        void testNoSnapshot() {
            AdjacencyStore adjacency = TestGraphs.build(new InMemoryAdjacencyStore(), TestGraphs.scenarioA());

            assertThrows(IllegalStateException.class,
                    () -> engine(10).propagate(adjacency, assignments, "run-x", null));
        }
    }

    @Test
    @DisplayName("Should relabel to the heaviest neighbour cluster and carry duplicates")
    void testRelabel() {
        SnapshotReader neighbours = mock(SnapshotReader.class);
        when(neighbours.primaryClusterOf("C:C1")).thenReturn(Optional.of("M:M1"));
        when(neighbours.primaryClusterOf("C:C2")).thenReturn(Optional.of("M:M3"));
        when(neighbours.primaryClusterOf("C:C3")).thenReturn(Optional.of("M:M3"));
        AdjacencyEntry entry = new AdjacencyEntry("M:M9", List.of(
                new Neighbor("C:C1", 3), new Neighbor("C:C2", 1), new Neighbor("C:C3", 1)));
        ClusterAssignment current = new ClusterAssignment("M:M9",
                ClusterMembership.primary("M:M9", 0), List.of(ClusterMembership.duplicate("M:M7", 1)));

        ClusterAssignment next = LabelPropagationEngine.relabel(entry, current, neighbours);

        assertEquals("M:M1", next.primaryClusterId());
        assertEquals(3, next.primary().weight());
        assertEquals(List.of(ClusterMembership.duplicate("M:M7", 1)), next.duplicates());
    }

    @Test
    @DisplayName("Should keep the current assignment when no neighbour has a label")
    void testRelabelWithoutVotes() {
        SnapshotReader neighbours = mock(SnapshotReader.class);
        when(neighbours.primaryClusterOf("C:C1")).thenReturn(Optional.empty());
        AdjacencyEntry entry = new AdjacencyEntry("M:M9", List.of(new Neighbor("C:C1", 3)));
        ClusterAssignment current = ClusterAssignment.seed("M:M9", "M:M9");

        assertSame(current, LabelPropagationEngine.relabel(entry, current, neighbours));
    }
}
