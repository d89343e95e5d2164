package com.interaction.clustering.propagation;

import com.interaction.clustering.api.ClusteringOptions;
import com.interaction.clustering.cache.CachingSnapshotReader;
import com.interaction.clustering.core.model.AdjacencyEntry;
import com.interaction.clustering.core.model.ClusterAssignment;
import com.interaction.clustering.core.model.EntityNamespace;
import com.interaction.clustering.core.model.Neighbor;
import com.interaction.clustering.logging.LogContext;
import com.interaction.clustering.metrics.MetricsService;
import com.interaction.clustering.store.AdjacencyStore;
import com.interaction.clustering.store.AssignmentStore;
import com.interaction.clustering.store.SnapshotReader;
import com.interaction.clustering.store.SnapshotWriter;
import com.interaction.clustering.tracing.Span;
import com.interaction.clustering.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Weighted label propagation over the bipartite interaction graph.
 *
 * <p>Iteration k reads snapshot k-1 and commits snapshot k in two half-phases:</p>
 * <ol>
 *   <li>every cardholder adopts the heaviest cluster among its merchants' clusters in k-1,
 *       and the cardholder half of snapshot k is sealed;</li>
 *   <li>every merchant adopts the heaviest cluster among its cardholders' clusters in the
 *       sealed half of snapshot k.</li>
 * </ol>
 * <p>Ties go to the lowest cluster id. Within a half-phase entities are independent and are
 * processed in parallel; each half-phase ends with a barrier. Updating both sides from k-1 at
 * once would make labels on a bipartite graph swap sides on every iteration.</p>
 *
 * <p>Iterations stop when churn is at most the tolerance, when {@code max_iterations} is
 * reached, or when the deadline has passed once an iteration commits.</p>
 */
public class LabelPropagationEngine {
    private static final Logger log = LoggerFactory.getLogger(LabelPropagationEngine.class);

    private final ClusteringOptions options;
    private final PageDispatcher dispatcher;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final Clock clock;

    public LabelPropagationEngine(ClusteringOptions options, PageDispatcher dispatcher,
                                  MetricsService metricsService, TracingService tracingService) {
        this(options, dispatcher, metricsService, tracingService, Clock.systemUTC());
    }

    public LabelPropagationEngine(ClusteringOptions options, PageDispatcher dispatcher,
                                  MetricsService metricsService, TracingService tracingService, Clock clock) {
        this.options = options;
        this.dispatcher = dispatcher;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
        this.clock = clock;
    }

    /**
     * Runs iterations after the latest committed snapshot until convergence, the iteration
     * budget or the deadline.
     *
     * @param deadline absolute deadline, or null for none
     */
    public PropagationResult propagate(AdjacencyStore adjacency, AssignmentStore assignments,
                                       String runId, Instant deadline) {
        int start = assignments.latestIteration()
                .orElseThrow(() -> new IllegalStateException("No committed snapshot to propagate from"));
        long entities = adjacency.summary().entityCount();
        double tolerance = options.getConvergenceTolerance();
        List<IterationStats> history = new ArrayList<>();

        OptionalDouble recorded = assignments.churnOf(start);
        if (recorded.isPresent() && recorded.getAsDouble() <= tolerance) {
            log.info("propagation.already.converged snapshot={} churn={}", start, recorded.getAsDouble());
            return new PropagationResult(start, true, history, null);
        }
        if (start >= options.getMaxIterations()) {
            log.warn("propagation.skipped snapshot={} maxIterations={}", start, options.getMaxIterations());
            return nonConverged(start, history, NonConvergenceWarning.Reason.ITERATION_BUDGET,
                    recorded.orElse(Double.NaN));
        }

        for (int k = start + 1; k <= options.getMaxIterations(); k++) {
            IterationStats stats = iterate(k, adjacency, assignments, runId, entities);
            history.add(stats);
            assignments.discard(k - 1);

            if (stats.churn() <= tolerance) {
                log.info("propagation.converged iteration={} churn={}", k, stats.churn());
                return new PropagationResult(k, true, history, null);
            }
            if (deadline != null && !clock.instant().isBefore(deadline)) {
                log.warn("propagation.deadline iteration={} churn={}", k, stats.churn());
                return nonConverged(k, history, NonConvergenceWarning.Reason.DEADLINE, stats.churn());
            }
        }
        int last = options.getMaxIterations();
        log.warn("propagation.budget.exhausted iterations={} churn={}", last,
                history.get(history.size() - 1).churn());
        return nonConverged(last, history, NonConvergenceWarning.Reason.ITERATION_BUDGET,
                history.get(history.size() - 1).churn());
    }

    private PropagationResult nonConverged(int snapshot, List<IterationStats> history,
                                           NonConvergenceWarning.Reason reason, double churn) {
        metricsService.incrementNonConverged();
        NonConvergenceWarning warning = new NonConvergenceWarning(reason, snapshot, churn,
                options.getConvergenceTolerance());
        return new PropagationResult(snapshot, false, history, warning);
    }

    private IterationStats iterate(int k, AdjacencyStore adjacency, AssignmentStore assignments,
                                   String runId, long entities) {
        long startNanos = System.nanoTime();
        long cardholdersChanged;
        long merchantsChanged;
        double churn;
        try (Span span = tracingService.startIteration(runId, k);
             SnapshotReader previous = CachingSnapshotReader.wrap(
                     assignments.openSnapshot(k - 1), options.getLabelCacheSize(), metricsService);
             SnapshotWriter writer = assignments.beginSnapshot(k)) {
            try {
                try (LogContext ctx = LogContext.forIteration(runId, k, "cardholder")) {
                    cardholdersChanged = runPhase(EntityNamespace.CARDHOLDER, adjacency, previous, previous, writer);
                    writer.seal(EntityNamespace.CARDHOLDER);
                    log.debug("propagation.phase.completed changed={}", cardholdersChanged);
                }
                try (LogContext ctx = LogContext.forIteration(runId, k, "merchant");
                     SnapshotReader sealed = CachingSnapshotReader.wrap(
                             writer.sealedView(), options.getLabelCacheSize(), metricsService)) {
                    merchantsChanged = runPhase(EntityNamespace.MERCHANT, adjacency, previous, sealed, writer);
                    log.debug("propagation.phase.completed changed={}", merchantsChanged);
                }
                churn = entities == 0 ? 0.0 : (double) (cardholdersChanged + merchantsChanged) / entities;
                writer.commit(churn);
            } catch (RuntimeException e) {
                span.fail(e);
                log.error("propagation.iteration.failed iteration={} error={}", k, e.getMessage());
                throw e;
            }
            span.setAttribute("churn", churn);

            Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
            metricsService.recordStageDuration("iteration", duration);
            metricsService.recordChurn(churn);
            log.info("propagation.iteration iteration={} cardholdersChanged={} merchantsChanged={} churn={} durationMs={}",
                    k, cardholdersChanged, merchantsChanged, churn, duration.toMillis());
            return new IterationStats(k, cardholdersChanged, merchantsChanged, churn, duration.toMillis());
        }
    }

    /**
     * Recomputes the primary cluster of every entity of one side.
     *
     * @param previous  snapshot k-1, source of each entity's current assignment
     * @param neighbors snapshot holding the neighbours' labels to vote with
     * @return number of entities whose primary cluster changed
     */
    private long runPhase(EntityNamespace namespace, AdjacencyStore adjacency, SnapshotReader previous,
                          SnapshotReader neighbors, SnapshotWriter writer) {
        List<Long> changedPerPage = dispatcher.dispatch(adjacency, namespace, options.getBatchSize(), entries -> {
            List<ClusterAssignment> updated = new ArrayList<>(entries.size());
            long changed = 0;
            for (AdjacencyEntry entry : entries) {
                ClusterAssignment current = previous.get(entry.entityId())
                        .orElseGet(() -> ClusterAssignment.seed(entry.entityId(), entry.entityId()));
                ClusterAssignment next = relabel(entry, current, neighbors);
                if (!next.primaryClusterId().equals(current.primaryClusterId())) {
                    changed++;
                }
                updated.add(next);
            }
            writer.write(updated);
            return changed;
        });
        long total = 0;
        for (long c : changedPerPage) {
            total += c;
        }
        return total;
    }

    /**
     * Weighted argmax over the neighbours' clusters. Duplicates are carried over unchanged.
     */
    static ClusterAssignment relabel(AdjacencyEntry entry, ClusterAssignment current, SnapshotReader neighbors) {
        VoteTally tally = tally(entry, neighbors);
        return tally.winner()
                .map(v -> current.withPrimary(v.clusterId(), v.weight()))
                .orElse(current);
    }

    /**
     * Sums edge weights per primary cluster of the neighbours.
     */
    public static VoteTally tally(AdjacencyEntry entry, SnapshotReader neighbors) {
        VoteTally tally = new VoteTally();
        for (Neighbor n : entry.neighbors()) {
            neighbors.primaryClusterOf(n.entityId())
                    .ifPresent(cluster -> tally.add(cluster, n.weight()));
        }
        return tally;
    }
}
