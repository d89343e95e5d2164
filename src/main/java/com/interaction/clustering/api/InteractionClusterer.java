package com.interaction.clustering.api;

import com.interaction.clustering.adjacency.AdjacencyBuilder;
import com.interaction.clustering.adjacency.AdjacencyStats;
import com.interaction.clustering.bulk.InteractionSource;
import com.interaction.clustering.bulk.ProgressCallback;
import com.interaction.clustering.cache.CachingSnapshotReader;
import com.interaction.clustering.duplication.DuplicationResolver;
import com.interaction.clustering.duplication.DuplicationResult;
import com.interaction.clustering.logging.LogContext;
import com.interaction.clustering.metrics.MetricsService;
import com.interaction.clustering.metrics.NoOpMetricsService;
import com.interaction.clustering.propagation.LabelPropagationEngine;
import com.interaction.clustering.propagation.PageDispatcher;
import com.interaction.clustering.propagation.PropagationResult;
import com.interaction.clustering.report.ClusteringReport;
import com.interaction.clustering.report.CollectedStats;
import com.interaction.clustering.report.OutputCollector;
import com.interaction.clustering.seed.SeedMode;
import com.interaction.clustering.seed.SeedResult;
import com.interaction.clustering.seed.SeedStage;
import com.interaction.clustering.store.AdjacencyStore;
import com.interaction.clustering.store.AssignmentStore;
import com.interaction.clustering.store.InMemoryAdjacencyStore;
import com.interaction.clustering.store.InMemoryAssignmentStore;
import com.interaction.clustering.store.RocksDbStorage;
import com.interaction.clustering.store.SnapshotReader;
import com.interaction.clustering.store.StorageRetry;
import com.interaction.clustering.tracing.NoOpTracingService;
import com.interaction.clustering.tracing.Span;
import com.interaction.clustering.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Supplier;

/**
 * Main entry point of the clustering library.
 * Runs the pipeline ingest, seed, propagate, resolve and collect over one pair of stores.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * try (InteractionClusterer clusterer = InteractionClusterer.builder()
 *         .options(ClusteringOptions.load(Path.of("clustering.properties")))
 *         .rocksDb(Path.of("/var/lib/clustering"))
 *         .build();
 *      CsvInteractionSource source = CsvInteractionSource.open(Path.of("transactions.csv"))) {
 *     ClusteringResult result = clusterer.run(source);
 *     result.exportCsv(Path.of("assignments.csv"), null);
 *     result.writeReport(Path.of("report.json"));
 * }
 * </pre>
 *
 * <p>With a persistent store, a run interrupted after seeding can be continued from its
 * latest committed snapshot with {@link #resume()}.</p>
 */
public class InteractionClusterer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(InteractionClusterer.class);

    private final ClusteringOptions options;
    private final AdjacencyStore adjacency;
    private final AssignmentStore assignments;
    private final RocksDbStorage ownedStorage;
    private final boolean ownsStores;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final ProgressCallback progressCallback;
    private final Clock clock;
    private final OutputCollector collector;

    private InteractionClusterer(Builder builder, MetricsService metricsService,
                                 AdjacencyStore adjacency, AssignmentStore assignments, RocksDbStorage storage) {
        this.options = builder.options;
        this.metricsService = metricsService;
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        this.progressCallback = builder.progressCallback != null
                ? builder.progressCallback : ProgressCallback.NOOP;
        this.clock = builder.clock;
        this.adjacency = adjacency;
        this.assignments = assignments;
        this.ownedStorage = storage;
        this.ownsStores = builder.adjacencyStore == null;
        this.collector = new OutputCollector(options.getBatchSize());
        log.info("InteractionClusterer initialized: storage={} options={}",
                storage != null ? storage.getPath() : "memory", options);
    }

    /**
     * Builds the adjacency from {@code source} and runs the full pipeline.
     *
     * @throws IllegalStateException if the stores already hold a built graph
     */
    public ClusteringResult run(InteractionSource source) {
        if (adjacency.isFrozen()) {
            throw new IllegalStateException("The adjacency store already holds a built graph; use resume()");
        }
        String runId = LogContext.generateRunId();
        Instant deadline = deadline();
        try (LogContext ctx = LogContext.forRun(runId);
             Span span = tracingService.startRun(runId, false)) {
            log.info("run.started runId={}", runId);
            try {
                AdjacencyStats ingest = stage(runId, "ingest", () -> {
                    // a failed or crashed ingest leaves unfrozen edges behind
                    adjacency.clear();
                    return new AdjacencyBuilder(adjacency, options, metricsService).build(source, progressCallback);
                });
                SeedMode mode = SeedStage.select(options.getSeedMode(), ingest.entityCount(),
                        options.getComponentsSeedMaxEntities());
                long seedStart = System.nanoTime();
                SeedResult seed = stage(runId, "seed",
                        () -> SeedStage.forMode(mode, options.getBatchSize()).seed(adjacency, assignments));
                metricsService.recordStageDuration("seed", Duration.ofNanos(System.nanoTime() - seedStart));
                return finish(runId, deadline, seed.mode(), ingest, span);
            } catch (RuntimeException e) {
                span.fail(e);
                log.error("run.failed runId={} error={}", runId, e.getMessage());
                throw e;
            }
        }
    }

    /**
     * Continues an interrupted run from the latest committed snapshot. The iteration budget
     * counts from snapshot 0, so an interrupted and resumed run ends where an uninterrupted
     * one would.
     *
     * @throws IllegalStateException if the adjacency is not frozen or no snapshot is committed
     */
    public ClusteringResult resume() {
        if (!adjacency.isFrozen()) {
            throw new IllegalStateException("Nothing to resume: the adjacency store holds no built graph");
        }
        if (assignments.latestIteration().isEmpty()) {
            throw new IllegalStateException("Nothing to resume: no committed snapshot");
        }
        String runId = LogContext.generateRunId();
        Instant deadline = deadline();
        try (LogContext ctx = LogContext.forRun(runId).with("resumed", "true");
             Span span = tracingService.startRun(runId, true)) {
            log.info("run.resumed runId={} fromSnapshot={}", runId, assignments.latestIteration().getAsInt());
            try {
                return finish(runId, deadline, null, null, span);
            } catch (RuntimeException e) {
                span.fail(e);
                log.error("run.failed runId={} error={}", runId, e.getMessage());
                throw e;
            }
        }
    }

    private ClusteringResult finish(String runId, Instant deadline, SeedMode seedMode,
                                    AdjacencyStats ingest, Span runSpan) {
        try (PageDispatcher dispatcher = new PageDispatcher(options.getWorkerThreads())) {
            PropagationResult propagation = new LabelPropagationEngine(
                    options, dispatcher, metricsService, tracingService, clock)
                    .propagate(adjacency, assignments, runId, deadline);
            DuplicationResult duplication = stage(runId, "resolve", () -> new DuplicationResolver(
                    options, dispatcher, metricsService)
                    .resolve(adjacency, assignments, propagation.finalSnapshot()));
            CollectedStats collected = stage(runId, "collect", this::collect);

            ClusteringReport report = new ClusteringReport(runId, seedMode, propagation.converged(),
                    propagation.finalSnapshot(), propagation.warning(), collected.chattiness(),
                    collected.totalEdgeWeight(), collected.crossClusterWeight(), collected.clusters(),
                    ingest, duplication, propagation.iterations());
            runSpan.setAttribute("clustering.converged", Boolean.toString(report.converged()));
            runSpan.setAttribute("clustering.chattiness", report.chattiness());
            propagation.nonConvergence().ifPresent(w -> log.warn("run.nonconverged runId={} {}", runId, w.message()));
            log.info("run.completed runId={} converged={} iterations={} clusters={} duplicates={} chattiness={}",
                    runId, report.converged(), report.iterations(), report.clusterCount(),
                    duplication.duplicatesAdded(), report.chattiness());
            return new ClusteringResult(report, assignments, collector);
        }
    }

    private CollectedStats collect() {
        long start = System.nanoTime();
        try (SnapshotReader resolved = CachingSnapshotReader.wrap(
                assignments.openSnapshot(AssignmentStore.RESOLVED), options.getLabelCacheSize(), metricsService)) {
            CollectedStats stats = collector.collect(adjacency, resolved);
            metricsService.recordChattiness(stats.chattiness());
            metricsService.recordStageDuration("collect", Duration.ofNanos(System.nanoTime() - start));
            return stats;
        }
    }

    private <T> T stage(String runId, String name, Supplier<T> work) {
        try (LogContext ctx = LogContext.forStage(runId, name);
             Span span = tracingService.startStage(runId, name)) {
            try {
                return work.get();
            } catch (RuntimeException e) {
                span.fail(e);
                throw e;
            }
        }
    }

    private Instant deadline() {
        return options.getDeadline().map(d -> clock.instant().plus(d)).orElse(null);
    }

    public ClusteringOptions getOptions() {
        return options;
    }

    public AdjacencyStore getAdjacencyStore() {
        return adjacency;
    }

    public AssignmentStore getAssignmentStore() {
        return assignments;
    }

    @Override
    public void close() {
        if (!ownsStores) {
            return;
        }
        if (ownedStorage != null) {
            ownedStorage.close();
        } else {
            adjacency.close();
            assignments.close();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ClusteringOptions options = ClusteringOptions.defaults();
        private Path storagePath;
        private AdjacencyStore adjacencyStore;
        private AssignmentStore assignmentStore;
        private MetricsService metricsService;
        private TracingService tracingService;
        private ProgressCallback progressCallback;
        private Clock clock = Clock.systemUTC();

        public Builder options(ClusteringOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Keeps adjacency and snapshots in a RocksDB database under {@code path}, owned and
         * closed by the clusterer. Without this, or custom stores, everything stays on the heap.
         */
        public Builder rocksDb(Path path) {
            this.storagePath = path;
            return this;
        }

        /**
         * Uses caller-owned stores; they are not closed with the clusterer.
         */
        public Builder stores(AdjacencyStore adjacencyStore, AssignmentStore assignmentStore) {
            this.adjacencyStore = adjacencyStore;
            this.assignmentStore = assignmentStore;
            return this;
        }

        /**
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Defaults to {@link NoOpTracingService} if not set.
         */
        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder progressCallback(ProgressCallback progressCallback) {
            this.progressCallback = progressCallback;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public InteractionClusterer build() {
            if (options == null) {
                throw new IllegalStateException("ClusteringOptions are required");
            }
            if ((adjacencyStore == null) != (assignmentStore == null)) {
                throw new IllegalStateException("Both an adjacency store and an assignment store are required");
            }
            if (adjacencyStore != null && storagePath != null) {
                throw new IllegalStateException("Choose either custom stores or a RocksDB path, not both");
            }
            MetricsService metrics = metricsService != null ? metricsService : new NoOpMetricsService();
            if (adjacencyStore != null) {
                return new InteractionClusterer(this, metrics, adjacencyStore, assignmentStore, null);
            }
            if (storagePath != null) {
                RocksDbStorage storage = RocksDbStorage.open(storagePath, new StorageRetry(
                        options.getStorageMaxRetries(), options.getStorageRetryBackoffMs(), metrics));
                try {
                    return new InteractionClusterer(this, metrics,
                            storage.adjacencyStore(), storage.assignmentStore(), storage);
                } catch (RuntimeException e) {
                    storage.close();
                    throw e;
                }
            }
            return new InteractionClusterer(this, metrics,
                    new InMemoryAdjacencyStore(), new InMemoryAssignmentStore(), null);
        }
    }
}
