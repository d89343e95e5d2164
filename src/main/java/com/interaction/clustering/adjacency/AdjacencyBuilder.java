package com.interaction.clustering.adjacency;

import com.interaction.clustering.api.ClusteringOptions;
import com.interaction.clustering.bulk.InteractionSource;
import com.interaction.clustering.bulk.ProgressCallback;
import com.interaction.clustering.core.exception.ClusteringException;
import com.interaction.clustering.core.exception.MalformedRecordException;
import com.interaction.clustering.core.model.EntityId;
import com.interaction.clustering.core.model.EntityNamespace;
import com.interaction.clustering.core.model.InteractionRecord;
import com.interaction.clustering.metrics.MetricsService;
import com.interaction.clustering.store.AdjacencySummary;
import com.interaction.clustering.store.AdjacencyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Streams interaction records into the two adjacency mappings.
 *
 * <p>Records are buffered up to the batch size and aggregated per (entity, neighbour)
 * in both directions. Aggregated keys are split into disjoint partitions by entity id
 * hash, and each partition is flushed by its own writer, so no key is ever written by
 * two writers. A batch is fully flushed before the next one is read, which bounds memory
 * to one batch.</p>
 */
public class AdjacencyBuilder {
    private static final Logger log = LoggerFactory.getLogger(AdjacencyBuilder.class);

    static final int MAX_ERROR_SAMPLES = 100;

    private final AdjacencyStore store;
    private final ClusteringOptions options;
    private final MetricsService metricsService;

    public AdjacencyBuilder(AdjacencyStore store, ClusteringOptions options, MetricsService metricsService) {
        this.store = store;
        this.options = options;
        this.metricsService = metricsService;
    }

    /**
     * Reads the whole source, writes the adjacency and freezes the store.
     *
     * @throws MalformedRecordException in strict mode, on the first malformed unit
     */
    public AdjacencyStats build(InteractionSource source, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        long start = System.nanoTime();
        int writers = options.getWriterThreads();
        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(writers, r -> {
            Thread t = new Thread(r, "adjacency-writer-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        long read = 0;
        long accepted = 0;
        long skipped = 0;
        List<AdjacencyStats.RecordError> errors = new ArrayList<>();
        List<InteractionRecord> buffer = new ArrayList<>(Math.min(options.getBatchSize(), 65_536));
        try {
            while (true) {
                Optional<InteractionRecord> next;
                try {
                    next = source.next();
                    if (next.isEmpty()) {
                        break;
                    }
                    read++;
                    validate(next.get(), source.position());
                } catch (MalformedRecordException e) {
                    read++;
                    if (options.isStrict()) {
                        log.error("ingest.malformed.strict line={} error={}", e.getLineNumber(), e.getMessage());
                        throw e;
                    }
                    skipped++;
                    metricsService.incrementRecordsSkipped();
                    if (errors.size() < MAX_ERROR_SAMPLES) {
                        errors.add(new AdjacencyStats.RecordError(e.getLineNumber(), e.getMessage()));
                    }
                    log.warn("ingest.skipped line={} error={}", e.getLineNumber(), e.getMessage());
                    continue;
                }
                buffer.add(next.get());
                accepted++;
                if (buffer.size() >= options.getBatchSize()) {
                    flush(buffer, executor, writers);
                    cb.onProgress(read, -1, "Ingested " + read + " records");
                }
            }
            if (!buffer.isEmpty()) {
                flush(buffer, executor, writers);
            }
        } finally {
            executor.shutdownNow();
        }

        store.freeze();
        AdjacencySummary summary = store.summary();
        AdjacencyStats stats = new AdjacencyStats(read, accepted, skipped,
                summary.cardholders(), summary.merchants(), summary.distinctEdges(), summary.totalEdgeWeight(),
                errors);
        metricsService.recordStageDuration("ingest", Duration.ofNanos(System.nanoTime() - start));
        cb.onProgress(read, read, "Ingest completed");
        log.info("ingest.completed stats={}", stats);
        return stats;
    }

    private static void validate(InteractionRecord record, long position) {
        if (!EntityId.isValidRawId(record.cardholderId())) {
            throw new MalformedRecordException(position, "invalid cardholder id '" + record.cardholderId() + "'");
        }
        if (!EntityId.isValidRawId(record.merchantId())) {
            throw new MalformedRecordException(position, "invalid merchant id '" + record.merchantId() + "'");
        }
        if (record.weight() < 1) {
            throw new MalformedRecordException(position, "weight must be >= 1 but was " + record.weight());
        }
    }

    private void flush(List<InteractionRecord> buffer, ExecutorService executor, int writers) {
        List<Map<EntityNamespace, Map<String, Map<String, Long>>>> partitions = new ArrayList<>(writers);
        for (int i = 0; i < writers; i++) {
            partitions.add(new EnumMap<>(EntityNamespace.class));
        }
        for (InteractionRecord record : buffer) {
            String cardholder = record.cardholder().value();
            String merchant = record.merchant().value();
            add(partitions.get(partitionOf(cardholder, writers)), EntityNamespace.CARDHOLDER,
                    cardholder, merchant, record.weight());
            add(partitions.get(partitionOf(merchant, writers)), EntityNamespace.MERCHANT,
                    merchant, cardholder, record.weight());
        }
        int batchSize = buffer.size();
        buffer.clear();

        List<CompletableFuture<Void>> futures = new ArrayList<>(writers);
        for (Map<EntityNamespace, Map<String, Map<String, Long>>> partition : partitions) {
            if (partition.isEmpty()) {
                continue;
            }
            futures.add(CompletableFuture.runAsync(
                    () -> partition.forEach(store::mergeWeights), executor));
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new ClusteringException("Adjacency write failed", e.getCause());
        }
        metricsService.recordIngestBatch(batchSize);
        log.debug("ingest.batch.flushed records={} partitions={}", batchSize, futures.size());
    }

    /**
     * Writer partition owning an entity key.
     */
    static int partitionOf(String entityId, int partitions) {
        return Math.floorMod(entityId.hashCode(), partitions);
    }

    private static void add(Map<EntityNamespace, Map<String, Map<String, Long>>> partition,
                            EntityNamespace namespace, String entity, String neighbor, long weight) {
        partition.computeIfAbsent(namespace, ns -> new HashMap<>())
                .computeIfAbsent(entity, e -> new HashMap<>())
                .merge(neighbor, weight, Long::sum);
    }
}
