package com.interaction.clustering.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code clustering.stage.duration} - Timer (tag: stage)</li>
 *   <li>{@code clustering.ingest.batch.size} - DistributionSummary</li>
 *   <li>{@code clustering.records.skipped} - Counter</li>
 *   <li>{@code clustering.iteration.churn} - DistributionSummary</li>
 *   <li>{@code clustering.runs.nonconverged} - Counter</li>
 *   <li>{@code clustering.duplicates.added} - Counter</li>
 *   <li>{@code clustering.chattiness} - DistributionSummary</li>
 *   <li>{@code clustering.storage.retry} - Counter (tag: operation)</li>
 *   <li>{@code clustering.label.cache.hit} / {@code clustering.label.cache.miss} - Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> retryCounterCache = new ConcurrentHashMap<>();
    private final DistributionSummary batchSizeSummary;
    private final DistributionSummary churnSummary;
    private final DistributionSummary chattinessSummary;
    private final Counter skippedCounter;
    private final Counter nonConvergedCounter;
    private final Counter duplicatesCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.batchSizeSummary = DistributionSummary.builder("clustering.ingest.batch.size")
                .description("Records per adjacency flush")
                .register(registry);
        this.churnSummary = DistributionSummary.builder("clustering.iteration.churn")
                .description("Fraction of entities changing primary cluster per iteration")
                .register(registry);
        this.chattinessSummary = DistributionSummary.builder("clustering.chattiness")
                .description("Cross-cluster edge weight over total edge weight per run")
                .register(registry);
        this.skippedCounter = Counter.builder("clustering.records.skipped")
                .description("Malformed input records skipped")
                .register(registry);
        this.nonConvergedCounter = Counter.builder("clustering.runs.nonconverged")
                .description("Runs that stopped before reaching the convergence tolerance")
                .register(registry);
        this.duplicatesCounter = Counter.builder("clustering.duplicates.added")
                .description("Duplicate cluster memberships created")
                .register(registry);
        this.cacheHitCounter = Counter.builder("clustering.label.cache.hit")
                .description("Snapshot label lookups served from cache")
                .register(registry);
        this.cacheMissCounter = Counter.builder("clustering.label.cache.miss")
                .description("Snapshot label lookups read from the store")
                .register(registry);
    }

    @Override
    public void recordStageDuration(String stage, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(stage, k ->
                Timer.builder("clustering.stage.duration")
                        .description("Duration of clustering pipeline stages")
                        .tag("stage", stage)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordIngestBatch(int records) {
        batchSizeSummary.record(records);
    }

    @Override
    public void incrementRecordsSkipped() {
        skippedCounter.increment();
    }

    @Override
    public void recordChurn(double churn) {
        churnSummary.record(churn);
    }

    @Override
    public void incrementNonConverged() {
        nonConvergedCounter.increment();
    }

    @Override
    public void incrementDuplicatesAdded(long count) {
        duplicatesCounter.increment(count);
    }

    @Override
    public void recordChattiness(double chattiness) {
        chattinessSummary.record(chattiness);
    }

    @Override
    public void incrementStorageRetry(String operation) {
        Counter counter = retryCounterCache.computeIfAbsent(operation, k ->
                Counter.builder("clustering.storage.retry")
                        .description("Retried storage operations")
                        .tag("operation", operation)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
