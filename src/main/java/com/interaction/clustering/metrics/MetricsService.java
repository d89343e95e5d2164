package com.interaction.clustering.metrics;

import java.time.Duration;

/**
 * Interface for recording clustering run metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    /**
     * Records how long a pipeline stage took ({@code ingest}, {@code seed},
     * {@code iteration}, {@code resolve}, {@code collect}).
     */
    void recordStageDuration(String stage, Duration duration);

    void recordIngestBatch(int records);

    void incrementRecordsSkipped();

    void recordChurn(double churn);

    void incrementNonConverged();

    void incrementDuplicatesAdded(long count);

    void recordChattiness(double chattiness);

    void incrementStorageRetry(String operation);

    void recordCacheHit();

    void recordCacheMiss();
}
