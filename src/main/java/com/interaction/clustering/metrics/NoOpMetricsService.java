package com.interaction.clustering.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 * Used by default when no metrics backend is configured.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordStageDuration(String stage, Duration duration) {
    }

    @Override
    public void recordIngestBatch(int records) {
    }

    @Override
    public void incrementRecordsSkipped() {
    }

    @Override
    public void recordChurn(double churn) {
    }

    @Override
    public void incrementNonConverged() {
    }

    @Override
    public void incrementDuplicatesAdded(long count) {
    }

    @Override
    public void recordChattiness(double chattiness) {
    }

    @Override
    public void incrementStorageRetry(String operation) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
