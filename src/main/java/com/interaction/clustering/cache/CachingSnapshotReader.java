package com.interaction.clustering.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.interaction.clustering.api.CursorPage;
import com.interaction.clustering.core.model.ClusterAssignment;
import com.interaction.clustering.core.model.EntityNamespace;
import com.interaction.clustering.metrics.MetricsService;
import com.interaction.clustering.store.SnapshotReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Caffeine-backed cache in front of one snapshot's point lookups.
 * The wrapped snapshot is immutable, so entries never need invalidation; the cache
 * lives exactly as long as the reader and is dropped on close.
 */
public class CachingSnapshotReader implements SnapshotReader {
    private static final Logger log = LoggerFactory.getLogger(CachingSnapshotReader.class);

    private final SnapshotReader delegate;
    private final Cache<String, Optional<ClusterAssignment>> cache;
    private final MetricsService metricsService;

    public CachingSnapshotReader(SnapshotReader delegate, long maxSize, MetricsService metricsService) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        this.delegate = delegate;
        this.metricsService = metricsService;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .recordStats()
                .build();
        log.debug("label.cache.created snapshot={} maxSize={}", delegate.snapshotId(), maxSize);
    }

    /**
     * Wraps a reader in a cache of the given size, or returns it unchanged when the size is 0.
     */
    public static SnapshotReader wrap(SnapshotReader reader, long maxSize, MetricsService metricsService) {
        return maxSize > 0 ? new CachingSnapshotReader(reader, maxSize, metricsService) : reader;
    }

    @Override
    public int snapshotId() {
        return delegate.snapshotId();
    }

    @Override
    public Optional<ClusterAssignment> get(String entityId) {
        Optional<ClusterAssignment> cached = cache.getIfPresent(entityId);
        if (cached != null) {
            metricsService.recordCacheHit();
            return cached;
        }
        metricsService.recordCacheMiss();
        Optional<ClusterAssignment> loaded = delegate.get(entityId);
        cache.put(entityId, loaded);
        return loaded;
    }

    @Override
    public CursorPage<ClusterAssignment> scan(EntityNamespace namespace, String afterEntityId, int limit) {
        return delegate.scan(namespace, afterEntityId, limit);
    }

    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }

    @Override
    public void close() {
        log.debug("label.cache.closed snapshot={} stats={}", delegate.snapshotId(), getStats());
        cache.invalidateAll();
        delegate.close();
    }
}
