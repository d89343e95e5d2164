package com.interaction.clustering.store;

import com.interaction.clustering.api.CursorPage;
import com.interaction.clustering.core.model.AdjacencyEntry;
import com.interaction.clustering.core.model.EntityNamespace;
import com.interaction.clustering.core.model.Neighbor;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * RocksDB-backed {@link AdjacencyStore}. One key per directed edge
 * ({@code a\0entity\0neighbor -> weight}), so an entity's neighbours are a contiguous
 * key range and no entry ever has to be held in memory as a whole while building.
 */
public class RocksDbAdjacencyStore implements AdjacencyStore {
    private static final Logger log = LoggerFactory.getLogger(RocksDbAdjacencyStore.class);

    private final RocksDbStorage storage;
    private volatile AdjacencySummary frozenSummary;

    RocksDbAdjacencyStore(RocksDbStorage storage) {
        this.storage = storage;
        this.frozenSummary = storage.retry().call("adjacency.open", () -> {
            byte[] value = storage.db().get(StorageKeys.ADJACENCY_FROZEN);
            return value != null ? decodeSummary(value) : null;
        });
        if (frozenSummary != null) {
            log.info("Reopened frozen adjacency: {}", frozenSummary);
        }
    }

    @Override
    public void mergeWeights(EntityNamespace namespace, Map<String, Map<String, Long>> weights) {
        if (frozenSummary != null) {
            throw new IllegalStateException("Adjacency store is frozen");
        }
        for (String entityId : weights.keySet()) {
            InMemoryAdjacencyStore.requireNamespace(namespace, entityId);
        }
        storage.retry().run("adjacency.merge", () -> {
            try (WriteBatch batch = new WriteBatch()) {
                for (Map.Entry<String, Map<String, Long>> e : weights.entrySet()) {
                    for (Map.Entry<String, Long> n : e.getValue().entrySet()) {
                        byte[] key = StorageKeys.edge(e.getKey(), n.getKey());
                        byte[] existing = storage.db().get(key);
                        long weight = n.getValue() + (existing != null ? StorageKeys.decodeLong(existing) : 0L);
                        batch.put(key, StorageKeys.encodeLong(weight));
                    }
                }
                storage.db().write(storage.writeOptions(), batch);
            }
        });
    }

    @Override
    public void clear() {
        if (frozenSummary != null) {
            throw new IllegalStateException("Adjacency store is frozen");
        }
        storage.retry().run("adjacency.clear", () -> storage.db().deleteRange(storage.syncWriteOptions(),
                StorageKeys.ADJACENCY_START, StorageKeys.ADJACENCY_END));
    }

    @Override
    public void freeze() {
        if (frozenSummary != null) {
            return;
        }
        AdjacencySummary summary = computeSummary();
        storage.retry().run("adjacency.freeze",
                () -> storage.db().put(storage.syncWriteOptions(), StorageKeys.ADJACENCY_FROZEN, encodeSummary(summary)));
        frozenSummary = summary;
        log.info("adjacency.frozen summary={}", summary);
    }

    @Override
    public boolean isFrozen() {
        return frozenSummary != null;
    }

    @Override
    public Optional<AdjacencyEntry> get(String entityId) {
        byte[] prefix = StorageKeys.adjacencyOf(entityId);
        return storage.retry().call("adjacency.get", () -> {
            List<Neighbor> neighbors = new ArrayList<>();
            try (RocksIterator it = storage.db().newIterator()) {
                for (it.seek(prefix); it.isValid() && StorageKeys.startsWith(it.key(), prefix); it.next()) {
                    neighbors.add(new Neighbor(StorageKeys.string(it.key(), prefix.length),
                            StorageKeys.decodeLong(it.value())));
                }
                it.status();
            }
            return neighbors.isEmpty() ? Optional.<AdjacencyEntry>empty()
                    : Optional.of(new AdjacencyEntry(entityId, neighbors));
        });
    }

    @Override
    public CursorPage<AdjacencyEntry> scan(EntityNamespace namespace, String afterEntityId, int limit) {
        byte[] namespacePrefix = StorageKeys.adjacencyNamespace(namespace);
        byte[] start = afterEntityId != null ? StorageKeys.adjacencyAfter(afterEntityId) : namespacePrefix;
        int entityOffset = StorageKeys.ADJACENCY.length();
        return storage.retry().call("adjacency.scan", () -> {
            List<AdjacencyEntry> content = new ArrayList<>(Math.min(limit, 1024));
            boolean hasMore = false;
            String currentEntity = null;
            List<Neighbor> currentNeighbors = new ArrayList<>();
            try (RocksIterator it = storage.db().newIterator()) {
                for (it.seek(start); it.isValid() && StorageKeys.startsWith(it.key(), namespacePrefix); it.next()) {
                    String key = StorageKeys.string(it.key(), entityOffset);
                    int sep = key.indexOf(StorageKeys.SEP);
                    String entityId = key.substring(0, sep);
                    if (!entityId.equals(currentEntity)) {
                        if (currentEntity != null) {
                            content.add(new AdjacencyEntry(currentEntity, currentNeighbors));
                            currentNeighbors = new ArrayList<>();
                        }
                        if (content.size() == limit) {
                            hasMore = true;
                            currentEntity = null;
                            break;
                        }
                        currentEntity = entityId;
                    }
                    currentNeighbors.add(new Neighbor(key.substring(sep + 1), StorageKeys.decodeLong(it.value())));
                }
                it.status();
            }
            if (currentEntity != null) {
                content.add(new AdjacencyEntry(currentEntity, currentNeighbors));
            }
            String cursor = content.isEmpty() ? null : content.get(content.size() - 1).entityId();
            return new CursorPage<>(content, cursor, hasMore);
        });
    }

    @Override
    public AdjacencySummary summary() {
        AdjacencySummary summary = frozenSummary;
        return summary != null ? summary : computeSummary();
    }

    @Override
    public void close() {
        // the database handle belongs to RocksDbStorage
    }

    private AdjacencySummary computeSummary() {
        long[] cardholderTotals = new long[3];
        forEach(EntityNamespace.CARDHOLDER, 10_000, entry -> {
            cardholderTotals[0]++;
            cardholderTotals[1] += entry.degree();
            cardholderTotals[2] += entry.totalWeight();
        });
        long[] merchants = new long[1];
        forEach(EntityNamespace.MERCHANT, 10_000, entry -> merchants[0]++);
        return new AdjacencySummary(cardholderTotals[0], merchants[0], cardholderTotals[1], cardholderTotals[2]);
    }

    private static byte[] encodeSummary(AdjacencySummary summary) {
        return ByteBuffer.allocate(4 * Long.BYTES)
                .putLong(summary.cardholders())
                .putLong(summary.merchants())
                .putLong(summary.distinctEdges())
                .putLong(summary.totalEdgeWeight())
                .array();
    }

    private static AdjacencySummary decodeSummary(byte[] value) {
        ByteBuffer buf = ByteBuffer.wrap(value);
        return new AdjacencySummary(buf.getLong(), buf.getLong(), buf.getLong(), buf.getLong());
    }
}
