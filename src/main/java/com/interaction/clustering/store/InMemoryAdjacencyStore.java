package com.interaction.clustering.store;

import com.interaction.clustering.api.CursorPage;
import com.interaction.clustering.core.model.AdjacencyEntry;
import com.interaction.clustering.core.model.EntityNamespace;
import com.interaction.clustering.core.model.Neighbor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory implementation of {@link AdjacencyStore}.
 * Both namespaces share one ordered map; the {@code C:} / {@code M:} prefixes keep them apart.
 */
public class InMemoryAdjacencyStore implements AdjacencyStore {

    private final ConcurrentSkipListMap<String, ConcurrentSkipListMap<String, Long>> adjacency =
            new ConcurrentSkipListMap<>();
    private volatile boolean frozen;

    @Override
    public void mergeWeights(EntityNamespace namespace, Map<String, Map<String, Long>> weights) {
        if (frozen) {
            throw new IllegalStateException("Adjacency store is frozen");
        }
        for (Map.Entry<String, Map<String, Long>> e : weights.entrySet()) {
            requireNamespace(namespace, e.getKey());
            ConcurrentSkipListMap<String, Long> neighbors =
                    adjacency.computeIfAbsent(e.getKey(), k -> new ConcurrentSkipListMap<>());
            e.getValue().forEach((neighbor, weight) -> neighbors.merge(neighbor, weight, Long::sum));
        }
    }

    @Override
    public void clear() {
        if (frozen) {
            throw new IllegalStateException("Adjacency store is frozen");
        }
        adjacency.clear();
    }

    @Override
    public void freeze() {
        frozen = true;
    }

    @Override
    public boolean isFrozen() {
        return frozen;
    }

    @Override
    public Optional<AdjacencyEntry> get(String entityId) {
        ConcurrentSkipListMap<String, Long> neighbors = adjacency.get(entityId);
        return neighbors != null ? Optional.of(toEntry(entityId, neighbors)) : Optional.empty();
    }

    @Override
    public CursorPage<AdjacencyEntry> scan(EntityNamespace namespace, String afterEntityId, int limit) {
        String prefix = namespace.keyPrefix();
        NavigableMap<String, ConcurrentSkipListMap<String, Long>> tail = afterEntityId != null
                ? adjacency.tailMap(afterEntityId, false)
                : adjacency.tailMap(prefix, true);
        List<AdjacencyEntry> content = new ArrayList<>(Math.min(limit, 1024));
        boolean hasMore = false;
        for (Map.Entry<String, ConcurrentSkipListMap<String, Long>> e : tail.entrySet()) {
            if (!e.getKey().startsWith(prefix)) {
                break;
            }
            if (content.size() == limit) {
                hasMore = true;
                break;
            }
            content.add(toEntry(e.getKey(), e.getValue()));
        }
        String cursor = content.isEmpty() ? null : content.get(content.size() - 1).entityId();
        return new CursorPage<>(content, cursor, hasMore);
    }

    @Override
    public AdjacencySummary summary() {
        long cardholders = 0;
        long merchants = 0;
        long edges = 0;
        long weight = 0;
        for (Map.Entry<String, ConcurrentSkipListMap<String, Long>> e : adjacency.entrySet()) {
            if (EntityNamespace.of(e.getKey()) == EntityNamespace.CARDHOLDER) {
                cardholders++;
                edges += e.getValue().size();
                for (long w : e.getValue().values()) {
                    weight += w;
                }
            } else {
                merchants++;
            }
        }
        return new AdjacencySummary(cardholders, merchants, edges, weight);
    }

    @Override
    public void close() {
        adjacency.clear();
    }

    private static AdjacencyEntry toEntry(String entityId, Map<String, Long> neighbors) {
        List<Neighbor> list = new ArrayList<>(neighbors.size());
        neighbors.forEach((id, w) -> list.add(new Neighbor(id, w)));
        return new AdjacencyEntry(entityId, list);
    }

    static void requireNamespace(EntityNamespace namespace, String entityId) {
        if (EntityNamespace.of(entityId) != namespace) {
            throw new IllegalArgumentException("Entity " + entityId + " is not in namespace " + namespace);
        }
    }
}
