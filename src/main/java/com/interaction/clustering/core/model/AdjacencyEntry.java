package com.interaction.clustering.core.model;

import java.util.List;
import java.util.Objects;

/**
 * An entity and its neighbours on the opposite side of the graph, ordered by neighbour id.
 * Entries are read-only once the adjacency store has been frozen.
 */
public record AdjacencyEntry(String entityId, List<Neighbor> neighbors) {

    public AdjacencyEntry {
        Objects.requireNonNull(entityId, "entityId is required");
        neighbors = neighbors != null ? List.copyOf(neighbors) : List.of();
    }

    public EntityNamespace namespace() {
        return EntityNamespace.of(entityId);
    }

    public int degree() {
        return neighbors.size();
    }

    public long totalWeight() {
        long total = 0;
        for (Neighbor n : neighbors) {
            total += n.weight();
        }
        return total;
    }
}
