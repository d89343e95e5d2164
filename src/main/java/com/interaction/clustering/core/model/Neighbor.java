package com.interaction.clustering.core.model;

/**
 * A neighbour of an entity together with the accumulated weight of their edge.
 */
public record Neighbor(String entityId, long weight) {

    public Neighbor {
        if (weight < 1) {
            throw new IllegalArgumentException("Edge weight must be >= 1, got " + weight);
        }
    }
}
