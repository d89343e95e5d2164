package com.interaction.clustering.store;

/**
 * Size of a built adjacency: distinct entities per side, distinct edges and their total weight.
 */
public record AdjacencySummary(long cardholders, long merchants, long distinctEdges, long totalEdgeWeight) {

    public static AdjacencySummary empty() {
        return new AdjacencySummary(0, 0, 0, 0);
    }

    public long entityCount() {
        return cardholders + merchants;
    }
}
