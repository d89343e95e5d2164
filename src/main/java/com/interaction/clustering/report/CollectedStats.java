package com.interaction.clustering.report;

import java.util.List;

/**
 * Membership and edge-weight figures gathered by the {@link OutputCollector}.
 */
public record CollectedStats(List<ClusterStats> clusters, long totalEdgeWeight, long crossClusterWeight) {

    public CollectedStats {
        clusters = clusters != null ? List.copyOf(clusters) : List.of();
    }

    /**
     * Cross-cluster weight over total weight; 0 for an empty graph.
     */
    public double chattiness() {
        return totalEdgeWeight == 0 ? 0.0 : (double) crossClusterWeight / totalEdgeWeight;
    }
}
