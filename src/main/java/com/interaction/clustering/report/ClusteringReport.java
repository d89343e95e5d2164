package com.interaction.clustering.report;

import com.interaction.clustering.adjacency.AdjacencyStats;
import com.interaction.clustering.duplication.DuplicationResult;
import com.interaction.clustering.propagation.IterationStats;
import com.interaction.clustering.propagation.NonConvergenceWarning;
import com.interaction.clustering.seed.SeedMode;

import java.util.List;
import java.util.Optional;

/**
 * Run-level report accompanying the final mapping.
 *
 * @param runId              id of the run, also found in the log MDC
 * @param seedMode           seed mode that produced snapshot 0, null when resumed
 * @param converged          whether propagation converged
 * @param iterations         last committed propagation iteration
 * @param warning            why propagation did not converge, null when it did
 * @param chattiness         cross-cluster weight over total weight, in [0, 1]
 * @param totalEdgeWeight    weight of all edges
 * @param crossClusterWeight weight of edges whose endpoints share no cluster
 * @param clusters           per-cluster stats ordered by cluster id
 * @param ingest             adjacency build stats, null when resumed
 * @param duplication        bridge and duplication summary
 * @param iterationHistory   per-iteration stats of this run
 */
public record ClusteringReport(
        String runId,
        SeedMode seedMode,
        boolean converged,
        int iterations,
        NonConvergenceWarning warning,
        double chattiness,
        long totalEdgeWeight,
        long crossClusterWeight,
        List<ClusterStats> clusters,
        AdjacencyStats ingest,
        DuplicationResult duplication,
        List<IterationStats> iterationHistory
) {
    public ClusteringReport {
        clusters = clusters != null ? List.copyOf(clusters) : List.of();
        iterationHistory = iterationHistory != null ? List.copyOf(iterationHistory) : List.of();
    }

    public Optional<NonConvergenceWarning> nonConvergence() {
        return Optional.ofNullable(warning);
    }

    public int clusterCount() {
        return clusters.size();
    }

    public Optional<ClusterStats> cluster(String clusterId) {
        return clusters.stream().filter(c -> c.clusterId().equals(clusterId)).findFirst();
    }
}
