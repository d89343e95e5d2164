package com.interaction.clustering.report;

import com.interaction.clustering.api.CursorPage;
import com.interaction.clustering.core.model.ClusterAssignment;
import com.interaction.clustering.core.model.ClusterMembership;
import com.interaction.clustering.core.model.ClusterRole;
import com.interaction.clustering.core.model.EntityNamespace;
import com.interaction.clustering.core.model.Neighbor;
import com.interaction.clustering.store.AdjacencyStore;
import com.interaction.clustering.store.SnapshotReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Consumer;

/**
 * Read-only pass over the resolved snapshot and the adjacency that produces cluster
 * statistics, chattiness and the output rows.
 *
 * <p>Each edge is counted once, from the cardholder side. It is internal to every cluster
 * both endpoints belong to (as primary or duplicate) and external to every other cluster
 * of either endpoint. An edge whose endpoints share no cluster crosses cluster boundaries
 * and counts towards chattiness.</p>
 */
public class OutputCollector {
    private static final Logger log = LoggerFactory.getLogger(OutputCollector.class);

    private final int pageSize;

    public OutputCollector(int pageSize) {
        this.pageSize = pageSize;
    }

    public CollectedStats collect(AdjacencyStore adjacency, SnapshotReader resolved) {
        Map<String, long[]> perCluster = new TreeMap<>();

        for (EntityNamespace ns : EntityNamespace.values()) {
            forEachAssignment(resolved, ns, a -> {
                counters(perCluster, a.primaryClusterId())[0]++;
                for (ClusterMembership d : a.duplicates()) {
                    counters(perCluster, d.clusterId())[1]++;
                }
            });
        }

        long[] totals = new long[2];
        adjacency.forEach(EntityNamespace.CARDHOLDER, pageSize, entry -> {
            Set<String> cardholderClusters = clustersOf(resolved, entry.entityId());
            for (Neighbor n : entry.neighbors()) {
                Set<String> merchantClusters = clustersOf(resolved, n.entityId());
                long w = n.weight();
                totals[0] += w;
                boolean shared = false;
                for (String c : cardholderClusters) {
                    if (merchantClusters.contains(c)) {
                        counters(perCluster, c)[2] += w;
                        shared = true;
                    } else {
                        counters(perCluster, c)[3] += w;
                    }
                }
                for (String m : merchantClusters) {
                    if (!cardholderClusters.contains(m)) {
                        counters(perCluster, m)[3] += w;
                    }
                }
                if (!shared) {
                    totals[1] += w;
                }
            }
        });

        List<ClusterStats> clusters = new ArrayList<>(perCluster.size());
        perCluster.forEach((id, c) -> clusters.add(new ClusterStats(id, c[0], c[1], c[2], c[3])));
        CollectedStats stats = new CollectedStats(clusters, totals[0], totals[1]);
        log.info("collect.completed clusters={} totalWeight={} crossWeight={} chattiness={}",
                clusters.size(), stats.totalEdgeWeight(), stats.crossClusterWeight(), stats.chattiness());
        return stats;
    }

    /**
     * Streams the output rows of a snapshot in ascending entity id order.
     */
    public void forEachRow(SnapshotReader snapshot, Consumer<AssignmentRow> action) {
        for (EntityNamespace ns : EntityNamespace.values()) {
            forEachAssignment(snapshot, ns, a -> {
                ClusterMembership p = a.primary();
                action.accept(new AssignmentRow(a.entityId(), p.clusterId(), ClusterRole.PRIMARY, p.weight()));
                for (ClusterMembership d : a.duplicates()) {
                    action.accept(new AssignmentRow(a.entityId(), d.clusterId(), ClusterRole.DUPLICATE, d.weight()));
                }
            });
        }
    }

    private void forEachAssignment(SnapshotReader snapshot, EntityNamespace ns, Consumer<ClusterAssignment> action) {
        String cursor = null;
        CursorPage<ClusterAssignment> page;
        do {
            page = snapshot.scan(ns, cursor, pageSize);
            page.content().forEach(action);
            cursor = page.nextCursor();
        } while (page.hasMore());
    }

    private static Set<String> clustersOf(SnapshotReader snapshot, String entityId) {
        return snapshot.get(entityId).map(ClusterAssignment::clusterIds).orElseGet(HashSet::new);
    }

    private static long[] counters(Map<String, long[]> perCluster, String clusterId) {
        return perCluster.computeIfAbsent(clusterId, k -> new long[4]);
    }
}
