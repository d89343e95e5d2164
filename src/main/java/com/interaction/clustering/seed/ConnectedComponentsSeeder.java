package com.interaction.clustering.seed;

import com.interaction.clustering.api.CursorPage;
import com.interaction.clustering.core.model.AdjacencyEntry;
import com.interaction.clustering.core.model.ClusterAssignment;
import com.interaction.clustering.core.model.EntityNamespace;
import com.interaction.clustering.core.model.Neighbor;
import com.interaction.clustering.store.AdjacencyStore;
import com.interaction.clustering.store.AssignmentStore;
import com.interaction.clustering.store.SnapshotWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Seeds each connected component as one cluster.
 *
 * <p>Start entities are enumerated in ascending id order over both namespaces, and each
 * unvisited one is expanded with an explicit frontier queue. The cluster id is the start
 * entity's id, which is the smallest id of its component. The visited set is held in memory,
 * which is why this mode is only selected for graphs below a configured entity count.</p>
 */
public class ConnectedComponentsSeeder implements SeedStage {
    private static final Logger log = LoggerFactory.getLogger(ConnectedComponentsSeeder.class);

    private final int pageSize;

    public ConnectedComponentsSeeder(int pageSize) {
        this.pageSize = pageSize;
    }

    @Override
    public SeedMode mode() {
        return SeedMode.COMPONENTS;
    }

    @Override
    public SeedResult seed(AdjacencyStore adjacency, AssignmentStore assignments) {
        Set<String> visited = new HashSet<>();
        List<ClusterAssignment> pending = new ArrayList<>();
        long components = 0;
        long largest = 0;

        try (SnapshotWriter writer = assignments.beginSnapshot(0)) {
            for (EntityNamespace ns : EntityNamespace.values()) {
                String cursor = null;
                CursorPage<AdjacencyEntry> page;
                do {
                    page = adjacency.scan(ns, cursor, pageSize);
                    for (AdjacencyEntry start : page.content()) {
                        if (visited.contains(start.entityId())) {
                            continue;
                        }
                        long size = expand(start, adjacency, visited, pending, writer);
                        components++;
                        largest = Math.max(largest, size);
                    }
                    cursor = page.nextCursor();
                } while (page.hasMore());
            }
            if (!pending.isEmpty()) {
                writer.write(pending);
            }
            writer.commit();
        }
        log.info("seed.completed mode=components entities={} components={} largest={}",
                visited.size(), components, largest);
        return new SeedResult(SeedMode.COMPONENTS, visited.size(), components);
    }

    private long expand(AdjacencyEntry start, AdjacencyStore adjacency, Set<String> visited,
                        List<ClusterAssignment> pending, SnapshotWriter writer) {
        String clusterId = start.entityId();
        ArrayDeque<String> frontier = new ArrayDeque<>();
        visited.add(clusterId);
        frontier.add(clusterId);
        long size = 0;
        while (!frontier.isEmpty()) {
            String entityId = frontier.poll();
            pending.add(ClusterAssignment.seed(entityId, clusterId));
            size++;
            if (pending.size() >= pageSize) {
                writer.write(pending);
                pending.clear();
            }
            AdjacencyEntry entry = entityId.equals(clusterId) ? start : adjacency.get(entityId).orElse(null);
            if (entry == null) {
                continue;
            }
            for (Neighbor n : entry.neighbors()) {
                if (visited.add(n.entityId())) {
                    frontier.add(n.entityId());
                }
            }
        }
        return size;
    }
}
