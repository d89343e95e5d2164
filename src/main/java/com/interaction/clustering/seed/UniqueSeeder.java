package com.interaction.clustering.seed;

import com.interaction.clustering.api.CursorPage;
import com.interaction.clustering.core.model.AdjacencyEntry;
import com.interaction.clustering.core.model.ClusterAssignment;
import com.interaction.clustering.core.model.EntityNamespace;
import com.interaction.clustering.store.AdjacencyStore;
import com.interaction.clustering.store.AssignmentStore;
import com.interaction.clustering.store.SnapshotWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Seeds every entity into its own singleton cluster, named after the entity.
 * Streams the adjacency page by page, so memory stays bounded by one page.
 */
public class UniqueSeeder implements SeedStage {
    private static final Logger log = LoggerFactory.getLogger(UniqueSeeder.class);

    private final int pageSize;

    public UniqueSeeder(int pageSize) {
        this.pageSize = pageSize;
    }

    @Override
    public SeedMode mode() {
        return SeedMode.UNIQUE;
    }

    @Override
    public SeedResult seed(AdjacencyStore adjacency, AssignmentStore assignments) {
        long entities = 0;
        try (SnapshotWriter writer = assignments.beginSnapshot(0)) {
            for (EntityNamespace ns : EntityNamespace.values()) {
                String cursor = null;
                CursorPage<AdjacencyEntry> page;
                do {
                    page = adjacency.scan(ns, cursor, pageSize);
                    List<ClusterAssignment> batch = new ArrayList<>(page.size());
                    for (AdjacencyEntry entry : page.content()) {
                        batch.add(ClusterAssignment.seed(entry.entityId(), entry.entityId()));
                    }
                    writer.write(batch);
                    entities += batch.size();
                    cursor = page.nextCursor();
                } while (page.hasMore());
                writer.seal(ns);
            }
            writer.commit();
        }
        log.info("seed.completed mode=unique entities={}", entities);
        return new SeedResult(SeedMode.UNIQUE, entities, entities);
    }
}
