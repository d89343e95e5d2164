package com.interaction.clustering.seed;

import com.interaction.clustering.store.AdjacencyStore;
import com.interaction.clustering.store.AssignmentStore;

/**
 * Produces the initial assignment (snapshot 0): one primary cluster per entity, no duplicates.
 */
public interface SeedStage {

    SeedMode mode();

    /**
     * Writes and commits snapshot 0 from a frozen adjacency.
     */
    SeedResult seed(AdjacencyStore adjacency, AssignmentStore assignments);

    /**
     * Resolves {@link SeedMode#AUTO} against the entity count of the graph.
     * Connected components is only chosen when the entity set fits the configured bound.
     */
    static SeedMode select(SeedMode requested, long entityCount, long componentsMaxEntities) {
        if (requested != SeedMode.AUTO) {
            return requested;
        }
        return entityCount <= componentsMaxEntities ? SeedMode.COMPONENTS : SeedMode.UNIQUE;
    }

    static SeedStage forMode(SeedMode mode, int pageSize) {
        return switch (mode) {
            case COMPONENTS -> new ConnectedComponentsSeeder(pageSize);
            case UNIQUE -> new UniqueSeeder(pageSize);
            case AUTO -> throw new IllegalArgumentException("AUTO must be resolved with select() first");
        };
    }
}
