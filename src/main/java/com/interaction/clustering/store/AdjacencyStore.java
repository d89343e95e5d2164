package com.interaction.clustering.store;

import com.interaction.clustering.api.CursorPage;
import com.interaction.clustering.core.model.AdjacencyEntry;
import com.interaction.clustering.core.model.EntityNamespace;

import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Keyed external storage of the two adjacency mappings (cardholder to merchants and
 * merchant to cardholders). Written in batches while the graph is built, then frozen
 * and read-only for the rest of the run.
 *
 * <p>Concurrent {@link #mergeWeights} calls are safe as long as each caller owns a
 * disjoint set of entity keys.</p>
 */
public interface AdjacencyStore extends AutoCloseable {

    /**
     * Adds edge weights to the mapping of one namespace. Existing weights are summed, never overwritten.
     *
     * @param namespace the side whose entities are the keys of {@code weights}
     * @param weights   entity id to (neighbour id to weight to add)
     * @throws IllegalStateException if the store is frozen
     */
    void mergeWeights(EntityNamespace namespace, Map<String, Map<String, Long>> weights);

    /**
     * Marks construction as complete. Later merges are rejected.
     */
    void freeze();

    boolean isFrozen();

    /**
     * Removes every edge written so far, leaving an empty store ready for a new build.
     * Used to discard the partial graph of an ingest that failed before freezing.
     *
     * @throws IllegalStateException if the store is frozen
     */
    void clear();

    /**
     * Returns the adjacency of one entity, looked up by its namespaced id.
     */
    Optional<AdjacencyEntry> get(String entityId);

    /**
     * Range read of one namespace in ascending entity id order.
     *
     * @param afterEntityId exclusive lower bound, or null to start at the beginning
     * @param limit         maximum number of entries on the page
     */
    CursorPage<AdjacencyEntry> scan(EntityNamespace namespace, String afterEntityId, int limit);

    /**
     * Returns entity, edge and weight totals of the stored graph.
     */
    AdjacencySummary summary();

    /**
     * Visits every entry of a namespace in ascending id order, reading {@code pageSize} entries at a time.
     */
    default void forEach(EntityNamespace namespace, int pageSize, Consumer<AdjacencyEntry> action) {
        String cursor = null;
        CursorPage<AdjacencyEntry> page;
        do {
            page = scan(namespace, cursor, pageSize);
            page.content().forEach(action);
            cursor = page.nextCursor();
        } while (page.hasMore());
    }

    @Override
    void close();
}
