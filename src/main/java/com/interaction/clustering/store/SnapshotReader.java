package com.interaction.clustering.store;

import com.interaction.clustering.api.CursorPage;
import com.interaction.clustering.core.model.ClusterAssignment;
import com.interaction.clustering.core.model.EntityNamespace;

import java.util.Optional;

/**
 * Read access to one immutable assignment snapshot. A snapshot is not physically
 * removed while a reader on it is open.
 */
public interface SnapshotReader extends AutoCloseable {

    int snapshotId();

    Optional<ClusterAssignment> get(String entityId);

    /**
     * Returns the primary cluster id of an entity in this snapshot.
     */
    default Optional<String> primaryClusterOf(String entityId) {
        return get(entityId).map(ClusterAssignment::primaryClusterId);
    }

    /**
     * Range read of one namespace in ascending entity id order.
     */
    CursorPage<ClusterAssignment> scan(EntityNamespace namespace, String afterEntityId, int limit);

    @Override
    void close();
}
