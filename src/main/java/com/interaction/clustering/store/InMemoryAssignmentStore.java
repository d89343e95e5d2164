package com.interaction.clustering.store;

import com.interaction.clustering.api.CursorPage;
import com.interaction.clustering.core.model.ClusterAssignment;
import com.interaction.clustering.core.model.EntityNamespace;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory implementation of {@link AssignmentStore}.
 * Thread-safe via concurrent skip-list maps; intended for graphs that fit on the heap and for tests.
 */
public class InMemoryAssignmentStore extends AbstractAssignmentStore {

    private final Map<Integer, ConcurrentSkipListMap<String, ClusterAssignment>> snapshots = new ConcurrentHashMap<>();

    @Override
    protected void stage(int snapshotId, Collection<ClusterAssignment> assignments) {
        ConcurrentSkipListMap<String, ClusterAssignment> data =
                snapshots.computeIfAbsent(snapshotId, k -> new ConcurrentSkipListMap<>());
        for (ClusterAssignment a : assignments) {
            data.put(a.entityId(), a);
        }
    }

    @Override
    protected Optional<ClusterAssignment> load(int snapshotId, String entityId) {
        ConcurrentSkipListMap<String, ClusterAssignment> data = snapshots.get(snapshotId);
        return data != null ? Optional.ofNullable(data.get(entityId)) : Optional.empty();
    }

    @Override
    protected CursorPage<ClusterAssignment> loadRange(int snapshotId, EntityNamespace namespace,
                                                      String afterEntityId, int limit) {
        ConcurrentSkipListMap<String, ClusterAssignment> data = snapshots.get(snapshotId);
        if (data == null) {
            return CursorPage.empty();
        }
        String prefix = namespace.keyPrefix();
        NavigableMap<String, ClusterAssignment> tail = afterEntityId != null
                ? data.tailMap(afterEntityId, false)
                : data.tailMap(prefix, true);
        List<ClusterAssignment> candidates = new ArrayList<>(Math.min(limit + 1, 1024));
        for (Map.Entry<String, ClusterAssignment> e : tail.entrySet()) {
            if (!e.getKey().startsWith(prefix) || candidates.size() > limit) {
                break;
            }
            candidates.add(e.getValue());
        }
        return toPage(candidates, limit);
    }

    @Override
    protected void publish(int snapshotId, double churn) {
        snapshots.computeIfAbsent(snapshotId, k -> new ConcurrentSkipListMap<>());
    }

    @Override
    protected void unpublish(int snapshotId) {
    }

    @Override
    protected void drop(int snapshotId) {
        snapshots.remove(snapshotId);
    }

    @Override
    protected void closeResources() {
        snapshots.clear();
    }

    /**
     * Returns the number of snapshots currently holding data, committed or not.
     */
    int retainedSnapshotCount() {
        return snapshots.size();
    }
}
