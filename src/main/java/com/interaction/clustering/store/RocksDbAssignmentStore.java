package com.interaction.clustering.store;

import com.interaction.clustering.api.CursorPage;
import com.interaction.clustering.core.model.ClusterAssignment;
import com.interaction.clustering.core.model.EntityNamespace;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * RocksDB-backed {@link AssignmentStore}. Staged assignments are written straight to disk;
 * a snapshot becomes visible only once its commit marker is written with a synced write,
 * so a crash mid-iteration leaves the previous committed snapshot intact.
 * Orphaned staging data found on open is removed.
 */
public class RocksDbAssignmentStore extends AbstractAssignmentStore {
    private static final Logger log = LoggerFactory.getLogger(RocksDbAssignmentStore.class);

    private final RocksDbStorage storage;

    RocksDbAssignmentStore(RocksDbStorage storage) {
        this.storage = storage;
        Map<Integer, Double> committed = storage.retry().call("snapshot.recover", this::readCommitMarkers);
        for (int orphan : storage.retry().call("snapshot.recover", () -> findOrphans(committed.keySet()))) {
            log.warn("snapshot.orphan.dropped id={}", orphan);
            drop(orphan);
        }
        restoreCommitted(committed);
        if (!committed.isEmpty()) {
            log.info("Recovered committed snapshots {}", committed.keySet());
        }
    }

    @Override
    protected void stage(int snapshotId, Collection<ClusterAssignment> assignments) {
        storage.retry().run("snapshot.write", () -> {
            try (WriteBatch batch = new WriteBatch()) {
                for (ClusterAssignment a : assignments) {
                    batch.put(StorageKeys.assignment(snapshotId, a.entityId()), AssignmentCodec.encode(a));
                }
                storage.db().write(storage.writeOptions(), batch);
            }
        });
    }

    @Override
    protected Optional<ClusterAssignment> load(int snapshotId, String entityId) {
        byte[] value = storage.retry().call("snapshot.get",
                () -> storage.db().get(StorageKeys.assignment(snapshotId, entityId)));
        return value != null ? Optional.of(AssignmentCodec.decode(entityId, value)) : Optional.empty();
    }

    @Override
    protected CursorPage<ClusterAssignment> loadRange(int snapshotId, EntityNamespace namespace,
                                                      String afterEntityId, int limit) {
        byte[] namespacePrefix = StorageKeys.snapshotNamespace(snapshotId, namespace);
        byte[] start = afterEntityId != null
                ? StorageKeys.assignmentAfter(snapshotId, afterEntityId)
                : namespacePrefix;
        int entityOffset = StorageKeys.snapshotPrefix(snapshotId).length;
        List<ClusterAssignment> candidates = storage.retry().call("snapshot.scan", () -> {
            List<ClusterAssignment> found = new ArrayList<>(Math.min(limit + 1, 1024));
            try (RocksIterator it = storage.db().newIterator()) {
                for (it.seek(start); it.isValid() && found.size() <= limit
                        && StorageKeys.startsWith(it.key(), namespacePrefix); it.next()) {
                    String entityId = StorageKeys.string(it.key(), entityOffset);
                    found.add(AssignmentCodec.decode(entityId, it.value()));
                }
                it.status();
            }
            return found;
        });
        return toPage(candidates, limit);
    }

    @Override
    protected void publish(int snapshotId, double churn) {
        // the marker value holds the churn; empty when none was recorded
        byte[] marker = Double.isNaN(churn) ? new byte[0] : StorageKeys.encodeLong(Double.doubleToLongBits(churn));
        storage.retry().run("snapshot.commit",
                () -> storage.db().put(storage.syncWriteOptions(), StorageKeys.commitMarker(snapshotId), marker));
    }

    @Override
    protected void unpublish(int snapshotId) {
        storage.retry().run("snapshot.unpublish",
                () -> storage.db().delete(storage.syncWriteOptions(), StorageKeys.commitMarker(snapshotId)));
    }

    @Override
    protected void drop(int snapshotId) {
        storage.retry().run("snapshot.drop", () -> storage.db().deleteRange(storage.writeOptions(),
                StorageKeys.snapshotPrefix(snapshotId), StorageKeys.snapshotEnd(snapshotId)));
    }

    @Override
    protected void closeResources() {
        // the database handle belongs to RocksDbStorage
    }

    private Map<Integer, Double> readCommitMarkers() throws Exception {
        Map<Integer, Double> ids = new TreeMap<>();
        byte[] prefix = StorageKeys.bytes(StorageKeys.COMMIT_MARKER);
        try (RocksIterator it = storage.db().newIterator()) {
            for (it.seek(prefix); it.isValid() && StorageKeys.startsWith(it.key(), prefix); it.next()) {
                byte[] value = it.value();
                double churn = value.length == Long.BYTES
                        ? Double.longBitsToDouble(StorageKeys.decodeLong(value)) : Double.NaN;
                ids.put(StorageKeys.snapshotIdOf(it.key(), prefix.length), churn);
            }
            it.status();
        }
        return ids;
    }

    private List<Integer> findOrphans(Set<Integer> committed) throws Exception {
        List<Integer> orphans = new ArrayList<>();
        byte[] prefix = StorageKeys.bytes(StorageKeys.SNAPSHOT);
        try (RocksIterator it = storage.db().newIterator()) {
            it.seek(prefix);
            while (it.isValid() && StorageKeys.startsWith(it.key(), prefix)) {
                int snapshotId = StorageKeys.snapshotIdOf(it.key(), prefix.length);
                if (!committed.contains(snapshotId)) {
                    orphans.add(snapshotId);
                }
                it.seek(StorageKeys.snapshotEnd(snapshotId));
            }
            it.status();
        }
        return orphans;
    }
}
