package com.interaction.clustering.store;

import com.interaction.clustering.api.CursorPage;
import com.interaction.clustering.core.model.ClusterAssignment;
import com.interaction.clustering.core.model.EntityNamespace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeSet;

/**
 * Snapshot lifecycle shared by all assignment stores: publication on commit, reader
 * reference counting, and deferred removal of discarded snapshots.
 * Subclasses only provide the raw staging, lookup and deletion primitives.
 */
public abstract class AbstractAssignmentStore implements AssignmentStore {
    private static final Logger log = LoggerFactory.getLogger(AbstractAssignmentStore.class);

    private final Object lock = new Object();
    private final TreeSet<Integer> committed = new TreeSet<>();
    private final Map<Integer, Double> churns = new HashMap<>();
    private final Set<Integer> inProgress = new HashSet<>();
    private final Map<Integer, Integer> openReaders = new HashMap<>();
    private final Set<Integer> pendingDrop = new HashSet<>();
    private volatile boolean closed;

    /**
     * Stages assignments of a snapshot that is not yet published.
     */
    protected abstract void stage(int snapshotId, Collection<ClusterAssignment> assignments);

    protected abstract Optional<ClusterAssignment> load(int snapshotId, String entityId);

    protected abstract CursorPage<ClusterAssignment> loadRange(int snapshotId, EntityNamespace namespace,
                                                               String afterEntityId, int limit);

    /**
     * Makes a fully staged snapshot durable and visible in a single atomic step.
     *
     * @param churn churn of the producing iteration, NaN if none
     */
    protected abstract void publish(int snapshotId, double churn);

    protected abstract void unpublish(int snapshotId);

    /**
     * Physically removes the data of a snapshot, published or not.
     */
    protected abstract void drop(int snapshotId);

    protected abstract void closeResources();

    /**
     * Registers snapshots found committed when a persistent store is reopened,
     * with their recorded churn (NaN if none).
     */
    protected void restoreCommitted(Map<Integer, Double> churnBySnapshot) {
        synchronized (lock) {
            churnBySnapshot.forEach((id, churn) -> {
                committed.add(id);
                if (!Double.isNaN(churn)) {
                    churns.put(id, churn);
                }
            });
        }
    }

    @Override
    public SnapshotWriter beginSnapshot(int snapshotId) {
        ensureOpen();
        synchronized (lock) {
            if (committed.contains(snapshotId)) {
                throw new IllegalStateException("Snapshot " + snapshotId + " is already committed");
            }
            if (inProgress.contains(snapshotId) || pendingDrop.contains(snapshotId)) {
                throw new IllegalStateException("Snapshot " + snapshotId + " is still in use");
            }
            drop(snapshotId);
            inProgress.add(snapshotId);
        }
        log.debug("snapshot.begin id={}", snapshotId);
        return new StagingWriter(snapshotId);
    }

    @Override
    public SnapshotReader openSnapshot(int snapshotId) {
        ensureOpen();
        synchronized (lock) {
            if (!committed.contains(snapshotId)) {
                throw new IllegalStateException("Snapshot " + snapshotId + " is not committed");
            }
            openReaders.merge(snapshotId, 1, Integer::sum);
        }
        return new CommittedReader(snapshotId);
    }

    @Override
    public boolean isCommitted(int snapshotId) {
        synchronized (lock) {
            return committed.contains(snapshotId);
        }
    }

    @Override
    public OptionalInt latestIteration() {
        synchronized (lock) {
            Integer latest = committed.lower(RESOLVED);
            return latest != null ? OptionalInt.of(latest) : OptionalInt.empty();
        }
    }

    @Override
    public OptionalDouble churnOf(int snapshotId) {
        synchronized (lock) {
            Double churn = committed.contains(snapshotId) ? churns.get(snapshotId) : null;
            return churn != null ? OptionalDouble.of(churn) : OptionalDouble.empty();
        }
    }

    @Override
    public List<Integer> committedSnapshots() {
        synchronized (lock) {
            return List.copyOf(committed);
        }
    }

    @Override
    public void discard(int snapshotId) {
        ensureOpen();
        synchronized (lock) {
            if (!committed.remove(snapshotId)) {
                return;
            }
            churns.remove(snapshotId);
            unpublish(snapshotId);
            if (openReaders.getOrDefault(snapshotId, 0) > 0) {
                pendingDrop.add(snapshotId);
                log.debug("snapshot.discard.deferred id={} readers={}", snapshotId, openReaders.get(snapshotId));
                return;
            }
            drop(snapshotId);
        }
        log.debug("snapshot.discarded id={}", snapshotId);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        closeResources();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Assignment store is closed");
        }
    }

    private void releaseReader(int snapshotId) {
        synchronized (lock) {
            int remaining = openReaders.merge(snapshotId, -1, Integer::sum);
            if (remaining > 0) {
                return;
            }
            openReaders.remove(snapshotId);
            if (pendingDrop.remove(snapshotId) && !closed) {
                drop(snapshotId);
                log.debug("snapshot.discarded id={} (last reader closed)", snapshotId);
            }
        }
    }

    private final class CommittedReader implements SnapshotReader {
        private final int snapshotId;
        private boolean released;

        private CommittedReader(int snapshotId) {
            this.snapshotId = snapshotId;
        }

        @Override
        public int snapshotId() {
            return snapshotId;
        }

        @Override
        public Optional<ClusterAssignment> get(String entityId) {
            return load(snapshotId, entityId);
        }

        @Override
        public CursorPage<ClusterAssignment> scan(EntityNamespace namespace, String afterEntityId, int limit) {
            return loadRange(snapshotId, namespace, afterEntityId, limit);
        }

        @Override
        public synchronized void close() {
            if (!released) {
                released = true;
                releaseReader(snapshotId);
            }
        }
    }

    private final class StagingWriter implements SnapshotWriter {
        private final int snapshotId;
        private final Set<EntityNamespace> sealed = EnumSet.noneOf(EntityNamespace.class);
        private volatile boolean finished;

        private StagingWriter(int snapshotId) {
            this.snapshotId = snapshotId;
        }

        @Override
        public int snapshotId() {
            return snapshotId;
        }

        @Override
        public void write(Collection<ClusterAssignment> assignments) {
            if (finished) {
                throw new IllegalStateException("Snapshot " + snapshotId + " is no longer writable");
            }
            Set<EntityNamespace> sealedNow = sealedNamespaces();
            if (!sealedNow.isEmpty()) {
                for (ClusterAssignment a : assignments) {
                    EntityNamespace ns = EntityNamespace.of(a.entityId());
                    if (sealedNow.contains(ns)) {
                        throw new IllegalStateException(
                                "Namespace " + ns + " of snapshot " + snapshotId + " is sealed");
                    }
                }
            }
            stage(snapshotId, assignments);
        }

        @Override
        public void seal(EntityNamespace namespace) {
            synchronized (sealed) {
                sealed.add(namespace);
            }
        }

        @Override
        public boolean isSealed(EntityNamespace namespace) {
            synchronized (sealed) {
                return sealed.contains(namespace);
            }
        }

        @Override
        public SnapshotReader sealedView() {
            return new SnapshotReader() {
                @Override
                public int snapshotId() {
                    return snapshotId;
                }

                @Override
                public Optional<ClusterAssignment> get(String entityId) {
                    requireSealed(EntityNamespace.of(entityId));
                    return load(snapshotId, entityId);
                }

                @Override
                public CursorPage<ClusterAssignment> scan(EntityNamespace namespace, String afterEntityId, int limit) {
                    requireSealed(namespace);
                    return loadRange(snapshotId, namespace, afterEntityId, limit);
                }

                @Override
                public void close() {
                }
            };
        }

        @Override
        public void commit() {
            commit(Double.NaN);
        }

        @Override
        public void commit(double churn) {
            if (finished) {
                throw new IllegalStateException("Snapshot " + snapshotId + " is already finished");
            }
            for (EntityNamespace ns : EntityNamespace.values()) {
                seal(ns);
            }
            synchronized (lock) {
                publish(snapshotId, churn);
                committed.add(snapshotId);
                if (!Double.isNaN(churn)) {
                    churns.put(snapshotId, churn);
                }
                inProgress.remove(snapshotId);
            }
            finished = true;
            log.debug("snapshot.committed id={} churn={}", snapshotId, churn);
        }

        @Override
        public void abort() {
            if (finished) {
                return;
            }
            finished = true;
            synchronized (lock) {
                inProgress.remove(snapshotId);
                if (!closed) {
                    drop(snapshotId);
                }
            }
            log.debug("snapshot.aborted id={}", snapshotId);
        }

        @Override
        public void close() {
            abort();
        }

        private Set<EntityNamespace> sealedNamespaces() {
            synchronized (sealed) {
                return sealed.isEmpty() ? Set.of() : EnumSet.copyOf(sealed);
            }
        }

        private void requireSealed(EntityNamespace namespace) {
            if (!isSealed(namespace)) {
                throw new IllegalStateException(
                        "Namespace " + namespace + " of snapshot " + snapshotId + " is still being written");
            }
        }
    }

    /**
     * Builds a page from an ordered candidate list that holds at most {@code limit + 1} items.
     */
    protected static CursorPage<ClusterAssignment> toPage(List<ClusterAssignment> candidates, int limit) {
        boolean hasMore = candidates.size() > limit;
        List<ClusterAssignment> content = hasMore ? new ArrayList<>(candidates.subList(0, limit)) : candidates;
        String cursor = content.isEmpty() ? null : content.get(content.size() - 1).entityId();
        return new CursorPage<>(content, cursor, hasMore);
    }
}
