package com.interaction.clustering.store;

import com.interaction.clustering.core.model.ClusterAssignment;
import com.interaction.clustering.core.model.EntityNamespace;

import java.util.Collection;

/**
 * Builds one assignment snapshot. Nothing written here is visible to
 * {@link AssignmentStore#openSnapshot(int)} until {@link #commit()} succeeds.
 *
 * <p>{@link #write} may be called concurrently from several workers. A namespace can be
 * sealed once all of its entities are written; sealed namespaces reject further writes and
 * become readable through {@link #sealedView()}.</p>
 */
public interface SnapshotWriter extends AutoCloseable {

    int snapshotId();

    /**
     * Stages assignments. An entity written twice keeps its last assignment.
     *
     * @throws IllegalStateException if an assignment belongs to a sealed namespace
     *                               or the writer is already committed or aborted
     */
    void write(Collection<ClusterAssignment> assignments);

    /**
     * Freezes one namespace of the snapshot under construction.
     */
    void seal(EntityNamespace namespace);

    boolean isSealed(EntityNamespace namespace);

    /**
     * Returns a reader over the sealed namespaces of this snapshot.
     * Lookups into an unsealed namespace fail with {@link IllegalStateException}.
     */
    SnapshotReader sealedView();

    /**
     * Seals any open namespace and atomically publishes the snapshot.
     */
    void commit();

    /**
     * Commits like {@link #commit()} and records {@code churn}, the share of entities whose
     * primary cluster changed in the iteration that produced this snapshot.
     */
    void commit(double churn);

    /**
     * Drops everything staged by this writer.
     */
    void abort();

    /**
     * Aborts the snapshot unless it was committed.
     */
    @Override
    void close();
}
