package com.interaction.clustering.store;

import java.util.List;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Versioned external mapping from entity id to cluster assignment. Each propagation
 * iteration writes a new snapshot addressed by its iteration number (0 is the seed);
 * a committed snapshot is immutable and never overwritten.
 *
 * <p>The overlapping assignment produced by the duplication resolver is committed under
 * the reserved id {@link #RESOLVED}.</p>
 */
public interface AssignmentStore extends AutoCloseable {

    /**
     * Snapshot id of the final overlapping assignment.
     */
    int RESOLVED = Integer.MAX_VALUE;

    /**
     * Starts a new snapshot. Left-over uncommitted data for the same id is dropped first.
     *
     * @throws IllegalStateException if the id is already committed or being written
     */
    SnapshotWriter beginSnapshot(int snapshotId);

    /**
     * Opens a reader on a committed snapshot.
     *
     * @throws IllegalStateException if the snapshot is not committed
     */
    SnapshotReader openSnapshot(int snapshotId);

    boolean isCommitted(int snapshotId);

    /**
     * Returns the highest committed iteration number, ignoring {@link #RESOLVED}.
     */
    OptionalInt latestIteration();

    /**
     * Returns the churn recorded when a propagation snapshot was committed. Empty for
     * snapshots committed without one (the seed, the resolved assignment) and for
     * snapshots that are not committed.
     */
    OptionalDouble churnOf(int snapshotId);

    /**
     * Returns the committed snapshot ids in ascending order.
     */
    List<Integer> committedSnapshots();

    /**
     * Unpublishes a snapshot. Its data is removed as soon as no reader holds it.
     */
    void discard(int snapshotId);

    @Override
    void close();
}
