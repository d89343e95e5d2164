package com.interaction.clustering.core.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Cluster assignment of one entity within a snapshot: exactly one primary membership
 * and zero or more duplicate memberships in other clusters.
 *
 * <p>Duplicates are kept ordered by cluster id so that serialized snapshots are
 * byte-for-byte reproducible.</p>
 */
public record ClusterAssignment(String entityId, ClusterMembership primary, List<ClusterMembership> duplicates) {

    private static final Comparator<ClusterMembership> BY_CLUSTER =
            Comparator.comparing(ClusterMembership::clusterId);

    public ClusterAssignment {
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(primary, "primary membership is required");
        if (!primary.isPrimary()) {
            throw new IllegalArgumentException("primary membership must have role PRIMARY");
        }
        List<ClusterMembership> sorted = new ArrayList<>(duplicates != null ? duplicates : List.of());
        sorted.sort(BY_CLUSTER);
        Set<String> seen = new HashSet<>();
        seen.add(primary.clusterId());
        for (ClusterMembership d : sorted) {
            if (d.isPrimary()) {
                throw new IllegalArgumentException("Entity " + entityId + " has more than one primary membership");
            }
            if (!seen.add(d.clusterId())) {
                throw new IllegalArgumentException(
                        "Entity " + entityId + " is assigned to cluster " + d.clusterId() + " more than once");
            }
        }
        duplicates = List.copyOf(sorted);
    }

    /**
     * Creates a seed assignment: a single primary membership with no vote weight.
     */
    public static ClusterAssignment seed(String entityId, String clusterId) {
        return new ClusterAssignment(entityId, ClusterMembership.primary(clusterId, 0), List.of());
    }

    public static ClusterAssignment primaryOnly(String entityId, String clusterId, long weight) {
        return new ClusterAssignment(entityId, ClusterMembership.primary(clusterId, weight), List.of());
    }

    public String primaryClusterId() {
        return primary.clusterId();
    }

    public boolean hasDuplicates() {
        return !duplicates.isEmpty();
    }

    /**
     * Returns a copy with a new primary cluster, keeping the duplicates that do not collide with it.
     */
    public ClusterAssignment withPrimary(String clusterId, long weight) {
        List<ClusterMembership> kept = new ArrayList<>(duplicates.size());
        for (ClusterMembership d : duplicates) {
            if (!d.clusterId().equals(clusterId)) {
                kept.add(d);
            }
        }
        return new ClusterAssignment(entityId, ClusterMembership.primary(clusterId, weight), kept);
    }

    /**
     * Returns a copy with the given duplicate memberships replacing the current ones.
     */
    public ClusterAssignment withDuplicates(List<ClusterMembership> newDuplicates) {
        return new ClusterAssignment(entityId, primary, newDuplicates);
    }

    /**
     * Returns all memberships, primary first.
     */
    public List<ClusterMembership> memberships() {
        List<ClusterMembership> all = new ArrayList<>(duplicates.size() + 1);
        all.add(primary);
        all.addAll(duplicates);
        return all;
    }

    /**
     * Returns the ids of every cluster this entity belongs to, primary first.
     */
    public Set<String> clusterIds() {
        Set<String> ids = new LinkedHashSet<>();
        ids.add(primary.clusterId());
        for (ClusterMembership d : duplicates) {
            ids.add(d.clusterId());
        }
        return ids;
    }

    public boolean isMemberOf(String clusterId) {
        if (primary.clusterId().equals(clusterId)) {
            return true;
        }
        for (ClusterMembership d : duplicates) {
            if (d.clusterId().equals(clusterId)) {
                return true;
            }
        }
        return false;
    }
}
