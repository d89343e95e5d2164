package com.interaction.clustering.core.model;

import java.util.Objects;

/**
 * Membership of one entity in one cluster.
 *
 * @param clusterId the cluster id
 * @param role      primary or duplicate
 * @param weight    vote weight backing this membership (0 for seed assignments)
 */
public record ClusterMembership(String clusterId, ClusterRole role, long weight) {

    public ClusterMembership {
        Objects.requireNonNull(clusterId, "clusterId is required");
        Objects.requireNonNull(role, "role is required");
        if (weight < 0) {
            throw new IllegalArgumentException("weight must be >= 0");
        }
    }

    public static ClusterMembership primary(String clusterId, long weight) {
        return new ClusterMembership(clusterId, ClusterRole.PRIMARY, weight);
    }

    public static ClusterMembership duplicate(String clusterId, long weight) {
        return new ClusterMembership(clusterId, ClusterRole.DUPLICATE, weight);
    }

    public boolean isPrimary() {
        return role == ClusterRole.PRIMARY;
    }
}
