package com.interaction.clustering.report;

/**
 * Per-cluster figures of the final overlapping assignment.
 *
 * @param clusterId        the cluster
 * @param primaryMembers   entities with this cluster as primary
 * @param duplicateMembers entities duplicated into this cluster
 * @param internalWeight   weight of edges with both endpoints in this cluster
 * @param externalWeight   weight of edges with exactly one endpoint in this cluster
 */
public record ClusterStats(String clusterId, long primaryMembers, long duplicateMembers,
                           long internalWeight, long externalWeight) {

    public long memberCount() {
        return primaryMembers + duplicateMembers;
    }
}
