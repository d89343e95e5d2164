package com.interaction.clustering.report;

import com.interaction.clustering.core.model.ClusterRole;

/**
 * One output row: an entity's membership in one cluster.
 */
public record AssignmentRow(String entityId, String clusterId, ClusterRole role, long voteWeight) {
}
