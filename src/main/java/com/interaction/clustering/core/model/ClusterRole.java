package com.interaction.clustering.core.model;

/**
 * Role of an entity inside a cluster.
 */
public enum ClusterRole {
    PRIMARY("primary"),
    DUPLICATE("duplicate");

    private final String label;

    ClusterRole(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
