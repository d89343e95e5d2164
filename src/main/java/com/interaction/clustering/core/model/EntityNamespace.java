package com.interaction.clustering.core.model;

/**
 * The two sides of the bipartite interaction graph.
 * Every entity id carries its namespace as a one-letter prefix ({@code C:} or {@code M:}).
 */
public enum EntityNamespace {
    CARDHOLDER('C'),
    MERCHANT('M');

    private final char prefix;

    EntityNamespace(char prefix) {
        this.prefix = prefix;
    }

    public char getPrefix() {
        return prefix;
    }

    /**
     * Returns the key prefix shared by every entity id of this namespace, e.g. {@code "C:"}.
     */
    public String keyPrefix() {
        return prefix + ":";
    }

    /**
     * Returns the namespace on the other side of the graph.
     */
    public EntityNamespace opposite() {
        return this == CARDHOLDER ? MERCHANT : CARDHOLDER;
    }

    /**
     * Returns the namespace of a namespaced entity id.
     *
     * @throws IllegalArgumentException if the id carries no known prefix
     */
    public static EntityNamespace of(String entityId) {
        if (entityId == null || entityId.length() < 2 || entityId.charAt(1) != ':') {
            throw new IllegalArgumentException("Not a namespaced entity id: " + entityId);
        }
        for (EntityNamespace ns : values()) {
            if (ns.prefix == entityId.charAt(0)) {
                return ns;
            }
        }
        throw new IllegalArgumentException("Unknown namespace in entity id: " + entityId);
    }
}
