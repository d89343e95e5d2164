package com.interaction.clustering.core.model;

import java.util.Objects;

/**
 * Namespaced identifier of a merchant or cardholder, rendered as {@code M:<id>} or {@code C:<id>}.
 * Stores and snapshots key entities by {@link #value()}.
 */
public record EntityId(EntityNamespace namespace, String rawId) implements Comparable<EntityId> {

    public EntityId {
        Objects.requireNonNull(namespace, "namespace is required");
        if (!isValidRawId(rawId)) {
            throw new IllegalArgumentException("Invalid raw entity id: '" + rawId + "'");
        }
    }

    public static EntityId cardholder(String rawId) {
        return new EntityId(EntityNamespace.CARDHOLDER, rawId);
    }

    public static EntityId merchant(String rawId) {
        return new EntityId(EntityNamespace.MERCHANT, rawId);
    }

    /**
     * Parses a namespaced id such as {@code "M:1234"}.
     */
    public static EntityId parse(String value) {
        EntityNamespace ns = EntityNamespace.of(value);
        return new EntityId(ns, value.substring(2));
    }

    /**
     * A raw id is usable when it is non-blank and free of control characters,
     * which the storage layer reserves as key separators.
     */
    public static boolean isValidRawId(String rawId) {
        if (rawId == null || rawId.isBlank()) {
            return false;
        }
        for (int i = 0; i < rawId.length(); i++) {
            if (Character.isISOControl(rawId.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public String value() {
        return namespace.keyPrefix() + rawId;
    }

    @Override
    public int compareTo(EntityId other) {
        return value().compareTo(other.value());
    }

    @Override
    public String toString() {
        return value();
    }
}
