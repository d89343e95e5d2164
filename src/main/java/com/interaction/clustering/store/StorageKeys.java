package com.interaction.clustering.store;

import com.interaction.clustering.core.model.EntityNamespace;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Key layout of the RocksDB-backed stores. Entity ids never contain control characters,
 * so {@code \0} separates key components and keeps byte order equal to entity id order.
 *
 * <pre>
 * a\0{entityId}\0{neighborId}        -> edge weight (8 bytes)
 * s\0{snapshotId:%010d}\0{entityId}  -> encoded ClusterAssignment
 * m\0snapshot\0{snapshotId:%010d}    -> commit marker
 * m\0adjacency.frozen                -> adjacency summary (4 x 8 bytes)
 * </pre>
 */
final class StorageKeys {

    static final char SEP = '\0';
    static final String ADJACENCY = "a" + SEP;
    static final String SNAPSHOT = "s" + SEP;
    static final String COMMIT_MARKER = "m" + SEP + "snapshot" + SEP;
    static final byte[] ADJACENCY_START = bytes(ADJACENCY);
    static final byte[] ADJACENCY_END = bytes("a" + '\u0001');
    static final byte[] ADJACENCY_FROZEN = bytes("m" + SEP + "adjacency.frozen");

    private StorageKeys() {
    }

    static byte[] edge(String entityId, String neighborId) {
        return bytes(ADJACENCY + entityId + SEP + neighborId);
    }

    static byte[] adjacencyOf(String entityId) {
        return bytes(ADJACENCY + entityId + SEP);
    }

    static byte[] adjacencyNamespace(EntityNamespace namespace) {
        return bytes(ADJACENCY + namespace.keyPrefix());
    }

    /**
     * Smallest adjacency key of any entity ordered after {@code entityId}.
     */
    static byte[] adjacencyAfter(String entityId) {
        return bytes(ADJACENCY + entityId + '\u0001');
    }

    static String snapshotPrefixString(int snapshotId) {
        return SNAPSHOT + String.format("%010d", snapshotId) + SEP;
    }

    static byte[] snapshotPrefix(int snapshotId) {
        return bytes(snapshotPrefixString(snapshotId));
    }

    /**
     * Exclusive upper bound of every key of a snapshot.
     */
    static byte[] snapshotEnd(int snapshotId) {
        return bytes(SNAPSHOT + String.format("%010d", snapshotId) + '\u0001');
    }

    static byte[] assignment(int snapshotId, String entityId) {
        return bytes(snapshotPrefixString(snapshotId) + entityId);
    }

    static byte[] snapshotNamespace(int snapshotId, EntityNamespace namespace) {
        return bytes(snapshotPrefixString(snapshotId) + namespace.keyPrefix());
    }

    static byte[] assignmentAfter(int snapshotId, String entityId) {
        return bytes(snapshotPrefixString(snapshotId) + entityId + SEP);
    }

    static byte[] commitMarker(int snapshotId) {
        return bytes(COMMIT_MARKER + String.format("%010d", snapshotId));
    }

    static int snapshotIdOf(byte[] key, int prefixLength) {
        return Integer.parseInt(new String(key, prefixLength, 10, StandardCharsets.UTF_8));
    }

    static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    static String string(byte[] value, int offset) {
        return new String(value, offset, value.length - offset, StandardCharsets.UTF_8);
    }

    static boolean startsWith(byte[] array, byte[] prefix) {
        if (array.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (array[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    static byte[] encodeLong(long value) {
        return ByteBuffer.allocate(Long.BYTES).putLong(value).array();
    }

    static long decodeLong(byte[] value) {
        return ByteBuffer.wrap(value).getLong();
    }
}
