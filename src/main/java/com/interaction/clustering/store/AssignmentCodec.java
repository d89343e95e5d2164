package com.interaction.clustering.store;

import com.interaction.clustering.core.model.ClusterAssignment;
import com.interaction.clustering.core.model.ClusterMembership;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary encoding of a {@link ClusterAssignment} value (the entity id lives in the key).
 *
 * <pre>
 * primaryClusterId:UTF | primaryWeight:long | duplicateCount:int | (clusterId:UTF | weight:long)*
 * </pre>
 */
final class AssignmentCodec {

    private AssignmentCodec() {
    }

    static byte[] encode(ClusterAssignment assignment) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(64);
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeUTF(assignment.primary().clusterId());
            out.writeLong(assignment.primary().weight());
            out.writeInt(assignment.duplicates().size());
            for (ClusterMembership d : assignment.duplicates()) {
                out.writeUTF(d.clusterId());
                out.writeLong(d.weight());
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    static ClusterAssignment decode(String entityId, byte[] value) {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(value))) {
            ClusterMembership primary = ClusterMembership.primary(in.readUTF(), in.readLong());
            int count = in.readInt();
            List<ClusterMembership> duplicates = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                duplicates.add(ClusterMembership.duplicate(in.readUTF(), in.readLong()));
            }
            return new ClusterAssignment(entityId, primary, duplicates);
        } catch (IOException e) {
            throw new UncheckedIOException("Corrupt assignment value for " + entityId, e);
        }
    }
}
