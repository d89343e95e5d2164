package com.interaction.clustering.adjacency;

import java.util.List;

/**
 * Result of building the adjacency mappings from an interaction stream.
 *
 * @param recordsRead     units read from the source, malformed ones included
 * @param recordsAccepted records merged into the adjacency
 * @param recordsSkipped  malformed units that were skipped
 * @param cardholders     distinct cardholders
 * @param merchants       distinct merchants
 * @param distinctEdges   distinct cardholder-merchant pairs
 * @param totalEdgeWeight sum of all edge weights
 * @param errorSamples    the first malformed units, with their positions
 */
public record AdjacencyStats(
        long recordsRead,
        long recordsAccepted,
        long recordsSkipped,
        long cardholders,
        long merchants,
        long distinctEdges,
        long totalEdgeWeight,
        List<RecordError> errorSamples
) {
    public AdjacencyStats {
        errorSamples = errorSamples != null ? List.copyOf(errorSamples) : List.of();
    }

    public long entityCount() {
        return cardholders + merchants;
    }

    public boolean hasErrors() {
        return recordsSkipped > 0;
    }

    /**
     * A malformed input unit.
     *
     * @param lineNumber position of the unit in the input (1-based)
     * @param message    why it was rejected
     */
    public record RecordError(long lineNumber, String message) {}

    @Override
    public String toString() {
        return "AdjacencyStats{read=" + recordsRead +
                ", accepted=" + recordsAccepted +
                ", skipped=" + recordsSkipped +
                ", cardholders=" + cardholders +
                ", merchants=" + merchants +
                ", edges=" + distinctEdges +
                ", weight=" + totalEdgeWeight + '}';
    }
}
