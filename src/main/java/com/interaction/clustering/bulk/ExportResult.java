package com.interaction.clustering.bulk;

/**
 * Result of exporting the final mapping.
 *
 * @param totalRows     rows written
 * @param primaryRows   rows with role primary
 * @param duplicateRows rows with role duplicate
 */
public record ExportResult(long totalRows, long primaryRows, long duplicateRows) {

    @Override
    public String toString() {
        return "ExportResult{rows=" + totalRows +
                ", primary=" + primaryRows +
                ", duplicate=" + duplicateRows + '}';
    }
}
