package com.interaction.clustering.core.exception;

/**
 * Thrown for an input unit that cannot be turned into a valid interaction record.
 * Recoverable: the adjacency builder skips and counts it unless strict mode is enabled.
 */
public class MalformedRecordException extends ClusteringException {

    private final long lineNumber;

    public MalformedRecordException(long lineNumber, String message) {
        super("line " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    public MalformedRecordException(long lineNumber, String message, Throwable cause) {
        super("line " + lineNumber + ": " + message, cause);
        this.lineNumber = lineNumber;
    }

    /**
     * Returns the 1-based position of the offending unit in its source, or 0 if unknown.
     */
    public long getLineNumber() {
        return lineNumber;
    }
}
