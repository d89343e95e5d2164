package com.interaction.clustering.core.exception;

/**
 * External storage could not be read or written. Transient failures are retried
 * before this is thrown; once thrown it is fatal for the run.
 */
public class StorageIOException extends ClusteringException {

    public StorageIOException(String message) {
        super(message);
    }

    public StorageIOException(String message, Throwable cause) {
        super(message, cause);
    }
}
