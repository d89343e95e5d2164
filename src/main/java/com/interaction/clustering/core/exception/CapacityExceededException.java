package com.interaction.clustering.core.exception;

/**
 * External storage is full. Never retried.
 */
public class CapacityExceededException extends ClusteringException {

    public CapacityExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
