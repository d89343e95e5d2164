package com.interaction.clustering.core.exception;

/**
 * Root of the clustering engine's unchecked exception hierarchy.
 */
public class ClusteringException extends RuntimeException {

    public ClusteringException(String message) {
        super(message);
    }

    public ClusteringException(String message, Throwable cause) {
        super(message, cause);
    }
}
