package com.interaction.clustering.core.exception;

/**
 * Invalid configuration value. Raised while options are built, before any processing starts.
 */
public class ConfigurationException extends ClusteringException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
