package com.interaction.clustering.store;

/**
 * A storage operation that may fail with a backend-specific checked exception.
 */
@FunctionalInterface
public interface StorageCall<T> {

    T call() throws Exception;
}
