package com.interaction.clustering.tracing;

/**
 * A traced unit of the pipeline: a run, one of its stages, or one propagation iteration.
 * Ends when closed; a span closed without {@link #fail} is reported as successful.
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, double value);

    /**
     * Marks the span as failed with {@code cause}.
     */
    void fail(Throwable cause);

    @Override
    void close();
}
