package com.interaction.clustering.bulk;

import com.interaction.clustering.core.exception.MalformedRecordException;
import com.interaction.clustering.core.model.InteractionRecord;

import java.util.Iterator;
import java.util.Optional;

/**
 * Pull-based stream of interaction records.
 *
 * <p>{@link #next()} throws {@link MalformedRecordException} for a unit that cannot be
 * parsed; the unit is consumed, so the caller may skip it and keep reading.</p>
 */
public interface InteractionSource extends AutoCloseable {

    /**
     * Returns the next record, or empty once the source is exhausted.
     *
     * @throws MalformedRecordException if the next unit is malformed
     */
    Optional<InteractionRecord> next();

    /**
     * Returns the 1-based position (line number or element index) of the unit last returned.
     */
    long position();

    @Override
    default void close() {
    }

    /**
     * Adapts an in-memory collection of records.
     */
    static InteractionSource of(Iterable<InteractionRecord> records) {
        Iterator<InteractionRecord> it = records.iterator();
        return new InteractionSource() {
            private long position;

            @Override
            public Optional<InteractionRecord> next() {
                if (!it.hasNext()) {
                    return Optional.empty();
                }
                position++;
                return Optional.of(it.next());
            }

            @Override
            public long position() {
                return position;
            }
        };
    }
}
