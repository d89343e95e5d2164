package com.interaction.clustering.report;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Streamable final mapping, visited in ascending entity id order with each entity's
 * primary row before its duplicate rows.
 */
@FunctionalInterface
public interface AssignmentRows {

    void forEach(Consumer<AssignmentRow> action);

    /**
     * Materializes every row. Only meant for small results.
     */
    default List<AssignmentRow> toList() {
        List<AssignmentRow> rows = new ArrayList<>();
        forEach(rows::add);
        return rows;
    }
}
