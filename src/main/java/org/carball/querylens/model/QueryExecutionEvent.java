package org.carball.querylens.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A statement execution reported by the host's database layer.
 */
public record QueryExecutionEvent(
        String sql,
        List<Object> bindings,
        double elapsedMs,
        String connection
) {

    public QueryExecutionEvent {
        bindings = bindings == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(bindings));
    }
}
