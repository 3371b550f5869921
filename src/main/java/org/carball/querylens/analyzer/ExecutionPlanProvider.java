package org.carball.querylens.analyzer;

import org.carball.querylens.model.ExecutionPlan;

import java.util.List;

/**
 * Runs a plan-introspection variant of a statement against the connection that
 * executed it.
 */
@FunctionalInterface
public interface ExecutionPlanProvider {

    /**
     * @return the plan, a failed plan carrying the database error, or {@code null}
     *         when the statement is not one that can be explained
     */
    ExecutionPlan explain(String sql, List<Object> bindings, String connection, ExplainMode mode);

    static ExecutionPlanProvider none() {
        return (sql, bindings, connection, mode) -> null;
    }
}
