package org.carball.querylens.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Result of running a plan-introspection variant of a statement. Either carries
 * the plan rows or the error message(s) the database returned.
 */
public record ExecutionPlan(
        @JsonProperty("format") String format,
        @JsonProperty("rows") List<Map<String, Object>> rows,
        @JsonProperty("error") String error,
        @JsonProperty("fallback_error") String fallbackError
) {

    public static ExecutionPlan of(String format, List<Map<String, Object>> rows) {
        return new ExecutionPlan(format, rows, null, null);
    }

    public static ExecutionPlan failed(String error) {
        return new ExecutionPlan(null, null, error, null);
    }

    public static ExecutionPlan failed(String error, String fallbackError) {
        return new ExecutionPlan(null, null, error, fallbackError);
    }

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }
}
