package org.carball.querylens.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SlowQuerySummary(
        @JsonProperty("sql") String sql,
        @JsonProperty("time_ms") double timeMs,
        @JsonProperty("formatted_sql") String formattedSql,
        @JsonProperty("explain") ExecutionPlan explain
) {

    public static SlowQuerySummary from(QueryRecord record) {
        return new SlowQuerySummary(record.sql(), record.timeMs(), record.formattedSql(), record.explain());
    }
}
