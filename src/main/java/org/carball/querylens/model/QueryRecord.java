package org.carball.querylens.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A single tracked query execution, as persisted to the query log. Instances are
 * immutable; the pattern tracker returns an enriched copy via {@link #toBuilder()}.
 */
@Builder(toBuilder = true)
public record QueryRecord(
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("request_id") String requestId,
        @JsonProperty("connection") String connection,
        @JsonProperty("sql") String sql,
        @JsonProperty("bindings") List<Object> bindings,
        @JsonProperty("time_ms") double timeMs,
        @JsonProperty("metadata") RequestMetadata metadata,
        @JsonProperty("normalized_sql") String normalizedSql,
        @JsonProperty("query_hash") String queryHash,
        @JsonProperty("formatted_sql") String formattedSql,
        @JsonProperty("backtrace") List<Frame> backtrace,
        @JsonProperty("backtrace_error") String backtraceError,
        @JsonProperty("source") String source,
        @JsonProperty("slow_query") boolean slowQuery,
        @JsonProperty("n_plus_one") NPlusOnePattern nPlusOne,
        @JsonProperty("explain") ExecutionPlan explain,
        @JsonProperty("explain_analyze") ExecutionPlan explainAnalyze,
        @JsonProperty("issues") List<QueryIssue> issues
) {

    public QueryRecord {
        bindings = bindings == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(bindings));
        backtrace = backtrace == null ? List.of() : List.copyOf(backtrace);
        issues = issues == null ? List.of() : List.copyOf(issues);
        metadata = metadata == null ? RequestMetadata.empty() : metadata;
    }

    public boolean hasNPlusOne() {
        return nPlusOne != null;
    }

    public String route() {
        return metadata.routeOrUnknown();
    }
}
