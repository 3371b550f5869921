package org.carball.querylens.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * End-of-request view over every query tracked for one request.
 */
public record RequestSummary(
        @JsonProperty("request_id") String requestId,
        @JsonProperty("total_queries") int totalQueries,
        @JsonProperty("total_time_ms") double totalTimeMs,
        @JsonProperty("request_duration_ms") long requestDurationMs,
        @JsonProperty("slow_queries_count") int slowQueriesCount,
        @JsonProperty("n_plus_one_count") int nPlusOneCount,
        @JsonProperty("slow_queries") List<SlowQuerySummary> slowQueries,
        @JsonProperty("n_plus_one_patterns") List<NPlusOnePattern> nPlusOnePatterns,
        @JsonProperty("detected_patterns") List<DetectedPattern> detectedPatterns,
        @JsonProperty("queries") List<QueryRecord> queries
) {

    public static RequestSummary empty() {
        return new RequestSummary(null, 0, 0.0, 0L, 0, 0, List.of(), List.of(), List.of(), List.of());
    }
}
