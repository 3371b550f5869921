package org.carball.querylens.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;
import java.util.List;

/**
 * Aggregates computed over one day of the persisted query log.
 */
public record LogAnalysis(
        @JsonProperty("date") LocalDate date,
        @JsonProperty("total_queries") int totalQueries,
        @JsonProperty("total_time_ms") double totalTimeMs,
        @JsonProperty("average_time_ms") double averageTimeMs,
        @JsonProperty("slow_queries_count") int slowQueriesCount,
        @JsonProperty("n_plus_one_count") int nPlusOneCount,
        @JsonProperty("slow_queries") List<QueryRecord> slowQueries,
        @JsonProperty("n_plus_one_queries") List<QueryRecord> nPlusOneQueries
) {}
