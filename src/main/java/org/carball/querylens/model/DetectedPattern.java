package org.carball.querylens.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A normalized query whose execution count reached the N+1 threshold in the
 * current request, regardless of whether the time window or binding checks held.
 */
public record DetectedPattern(
        @JsonProperty("query_hash") String queryHash,
        @JsonProperty("query_pattern") String queryPattern,
        @JsonProperty("count") int count,
        @JsonProperty("distinct_binding_sets") int distinctBindingSets
) {}
