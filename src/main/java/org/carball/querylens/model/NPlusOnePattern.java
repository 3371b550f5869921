package org.carball.querylens.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An N+1 storm detected for one normalized query within one request.
 */
public record NPlusOnePattern(
        @JsonProperty("query_pattern") String queryPattern,
        @JsonProperty("count") int count,
        @JsonProperty("route") String route,
        @JsonProperty("location") String location,
        @JsonProperty("suggestion") String suggestion
) {}
