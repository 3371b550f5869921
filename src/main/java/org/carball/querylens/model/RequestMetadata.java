package org.carball.querylens.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Request-level attributes attached to every query of a request. Each field
 * except route and method can be switched off in the configuration.
 */
@Builder(toBuilder = true)
public record RequestMetadata(
        @JsonProperty("route") String route,
        @JsonProperty("method") String method,
        @JsonProperty("user_id") String userId,
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("ip") String ip,
        @JsonProperty("user_agent") String userAgent,
        @JsonProperty("memory_mb") Double memoryMb
) {

    public static RequestMetadata empty() {
        return RequestMetadata.builder().build();
    }

    public String routeOrUnknown() {
        return route != null ? route : "unknown";
    }
}
