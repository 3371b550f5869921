package org.carball.querylens.output;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.querylens.config.QueryLensConfig;
import org.carball.querylens.model.RequestSummary;
import org.carball.querylens.storage.QueryLogJson;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Builds what a host adds to an HTTP response when it exposes the request
 * summary: a body entry under the configured key and two headers.
 */
public class ResponseSummaryInjector {

    public static final String QUERY_COUNT_HEADER = "X-Query-Count";
    public static final String QUERY_TIME_HEADER = "X-Query-Time-Ms";

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    private final QueryLensConfig config;
    private final ObjectMapper objectMapper;

    public ResponseSummaryInjector(QueryLensConfig config) {
        this.config = config;
        this.objectMapper = QueryLogJson.newMapper();
    }

    /**
     * Injection happens when it is switched on in the configuration or requested
     * explicitly for this request.
     */
    public boolean shouldInject(boolean requestedForRequest) {
        return config.isEnabled() && (config.isInjectInResponse() || requestedForRequest);
    }

    /**
     * Summary as a JSON-ready map; the per-query list is only included when the
     * configuration asks for full output.
     */
    public Map<String, Object> payload(RequestSummary summary) {
        Map<String, Object> payload = objectMapper.convertValue(summary, JSON_OBJECT);
        if (!config.isIncludeFullQueriesInResponse()) {
            payload.remove("queries");
        }
        return payload;
    }

    /**
     * Copy of the response body with the summary added under the response key.
     */
    public Map<String, Object> inject(Map<String, Object> responseBody, RequestSummary summary) {
        Map<String, Object> body = new LinkedHashMap<>(responseBody);
        body.put(config.getResponseKey(), payload(summary));
        return body;
    }

    public Map<String, String> headers(RequestSummary summary) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(QUERY_COUNT_HEADER, String.valueOf(summary.totalQueries()));
        headers.put(QUERY_TIME_HEADER, String.format(Locale.ROOT, "%.2f", summary.totalTimeMs()));
        return headers;
    }
}
