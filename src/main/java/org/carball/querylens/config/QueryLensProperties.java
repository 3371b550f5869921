package org.carball.querylens.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * YAML binding of the configuration file. Every section is optional; missing
 * values keep the defaults of {@link QueryLensConfig}.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryLensProperties {

    @JsonProperty("enabled")
    private Boolean enabled;

    @JsonProperty("connections")
    private List<String> connections;

    @JsonProperty("slow_query_threshold")
    private Double slowQueryThreshold;

    @JsonProperty("analyze_queries")
    private Boolean analyzeQueries;

    @JsonProperty("analyze_all_queries")
    private Boolean analyzeAllQueries;

    @JsonProperty("explain_analyze")
    private Boolean explainAnalyze;

    @JsonProperty("explain_analyze_all_queries")
    private Boolean explainAnalyzeAllQueries;

    @JsonProperty("sampling")
    private Integer sampling;

    @JsonProperty("exclude_patterns")
    private List<String> excludePatterns;

    @JsonProperty("n_plus_one_detection")
    private NPlusOne nPlusOneDetection = new NPlusOne();

    @JsonProperty("storage")
    private Storage storage = new Storage();

    @JsonProperty("alerts")
    private Alerts alerts = new Alerts();

    @JsonProperty("backtrace")
    private Backtrace backtrace = new Backtrace();

    @JsonProperty("metadata")
    private Metadata metadata = new Metadata();

    @JsonProperty("response")
    private Response response = new Response();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NPlusOne {
        @JsonProperty("enabled")
        private Boolean enabled;

        @JsonProperty("threshold")
        private Integer threshold;

        @JsonProperty("time_window_ms")
        private Long timeWindowMs;

        @JsonProperty("alert_mode")
        private NPlusOneAlertMode alertMode;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Storage {
        @JsonProperty("path")
        private String path;

        @JsonProperty("max_file_size_mb")
        private Long maxFileSizeMb;

        @JsonProperty("retention_days")
        private Integer retentionDays;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Alerts {
        @JsonProperty("enabled")
        private Boolean enabled;

        @JsonProperty("channels")
        private List<String> channels;

        @JsonProperty("slow_query")
        private Boolean slowQuery;

        @JsonProperty("n_plus_one")
        private Boolean nPlusOne;

        @JsonProperty("query_count_threshold")
        private Integer queryCountThreshold;

        @JsonProperty("webhook_url")
        private String webhookUrl;

        @JsonProperty("webhook_timeout_ms")
        private Long webhookTimeoutMs;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Backtrace {
        @JsonProperty("enabled")
        private Boolean enabled;

        @JsonProperty("limit")
        private Integer limit;

        @JsonProperty("exclude_prefixes")
        private List<String> excludePrefixes;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Metadata {
        @JsonProperty("user_id")
        private Boolean userId;

        @JsonProperty("tenant_id")
        private Boolean tenantId;

        @JsonProperty("ip")
        private Boolean ip;

        @JsonProperty("user_agent")
        private Boolean userAgent;

        @JsonProperty("memory_usage")
        private Boolean memoryUsage;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Response {
        @JsonProperty("inject")
        private Boolean inject;

        @JsonProperty("key")
        private String key;

        @JsonProperty("include_full_queries")
        private Boolean includeFullQueries;
    }

    /**
     * Overlays the values present in this file onto the given builder.
     */
    public QueryLensConfig.QueryLensConfigBuilder applyTo(QueryLensConfig.QueryLensConfigBuilder builder) {
        if (enabled != null) builder.enabled(enabled);
        if (connections != null) builder.connections(new ArrayList<>(connections));
        if (slowQueryThreshold != null) builder.slowQueryThresholdMs(slowQueryThreshold);
        if (analyzeQueries != null) builder.analyzeSlowQueries(analyzeQueries);
        if (analyzeAllQueries != null) builder.analyzeAllQueries(analyzeAllQueries);
        if (explainAnalyze != null) builder.explainAnalyze(explainAnalyze);
        if (explainAnalyzeAllQueries != null) builder.explainAnalyzeAllQueries(explainAnalyzeAllQueries);
        if (sampling != null) builder.samplingPercent(sampling);
        if (excludePatterns != null) builder.excludePatterns(new ArrayList<>(excludePatterns));

        if (nPlusOneDetection != null) {
            if (nPlusOneDetection.getEnabled() != null) builder.nPlusOneEnabled(nPlusOneDetection.getEnabled());
            if (nPlusOneDetection.getThreshold() != null) builder.nPlusOneThreshold(nPlusOneDetection.getThreshold());
            if (nPlusOneDetection.getTimeWindowMs() != null) builder.nPlusOneTimeWindowMs(nPlusOneDetection.getTimeWindowMs());
            if (nPlusOneDetection.getAlertMode() != null) builder.nPlusOneAlertMode(nPlusOneDetection.getAlertMode());
        }

        if (storage != null) {
            if (storage.getPath() != null) builder.storagePath(Paths.get(storage.getPath()));
            if (storage.getMaxFileSizeMb() != null) builder.maxFileSizeBytes(storage.getMaxFileSizeMb() * 1024 * 1024);
            if (storage.getRetentionDays() != null) builder.retentionDays(storage.getRetentionDays());
        }

        if (alerts != null) {
            if (alerts.getEnabled() != null) builder.alertsEnabled(alerts.getEnabled());
            if (alerts.getChannels() != null) builder.alertChannels(new ArrayList<>(alerts.getChannels()));
            if (alerts.getSlowQuery() != null) builder.alertOnSlowQuery(alerts.getSlowQuery());
            if (alerts.getNPlusOne() != null) builder.alertOnNPlusOne(alerts.getNPlusOne());
            if (alerts.getQueryCountThreshold() != null) builder.queryCountThreshold(alerts.getQueryCountThreshold());
            if (alerts.getWebhookUrl() != null) builder.webhookUrl(alerts.getWebhookUrl());
            if (alerts.getWebhookTimeoutMs() != null) builder.webhookTimeoutMs(alerts.getWebhookTimeoutMs());
        }

        if (backtrace != null) {
            if (backtrace.getEnabled() != null) builder.backtraceEnabled(backtrace.getEnabled());
            if (backtrace.getLimit() != null) builder.backtraceLimit(backtrace.getLimit());
            if (backtrace.getExcludePrefixes() != null) builder.backtraceExcludePrefixes(new ArrayList<>(backtrace.getExcludePrefixes()));
        }

        if (metadata != null) {
            if (metadata.getUserId() != null) builder.collectUserId(metadata.getUserId());
            if (metadata.getTenantId() != null) builder.collectTenantId(metadata.getTenantId());
            if (metadata.getIp() != null) builder.collectIp(metadata.getIp());
            if (metadata.getUserAgent() != null) builder.collectUserAgent(metadata.getUserAgent());
            if (metadata.getMemoryUsage() != null) builder.collectMemoryUsage(metadata.getMemoryUsage());
        }

        if (response != null) {
            if (response.getInject() != null) builder.injectInResponse(response.getInject());
            if (response.getKey() != null) builder.responseKey(response.getKey());
            if (response.getIncludeFullQueries() != null) builder.includeFullQueriesInResponse(response.getIncludeFullQueries());
        }

        return builder;
    }
}
