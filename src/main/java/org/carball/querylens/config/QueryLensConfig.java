package org.carball.querylens.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

@Value
@Builder(toBuilder = true)
@Slf4j
public class QueryLensConfig {

    public static final String ALL_CONNECTIONS = "*";

    public static final List<String> DEFAULT_EXCLUDE_PATTERNS = List.of(
            "(?i)^SHOW FULL COLUMNS FROM",
            "(?i)^SHOW TABLES LIKE",
            "(?i)^select \\* from [`\"]?(flyway_schema_history|databasechangelog)",
            "(?i)information_schema",
            "(?i)^SELECT DATABASE\\(\\)"
    );

    public static final List<String> DEFAULT_BACKTRACE_EXCLUDES = List.of(
            "java.",
            "jdk.",
            "sun.",
            "org.junit.",
            "org.springframework.",
            "org.hibernate.",
            "com.zaxxer.hikari.",
            "net.ttddyy.dsproxy.",
            "org.carball.querylens."
    );

    @Builder.Default
    boolean enabled = true;

    @Builder.Default
    List<String> connections = List.of(ALL_CONNECTIONS);

    // Classification
    @Builder.Default
    double slowQueryThresholdMs = 100;

    @Builder.Default
    boolean analyzeSlowQueries = true;

    @Builder.Default
    boolean analyzeAllQueries = false;

    @Builder.Default
    boolean explainAnalyze = false;

    @Builder.Default
    boolean explainAnalyzeAllQueries = false;

    @Builder.Default
    boolean nPlusOneEnabled = true;

    @Builder.Default
    int nPlusOneThreshold = 3;

    @Builder.Default
    long nPlusOneTimeWindowMs = 100;

    @Builder.Default
    NPlusOneAlertMode nPlusOneAlertMode = NPlusOneAlertMode.EXACT_THRESHOLD;

    @Builder.Default
    int samplingPercent = 100;

    @Builder.Default
    List<String> excludePatterns = DEFAULT_EXCLUDE_PATTERNS;

    // Alerts
    @Builder.Default
    boolean alertsEnabled = false;

    @Builder.Default
    List<String> alertChannels = List.of("log");

    @Builder.Default
    boolean alertOnSlowQuery = true;

    @Builder.Default
    boolean alertOnNPlusOne = true;

    @Builder.Default
    int queryCountThreshold = 50;

    String webhookUrl;

    @Builder.Default
    long webhookTimeoutMs = 2000;

    @Builder.Default
    int webhookFieldLimit = 500;

    // Storage
    @Builder.Default
    Path storagePath = Paths.get("logs", "queries");

    @Builder.Default
    long maxFileSizeBytes = 50L * 1024 * 1024;

    @Builder.Default
    int retentionDays = 7;

    // Backtrace
    @Builder.Default
    boolean backtraceEnabled = true;

    @Builder.Default
    int backtraceLimit = 10;

    @Builder.Default
    List<String> backtraceExcludePrefixes = DEFAULT_BACKTRACE_EXCLUDES;

    // Metadata toggles
    @Builder.Default
    boolean collectUserId = true;

    @Builder.Default
    boolean collectTenantId = false;

    @Builder.Default
    boolean collectIp = true;

    @Builder.Default
    boolean collectUserAgent = false;

    @Builder.Default
    boolean collectMemoryUsage = true;

    // Response injection
    @Builder.Default
    boolean injectInResponse = false;

    @Builder.Default
    String responseKey = "_query_debug";

    @Builder.Default
    boolean includeFullQueriesInResponse = false;

    public static QueryLensConfig defaults() {
        return QueryLensConfig.builder().build();
    }

    /**
     * Rejects settings the engine cannot run with and logs warnings for suspicious ones.
     *
     * @throws IllegalArgumentException if a setting is unusable
     */
    public QueryLensConfig validate() {
        if (samplingPercent < 1 || samplingPercent > 100) {
            throw new IllegalArgumentException("Sampling percentage must be between 1 and 100, got " + samplingPercent);
        }
        if (nPlusOneThreshold < 1) {
            throw new IllegalArgumentException("N+1 threshold must be positive, got " + nPlusOneThreshold);
        }
        if (retentionDays < 0) {
            throw new IllegalArgumentException("Retention days must not be negative, got " + retentionDays);
        }
        if (maxFileSizeBytes <= 0) {
            throw new IllegalArgumentException("Maximum log file size must be positive, got " + maxFileSizeBytes);
        }
        for (String regex : excludePatterns) {
            try {
                Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid exclude pattern '" + regex + "': " + e.getDescription(), e);
            }
        }

        if (nPlusOneTimeWindowMs <= 0) {
            log.warn("N+1 time window ({} ms) leaves no room for repeated queries; N+1 detection will rarely fire",
                    nPlusOneTimeWindowMs);
        }
        if (slowQueryThresholdMs <= 0) {
            log.warn("Slow query threshold ({} ms) flags every query as slow", slowQueryThresholdMs);
        }
        boolean webhookChannel = alertChannels.stream()
                .anyMatch(channel -> channel.equalsIgnoreCase("webhook") || channel.equalsIgnoreCase("slack"));
        if (webhookChannel && (webhookUrl == null || webhookUrl.isBlank())) {
            log.warn("Alert channel 'webhook' is configured without a webhook URL; webhook alerts will be skipped");
        }
        if (connections.isEmpty()) {
            log.warn("No connections are tracked; no queries will be recorded");
        }

        log.debug("Using configuration - slow: {} ms, N+1: {} within {} ms, sampling: {}%",
                slowQueryThresholdMs, nPlusOneThreshold, nPlusOneTimeWindowMs, samplingPercent);
        return this;
    }

    public String getConfigurationSummary() {
        return String.format("Enabled: %s | Slow: %.0f ms | N+1: %d within %d ms | Sampling: %d%% | Alerts: %s %s | Storage: %s",
                enabled, slowQueryThresholdMs, nPlusOneThreshold, nPlusOneTimeWindowMs, samplingPercent,
                alertsEnabled ? "on" : "off", alertChannels, storagePath);
    }
}
