package org.carball.querylens.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Collectors;

@Slf4j
public class ConfigurationLoader {

    private final Map<String, String> environment;
    private final ObjectMapper yamlMapper;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    /**
     * Loads configuration using the hierarchy: env vars > YAML file > defaults
     */
    public QueryLensConfig load(Path configFile) {
        QueryLensConfig.QueryLensConfigBuilder builder = QueryLensConfig.builder();

        if (configFile != null) {
            QueryLensProperties properties = readProperties(configFile);
            if (properties != null) {
                properties.applyTo(builder);
            }
        }

        applyEnvironmentVariables(builder);

        QueryLensConfig config = builder.build().validate();
        log.info("Configuration loaded: {}", config.getConfigurationSummary());
        return config;
    }

    /**
     * Loads built-in defaults overlaid with environment variables.
     */
    public QueryLensConfig loadDefaults() {
        return load(null);
    }

    /**
     * Starts from a named profile, then overlays the YAML file (if any) and environment variables.
     */
    public QueryLensConfig loadProfile(String profileName, Path configFile) {
        QueryLensProfile profile = QueryLensProfile.fromName(profileName);
        QueryLensConfig.QueryLensConfigBuilder builder = profile.buildConfig().toBuilder();

        if (configFile != null) {
            QueryLensProperties properties = readProperties(configFile);
            if (properties != null) {
                properties.applyTo(builder);
            }
        }

        applyEnvironmentVariables(builder);

        QueryLensConfig config = builder.build().validate();
        log.info("Configuration loaded with profile '{}': {}", profile.getProfileName(), config.getConfigurationSummary());
        return config;
    }

    private QueryLensProperties readProperties(Path configFile) {
        if (!Files.exists(configFile)) {
            log.warn("Configuration file not found: {}, using defaults", configFile);
            return null;
        }

        try {
            QueryLensProperties properties = yamlMapper.readValue(configFile.toFile(), QueryLensProperties.class);
            log.debug("Read configuration file: {}", configFile);
            return properties;
        } catch (IOException e) {
            log.error("Failed to read configuration from {}: {}, using defaults", configFile, e.getMessage());
            return null;
        }
    }

    private void applyEnvironmentVariables(QueryLensConfig.QueryLensConfigBuilder builder) {
        if (environment.containsKey("QUERY_LENS_ENABLED")) {
            builder.enabled(Boolean.parseBoolean(environment.get("QUERY_LENS_ENABLED")));
        }
        if (environment.containsKey("QUERY_LENS_CONNECTIONS")) {
            builder.connections(splitList(environment.get("QUERY_LENS_CONNECTIONS")));
        }
        if (environment.containsKey("QUERY_LENS_STORAGE_PATH")) {
            builder.storagePath(Paths.get(environment.get("QUERY_LENS_STORAGE_PATH")));
        }
        if (environment.containsKey("QUERY_LENS_ALERTS")) {
            builder.alertsEnabled(Boolean.parseBoolean(environment.get("QUERY_LENS_ALERTS")));
        }
        if (environment.containsKey("QUERY_LENS_WEBHOOK_URL")) {
            builder.webhookUrl(environment.get("QUERY_LENS_WEBHOOK_URL"));
        }

        applyNumeric("QUERY_LENS_SLOW_THRESHOLD", value -> builder.slowQueryThresholdMs(Double.parseDouble(value)));
        applyNumeric("QUERY_LENS_N_PLUS_ONE_THRESHOLD", value -> builder.nPlusOneThreshold(Integer.parseInt(value)));
        applyNumeric("QUERY_LENS_N_PLUS_ONE_WINDOW", value -> builder.nPlusOneTimeWindowMs(Long.parseLong(value)));
        applyNumeric("QUERY_LENS_SAMPLING", value -> builder.samplingPercent(Integer.parseInt(value)));
        applyNumeric("QUERY_LENS_RETENTION_DAYS", value -> builder.retentionDays(Integer.parseInt(value)));
        applyNumeric("QUERY_LENS_MAX_FILE_SIZE_MB",
                value -> builder.maxFileSizeBytes(Long.parseLong(value) * 1024 * 1024));
    }

    private void applyNumeric(String variable, Consumer<String> setter) {
        String value = environment.get(variable);
        if (value == null) {
            return;
        }
        try {
            setter.accept(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", variable, value);
        }
    }

    private static List<String> splitList(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * Returns help text for the environment overrides.
     */
    public static String getEnvironmentHelp() {
        return """
            Environment Variables (override the configuration file):
              QUERY_LENS_ENABLED               true|false
              QUERY_LENS_CONNECTIONS           Comma-separated connection names, or *
              QUERY_LENS_SLOW_THRESHOLD        Slow query threshold in ms
              QUERY_LENS_N_PLUS_ONE_THRESHOLD  Repetitions that make an N+1 pattern
              QUERY_LENS_N_PLUS_ONE_WINDOW     N+1 time window in ms
              QUERY_LENS_SAMPLING              Percentage of queries tracked (1-100)
              QUERY_LENS_STORAGE_PATH          Directory of the query log files
              QUERY_LENS_RETENTION_DAYS        Days of logs kept by cleanup
              QUERY_LENS_MAX_FILE_SIZE_MB      Size that triggers log rotation
              QUERY_LENS_ALERTS                true|false
              QUERY_LENS_WEBHOOK_URL           Webhook endpoint for alerts
            """;
    }
}
